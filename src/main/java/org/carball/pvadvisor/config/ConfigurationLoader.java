package org.carball.pvadvisor.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> env;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Loads gateway configuration using the hierarchy: CLI args > env vars > defaults
     */
    public GatewayConfig loadConfiguration(String[] args) {
        return build(GatewayConfig.builder(), args);
    }

    /**
     * Loads the YAML file first, then overlays environment variables and CLI arguments.
     */
    public GatewayConfig loadConfiguration(Path configFile, String[] args) throws IOException {
        GatewayConfig.GatewayConfigBuilder builder = GatewayConfig.builder();
        applyYamlFile(builder, configFile);
        return build(builder, args);
    }

    private GatewayConfig build(GatewayConfig.GatewayConfigBuilder builder, String[] args) {
        log.debug("Loading gateway configuration");

        // 1. Apply environment variables
        applyEnvironmentVariables(builder);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        GatewayConfig config = builder.build();
        config.validate();

        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    void applyYamlFile(GatewayConfig.GatewayConfigBuilder builder, Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IOException("Configuration file not found: " + configFile);
        }

        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        JsonNode root = yamlMapper.readTree(configFile.toFile());
        JsonNode gateway = root != null ? root.get("gateway") : null;
        if (gateway == null || !gateway.isObject()) {
            log.warn("No 'gateway' section in {}, using defaults", configFile);
            return;
        }

        if (gateway.has("enabled")) {
            builder.enabled(gateway.get("enabled").asBoolean(true));
        }
        if (gateway.hasNonNull("endpoint")) {
            builder.endpoint(gateway.get("endpoint").asText());
        }
        if (gateway.hasNonNull("provider")) {
            builder.provider(gateway.get("provider").asText());
        }
        if (gateway.hasNonNull("model")) {
            builder.model(gateway.get("model").asText());
        }
        if (gateway.hasNonNull("temperature")) {
            applyDouble("temperature", gateway.get("temperature").asText(), builder::temperature);
        }
        if (gateway.hasNonNull("max-tokens")) {
            applyInt("max-tokens", gateway.get("max-tokens").asText(), builder::maxTokens);
        }
        if (gateway.hasNonNull("timeout-seconds")) {
            applyInt("timeout-seconds", gateway.get("timeout-seconds").asText(), builder::timeoutSeconds);
        }
        if (gateway.hasNonNull("api-key")) {
            builder.apiKey(gateway.get("api-key").asText());
        }
        if (gateway.hasNonNull("openai-base-url")) {
            builder.openAiBaseUrl(gateway.get("openai-base-url").asText());
        }

        log.debug("Applied gateway settings from {}", configFile);
    }

    private void applyEnvironmentVariables(GatewayConfig.GatewayConfigBuilder builder) {
        if (env.containsKey("PV_ADVISOR_API_URL")) {
            builder.endpoint(env.get("PV_ADVISOR_API_URL"));
        }
        if (env.containsKey("PV_ADVISOR_PROVIDER")) {
            builder.provider(env.get("PV_ADVISOR_PROVIDER"));
        }
        if (env.containsKey("PV_ADVISOR_MODEL")) {
            builder.model(env.get("PV_ADVISOR_MODEL"));
        }
        if (env.containsKey("PV_ADVISOR_TEMPERATURE")) {
            applyDouble("PV_ADVISOR_TEMPERATURE", env.get("PV_ADVISOR_TEMPERATURE"), builder::temperature);
        }
        if (env.containsKey("PV_ADVISOR_MAX_TOKENS")) {
            applyInt("PV_ADVISOR_MAX_TOKENS", env.get("PV_ADVISOR_MAX_TOKENS"), builder::maxTokens);
        }
        if (env.containsKey("PV_ADVISOR_TIMEOUT_SECONDS")) {
            applyInt("PV_ADVISOR_TIMEOUT_SECONDS", env.get("PV_ADVISOR_TIMEOUT_SECONDS"), builder::timeoutSeconds);
        }
        if (env.containsKey("OPENAI_API_KEY")) {
            builder.apiKey(env.get("OPENAI_API_KEY"));
        }
    }

    private void applyCLIArguments(GatewayConfig.GatewayConfigBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--gateway.endpoint" -> builder.endpoint(value);
                case "--gateway.provider" -> builder.provider(value);
                case "--gateway.model" -> builder.model(value);
                case "--gateway.temperature" -> applyDouble(arg, value, builder::temperature);
                case "--gateway.max-tokens" -> applyInt(arg, value, builder::maxTokens);
                case "--gateway.timeout" -> applyInt(arg, value, builder::timeoutSeconds);
                case "--api-key" -> builder.apiKey(value);
                default -> {
                    // not a gateway option
                }
            }
        }
    }

    private void applyInt(String source, String value, IntConsumer setter) {
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    private void applyDouble(String source, String value, DoubleConsumer setter) {
        try {
            setter.accept(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for gateway configuration options.
     */
    public static String getGatewayHelp() {
        return """
            Gateway Configuration Options:

            CLI Arguments:
              --gateway.endpoint <url>       Base URL of the generation gateway
              --gateway.provider <name>      Provider name (ollama, openai, ...)
              --gateway.model <name>         Model identifier
              --gateway.temperature <num>    Sampling temperature
              --gateway.max-tokens <num>     Maximum tokens in the response
              --gateway.timeout <seconds>    Request timeout, 0 for none
              --api-key <key>                API key for the openai provider

            Environment Variables:
              PV_ADVISOR_API_URL             Same as --gateway.endpoint
              PV_ADVISOR_PROVIDER            Same as --gateway.provider
              PV_ADVISOR_MODEL               Same as --gateway.model
              PV_ADVISOR_TEMPERATURE         Same as --gateway.temperature
              PV_ADVISOR_MAX_TOKENS          Same as --gateway.max-tokens
              PV_ADVISOR_TIMEOUT_SECONDS     Same as --gateway.timeout
              OPENAI_API_KEY                 Same as --api-key

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML file given with --config
              4. Built-in defaults
            """;
    }
}
