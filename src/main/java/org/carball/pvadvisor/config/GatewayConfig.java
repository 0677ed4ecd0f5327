package org.carball.pvadvisor.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Settings for the external text-generation service.
 */
@Data
@Builder(toBuilder = true)
@Slf4j
public class GatewayConfig {

    public static final String PROVIDER_OPENAI = "openai";

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private String endpoint = "http://localhost:5500/api/v1";

    @Builder.Default
    private String provider = "ollama";

    @Builder.Default
    private String model = "airun-chat:latest";

    @Builder.Default
    private double temperature = 0.1;

    @Builder.Default
    private int maxTokens = 4000;

    private String apiKey;

    // Base URL override for the OpenAI provider; null uses the SDK default
    private String openAiBaseUrl;

    // 0 disables the client-side timeout
    @Builder.Default
    private int timeoutSeconds = 0;

    public static GatewayConfig defaults() {
        return GatewayConfig.builder().build();
    }

    public boolean isOpenAi() {
        return PROVIDER_OPENAI.equalsIgnoreCase(provider);
    }

    /**
     * Logs warnings for values that are likely to make the service reject or stall requests.
     */
    public void validate() {
        if (temperature < 0.0 || temperature > 2.0) {
            log.warn("Temperature ({}) is outside the usual range [0, 2]", temperature);
        }

        if (maxTokens <= 0) {
            log.warn("Max tokens ({}) should be positive", maxTokens);
        }

        if (timeoutSeconds < 0) {
            log.warn("Timeout ({}) should not be negative; treating as no timeout", timeoutSeconds);
        }

        if (isOpenAi() && (apiKey == null || apiKey.isBlank())) {
            log.warn("Provider 'openai' selected without an API key; AI analysis will fall back to rules");
        }

        log.debug("Using gateway - Endpoint: {}, Provider: {}, Model: {}, Timeout: {}s",
                endpoint, provider, model, timeoutSeconds);
    }

    public String getConfigurationSummary() {
        return String.format("Provider: %s | Model: %s | Endpoint: %s | Temperature: %.1f | Max tokens: %d | Timeout: %s",
                provider, model, endpoint, temperature, maxTokens,
                timeoutSeconds > 0 ? timeoutSeconds + "s" : "none");
    }
}
