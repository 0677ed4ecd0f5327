package org.carball.pvadvisor.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.carball.pvadvisor.config.GatewayConfig;

import java.io.IOException;
import java.time.Duration;

/**
 * Posts prompts to the generic {@code /callai} endpoint of the analytics back end.
 */
@Slf4j
public class CallAiGenerationClient implements GenerationClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final GatewayConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CallAiGenerationClient(GatewayConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper();

        Duration timeout = config.getTimeoutSeconds() > 0
                ? Duration.ofSeconds(config.getTimeoutSeconds())
                : Duration.ZERO;

        // Zero means no timeout in OkHttp
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .retryOnConnectionFailure(false)
                .build();
    }

    @Override
    public String complete(String prompt) throws GenerationException {
        String url = stripTrailingSlash(config.getEndpoint()) + "/callai";

        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(buildRequestBody(prompt), JSON))
                .build();

        log.debug("Request model: {} via {} at {}", config.getModel(), config.getProvider(), url);

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new GenerationException("AI API call failed: " + response.code() + " " + response.message());
            }

            ResponseBody body = response.body();
            String payload = body != null ? body.string() : "";
            log.trace("Received envelope: {} characters", payload.length());

            return extractContent(payload);
        } catch (IOException e) {
            throw new GenerationException("AI API call failed: " + e.getMessage(), e);
        }
    }

    String buildRequestBody(String prompt) throws GenerationException {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode message = root.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);

        ObjectNode options = root.putObject("options");
        options.put("provider", config.getProvider());
        options.put("model", config.getModel());
        options.put("temperature", config.getTemperature());
        options.put("max_tokens", config.getMaxTokens());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (IOException e) {
            throw new GenerationException("Unable to serialize AI request", e);
        }
    }

    /**
     * Unwraps {@code {success:true, data:{response:{content:text} | text}}}.
     */
    String extractContent(String payload) throws GenerationException {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new GenerationException("AI API returned a non-JSON envelope", e);
        }

        if (root == null || !root.path("success").asBoolean(false)) {
            throw new GenerationException("AI API reported failure");
        }

        JsonNode response = root.path("data").path("response");
        if (response.isTextual()) {
            return response.asText();
        }

        JsonNode content = response.path("content");
        if (content.isTextual()) {
            return content.asText();
        }

        throw new GenerationException("AI API envelope carries no text response");
    }

    private static String stripTrailingSlash(String endpoint) {
        if (endpoint == null) {
            return "";
        }
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
