package org.carball.pvadvisor.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.config.GatewayConfig;

import java.time.Duration;

/**
 * Sends prompts straight to an OpenAI-compatible chat completion API.
 */
@Slf4j
public class OpenAiGenerationClient implements GenerationClient {

    private final GatewayConfig config;
    private OpenAIClient openAiClient;

    public OpenAiGenerationClient(GatewayConfig config) {
        this.config = config;
    }

    @Override
    public String complete(String prompt) throws GenerationException {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(config.getModel())
                .addUserMessage(prompt)
                .temperature(config.getTemperature())
                .maxCompletionTokens(config.getMaxTokens())
                .build();

        log.debug("Request model: {}", config.getModel());

        ChatCompletion completion;
        try {
            completion = client().chat().completions().create(params);
        } catch (RuntimeException e) {
            throw new GenerationException("OpenAI call failed: " + e.getMessage(), e);
        }

        if (completion.choices().isEmpty()) {
            throw new GenerationException("OpenAI returned no choices");
        }

        String content = completion.choices().get(0).message().content().orElse("");
        if (content.isBlank()) {
            throw new GenerationException("OpenAI returned empty content");
        }
        return content;
    }

    private synchronized OpenAIClient client() throws GenerationException {
        if (openAiClient == null) {
            if (config.getApiKey() == null || config.getApiKey().isBlank()) {
                throw new GenerationException("OpenAI API key not configured");
            }

            OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                    .apiKey(config.getApiKey())
                    .maxRetries(0);

            if (config.getOpenAiBaseUrl() != null && !config.getOpenAiBaseUrl().isBlank()) {
                builder.baseUrl(config.getOpenAiBaseUrl());
            }
            if (config.getTimeoutSeconds() > 0) {
                builder.timeout(Duration.ofSeconds(config.getTimeoutSeconds()));
            }

            openAiClient = builder.build();
        }
        return openAiClient;
    }
}
