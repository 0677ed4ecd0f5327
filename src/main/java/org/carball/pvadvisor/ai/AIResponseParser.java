package org.carball.pvadvisor.ai;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.model.recommendation.AIRecommendationResponse;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the JSON answer from free-form model output.
 *
 * <p>Tries, in order: the whole text, a fenced {@code ```json} block, then the span from
 * the first '{' to the last '}'.
 */
@Slf4j
public class AIResponseParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*([\\s\\S]*?)\\s*```");

    private final ObjectMapper objectMapper;

    public AIResponseParser() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }

    public AIResult parse(String text) {
        if (text == null || text.isBlank()) {
            return AIResult.failed("Empty AI response");
        }

        Optional<AIRecommendationResponse> parsed = tryParse(text.trim());

        if (parsed.isEmpty()) {
            Matcher fenced = FENCED_JSON.matcher(text);
            if (fenced.find()) {
                log.debug("Direct parse failed, trying fenced JSON block");
                parsed = tryParse(fenced.group(1));
            }
        }

        if (parsed.isEmpty()) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                log.debug("Trying brace span {}..{}", start, end);
                parsed = tryParse(text.substring(start, end + 1));
            }
        }

        return parsed
                .map(AIResult::parsed)
                .orElseGet(() -> AIResult.failed("No valid JSON found in AI response"));
    }

    private Optional<AIRecommendationResponse> tryParse(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            AIRecommendationResponse response = objectMapper.treeToValue(node, AIRecommendationResponse.class);
            warnOnMissingFields(node);
            return Optional.of(response);
        } catch (Exception e) {
            log.trace("JSON candidate rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void warnOnMissingFields(JsonNode node) {
        String[] expectedFields = {"recommendedFields", "insights", "title", "description", "pvSolarInsights"};
        for (String field : expectedFields) {
            if (!node.has(field)) {
                log.debug("AI response missing expected field '{}'", field);
            }
        }
    }
}
