package org.carball.pvadvisor.ai;

import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.config.GatewayConfig;
import org.carball.pvadvisor.model.analysis.PatternProfile;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;

/**
 * Asks the external text-generation service for a structured recommendation.
 *
 * <p>One request per call, no retries. Any transport or parsing problem yields
 * {@link AIResult#failed(String)}; partial data is never returned.
 */
@Slf4j
public class AIAnalysisGateway {

    private final GatewayConfig config;
    private final GenerationClient client;
    private final AnalysisPromptBuilder promptBuilder;
    private final AIResponseParser responseParser;

    public AIAnalysisGateway(GatewayConfig config) {
        this(config, GenerationClients.create(config));
    }

    public AIAnalysisGateway(GatewayConfig config, GenerationClient client) {
        this.config = config;
        this.client = client;
        this.promptBuilder = new AnalysisPromptBuilder();
        this.responseParser = new AIResponseParser();
    }

    public AIResult analyze(SheetDescriptor sheet, PatternProfile profile) {
        if ("true".equals(System.getProperty("skip.ai")) || !config.isEnabled()) {
            log.info("Skipping AI analysis (disabled), using rule-based generation");
            return AIResult.failed("AI analysis disabled");
        }

        String prompt = promptBuilder.build(sheet, profile);
        log.trace("Sending prompt for sheet '{}':\n{}", sheet.name(), prompt);

        String text;
        try {
            text = client.complete(prompt);
        } catch (GenerationException e) {
            log.warn("AI analysis failed for sheet '{}': {}", sheet.name(), e.getMessage());
            return AIResult.failed(e.getMessage());
        }

        log.trace("Received response: {} characters\n{}", text != null ? text.length() : 0, text);

        AIResult result = responseParser.parse(text);
        if (!result.isSuccess()) {
            log.warn("AI response for sheet '{}' was unusable: {}", sheet.name(), result.getFailureReason());
        }
        return result;
    }
}
