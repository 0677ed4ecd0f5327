package org.carball.pvadvisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pvadvisor.ai.AIAnalysisGateway;
import org.carball.pvadvisor.ai.AIResult;
import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.analysis.PatternProfile;
import org.carball.pvadvisor.model.analysis.SheetSelection;
import org.carball.pvadvisor.model.recommendation.AIRecommendationResponse;
import org.carball.pvadvisor.model.recommendation.DomainInsights;
import org.carball.pvadvisor.model.recommendation.FilterSuggestion;
import org.carball.pvadvisor.model.recommendation.FilterType;
import org.carball.pvadvisor.model.recommendation.Recommendation;
import org.carball.pvadvisor.model.recommendation.RecommendationSource;
import org.carball.pvadvisor.model.sheet.SheetDescriptor;
import org.carball.pvadvisor.narrative.EnglishNarrativeTemplates;
import org.carball.pvadvisor.narrative.NarrativeTemplates;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the full pipeline for one request: sheet selection, pattern analysis, AI or
 * rule-based generation, field validation against real headers and filter derivation.
 *
 * <p>Never throws for data problems; the worst case is a generic but valid recommendation.
 */
@Slf4j
public class RecommendationAssembler {

    static final int MAX_FIELDS = 5;
    static final int MAX_INSIGHTS = 4;

    private final SheetSelector sheetSelector;
    private final PatternAnalyzer patternAnalyzer;
    private final AIAnalysisGateway gateway;
    private final RuleBasedGenerator ruleBasedGenerator;
    private final NarrativeTemplates templates;

    public RecommendationAssembler(AIAnalysisGateway gateway) {
        this(gateway, new EnglishNarrativeTemplates());
    }

    public RecommendationAssembler(AIAnalysisGateway gateway, NarrativeTemplates templates) {
        this.sheetSelector = new SheetSelector();
        this.patternAnalyzer = new PatternAnalyzer();
        this.ruleBasedGenerator = new RuleBasedGenerator();
        this.gateway = gateway;
        this.templates = templates;
    }

    public Recommendation recommend(List<SheetDescriptor> sheets) {
        Optional<SheetSelection> selection = sheetSelector.select(sheets);
        if (selection.isEmpty()) {
            log.info("No sheets to analyze, returning empty recommendation");
            return Recommendation.empty();
        }

        SheetSelection selected = selection.get();
        SheetDescriptor sheet = selected.sheet();
        PatternProfile profile = patternAnalyzer.analyze(sheet);

        int recordCount = profile.recordCount();
        int columnCount = sheet.resolvedColumnCount();

        Recommendation.RecommendationBuilder builder = Recommendation.builder()
                .selectedSheet(sheet.name())
                .confidence(selected.confidence())
                .category(DataCategory.classify(profile))
                .recordCount(recordCount)
                .columnCount(columnCount)
                .structure(templates.structure(recordCount, columnCount))
                .sheetScores(new ArrayList<>(selected.scores()));

        List<String> candidateFields;
        AIResult aiResult = callGateway(sheet, profile);

        if (aiResult.isSuccess()) {
            log.info("Using AI recommendation for sheet '{}'", sheet.name());
            candidateFields = applyAiResult(builder, aiResult.getResponse(), sheet, profile, columnCount);
        } else {
            log.info("Using rule-based recommendation for sheet '{}' ({})", sheet.name(), aiResult.getFailureReason());
            candidateFields = applyRuleBasedResult(builder, sheet, profile, columnCount);
        }

        List<String> fields = validateFields(candidateFields, sheet.headers());
        builder.recommendedFields(fields);
        builder.suggestedFilters(suggestFilters(fields));

        Recommendation recommendation = builder.build();
        log.info("Recommendation for '{}': {} fields, {} filters, source {}",
                recommendation.getSelectedSheet(), fields.size(),
                recommendation.getSuggestedFilters().size(), recommendation.getSource());
        return recommendation;
    }

    private AIResult callGateway(SheetDescriptor sheet, PatternProfile profile) {
        try {
            return gateway.analyze(sheet, profile);
        } catch (RuntimeException e) {
            log.warn("AI gateway raised an unexpected error for sheet '{}': {}", sheet.name(), e.getMessage());
            log.debug("Gateway error details", e);
            return AIResult.failed("Unexpected gateway error: " + e.getMessage());
        }
    }

    private List<String> applyAiResult(Recommendation.RecommendationBuilder builder,
                                       AIRecommendationResponse response,
                                       SheetDescriptor sheet,
                                       PatternProfile profile,
                                       int columnCount) {
        DataCategory category = DataCategory.classify(profile);

        builder.source(RecommendationSource.AI)
                .title(isBlank(response.getTitle()) ? templates.title(category, sheet.name()) : response.getTitle())
                .description(isBlank(response.getDescription())
                        ? templates.description(profile.recordCount(), columnCount,
                                ruleBasedGenerator.features(profile), profile.hasEnergyData() && profile.hasWeatherData())
                        : response.getDescription())
                .insights(response.getInsights() == null ? new ArrayList<>() : response.getInsights().stream()
                        .filter(Objects::nonNull)
                        .filter(insight -> !insight.isBlank())
                        .limit(MAX_INSIGHTS)
                        .toList())
                .domainInsights(response.getPvSolarInsights() != null
                        ? response.getPvSolarInsights().normalized()
                        : DomainInsights.empty());

        return response.getRecommendedFields() != null ? response.getRecommendedFields() : List.of();
    }

    private List<String> applyRuleBasedResult(Recommendation.RecommendationBuilder builder,
                                              SheetDescriptor sheet,
                                              PatternProfile profile,
                                              int columnCount) {
        RuleBasedAnalysis analysis = ruleBasedGenerator.generate(sheet.name(), sheet.headers(), profile, columnCount);

        builder.source(RecommendationSource.RULE_BASED)
                .title(templates.title(analysis.category(), analysis.sheetName()))
                .description(templates.description(analysis.recordCount(), analysis.columnCount(),
                        analysis.features(), analysis.correlationSupported()))
                .insights(analysis.insights().stream()
                        .map(templates::insight)
                        .limit(MAX_INSIGHTS)
                        .toList())
                .domainInsights(analysis.domainInsights());

        return analysis.recommendedFields();
    }

    /**
     * Keeps only names that match a header exactly; falls back to the first headers when none survive.
     */
    List<String> validateFields(List<String> candidates, List<String> headers) {
        Set<String> headerSet = new LinkedHashSet<>(headers);
        Set<String> valid = new LinkedHashSet<>();

        for (String candidate : candidates) {
            if (candidate != null && headerSet.contains(candidate)) {
                valid.add(candidate);
            }
        }

        if (valid.isEmpty()) {
            List<String> fallback = headers.subList(0, Math.min(MAX_FIELDS, headers.size()));
            if (!candidates.isEmpty()) {
                log.warn("Recommended fields {} do not match sheet headers, using first {} headers",
                        candidates, fallback.size());
            } else {
                log.warn("No recommended fields produced, using first {} headers", fallback.size());
            }
            return new ArrayList<>(fallback);
        }

        return valid.stream()
                .limit(MAX_FIELDS)
                .toList();
    }

    /**
     * At most one filter per group, checked in the order time, energy, weather.
     */
    List<FilterSuggestion> suggestFilters(List<String> fields) {
        List<FilterSuggestion> filters = new ArrayList<>();

        firstMatching(fields, KeywordFamily.TIME_FILTER).ifPresent(column ->
                filters.add(filter(FilterType.DATE_RANGE, column)));

        firstMatching(fields, KeywordFamily.ENERGY).ifPresent(column ->
                filters.add(filter(FilterType.NUMERIC_RANGE, column)));

        firstMatching(fields, KeywordFamily.WEATHER_FILTER).ifPresent(column ->
                filters.add(filter(FilterType.WEATHER_RANGE, column)));

        return filters;
    }

    private FilterSuggestion filter(FilterType type, String column) {
        return new FilterSuggestion(type, column, templates.filterDescription(type, column));
    }

    private Optional<String> firstMatching(List<String> fields, KeywordFamily family) {
        return fields.stream()
                .filter(family::matches)
                .findFirst();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
