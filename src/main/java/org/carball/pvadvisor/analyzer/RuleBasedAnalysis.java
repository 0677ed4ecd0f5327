package org.carball.pvadvisor.analyzer;

import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.recommendation.DomainInsights;
import org.carball.pvadvisor.narrative.DataFeature;
import org.carball.pvadvisor.narrative.InsightType;

import java.util.List;
import java.util.Set;

/**
 * Locale-neutral result of the rule-based path. Display text is rendered later
 * through {@link org.carball.pvadvisor.narrative.NarrativeTemplates}.
 */
public record RuleBasedAnalysis(
        DataCategory category,
        String sheetName,
        int recordCount,
        int columnCount,
        Set<DataFeature> features,
        boolean correlationSupported,
        List<InsightType> insights,
        List<String> recommendedFields,
        DomainInsights domainInsights
) {}
