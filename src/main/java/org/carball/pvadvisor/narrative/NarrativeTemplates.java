package org.carball.pvadvisor.narrative;

import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.recommendation.FilterType;

import java.util.Locale;
import java.util.Set;

/**
 * Renders the structured output of the engine as display text in one language.
 */
public interface NarrativeTemplates {

    String title(DataCategory category, String sheetName);

    String description(int recordCount, int columnCount, Set<DataFeature> features, boolean correlationSupported);

    String insight(InsightType insight);

    String structure(int recordCount, int columnCount);

    String filterDescription(FilterType type, String column);

    /**
     * Resolves templates for a language tag; unknown tags fall back to English.
     */
    static NarrativeTemplates forLanguage(String languageTag) {
        if (languageTag != null && languageTag.trim().toLowerCase(Locale.ROOT).startsWith("ko")) {
            return new KoreanNarrativeTemplates();
        }
        return new EnglishNarrativeTemplates();
    }
}
