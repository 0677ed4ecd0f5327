package org.carball.pvadvisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.carball.pvadvisor.model.analysis.DataCategory;
import org.carball.pvadvisor.model.analysis.SheetScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Final output of the recommendation pipeline. Always fully formed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Recommendation {

    @Builder.Default
    private String selectedSheet = "";

    private double confidence;

    @Builder.Default
    private List<String> recommendedFields = new ArrayList<>();

    @Builder.Default
    private String title = "";

    @Builder.Default
    private String description = "";

    @Builder.Default
    private DataCategory category = DataCategory.GENERIC;

    @Builder.Default
    private List<String> insights = new ArrayList<>();

    @Builder.Default
    private DomainInsights domainInsights = DomainInsights.empty();

    @Builder.Default
    private List<FilterSuggestion> suggestedFilters = new ArrayList<>();

    @Builder.Default
    private RecommendationSource source = RecommendationSource.NONE;

    @Builder.Default
    private String structure = "";

    private int recordCount;

    private int columnCount;

    @Builder.Default
    private List<SheetScore> sheetScores = new ArrayList<>();

    /**
     * Returned when no sheet was supplied: no recommendation is available.
     */
    public static Recommendation empty() {
        return Recommendation.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return selectedSheet.isEmpty();
    }
}
