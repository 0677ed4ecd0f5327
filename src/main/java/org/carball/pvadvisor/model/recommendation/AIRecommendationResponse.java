package org.carball.pvadvisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON structure expected back from the text-generation service.
 * Binding is loose; completeness is enforced by the assembler.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AIRecommendationResponse {

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("insights")
    private List<String> insights;

    @JsonProperty("recommendedFields")
    private List<String> recommendedFields;

    @JsonProperty("pvSolarInsights")
    private DomainInsights pvSolarInsights;
}
