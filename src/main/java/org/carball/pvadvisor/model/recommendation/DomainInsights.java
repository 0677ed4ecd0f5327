package org.carball.pvadvisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * PV-specific observations attached to a recommendation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DomainInsights {

    @JsonProperty("peakProductionTimes")
    @Builder.Default
    private List<String> peakProductionTimes = new ArrayList<>();

    @JsonProperty("weatherFactors")
    @Builder.Default
    private List<String> weatherFactors = new ArrayList<>();

    @JsonProperty("maintenancePatterns")
    @Builder.Default
    private List<String> maintenancePatterns = new ArrayList<>();

    @JsonProperty("performanceMetrics")
    @Builder.Default
    private List<String> performanceMetrics = new ArrayList<>();

    public static DomainInsights empty() {
        return DomainInsights.builder().build();
    }

    /**
     * Replaces null lists (possible after JSON binding) with empty ones.
     */
    public DomainInsights normalized() {
        return DomainInsights.builder()
                .peakProductionTimes(peakProductionTimes != null ? new ArrayList<>(peakProductionTimes) : new ArrayList<>())
                .weatherFactors(weatherFactors != null ? new ArrayList<>(weatherFactors) : new ArrayList<>())
                .maintenancePatterns(maintenancePatterns != null ? new ArrayList<>(maintenancePatterns) : new ArrayList<>())
                .performanceMetrics(performanceMetrics != null ? new ArrayList<>(performanceMetrics) : new ArrayList<>())
                .build();
    }
}
