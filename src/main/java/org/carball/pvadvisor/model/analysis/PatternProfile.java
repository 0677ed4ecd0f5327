package org.carball.pvadvisor.model.analysis;

import java.util.Map;
import java.util.Set;

/**
 * Domain-pattern profile of a single sheet. Built once per analysis by
 * {@link org.carball.pvadvisor.analyzer.PatternAnalyzer}.
 *
 * <p>{@code columnTypes} is inferred from the first non-empty sample of each column only.
 */
public record PatternProfile(
        boolean hasEnergyData,
        boolean hasProductionData,
        boolean hasWeatherData,
        boolean hasTimeData,
        boolean hasLocationData,
        boolean hasPerformanceData,
        Set<String> energyUnits,
        Set<String> timeFormats,
        Map<String, ColumnType> columnTypes,
        int recordCount
) {

    public long numericColumnCount() {
        return columnTypes.values().stream()
                .filter(type -> type == ColumnType.NUMERIC)
                .count();
    }
}
