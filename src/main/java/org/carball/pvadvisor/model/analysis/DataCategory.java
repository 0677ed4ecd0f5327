package org.carball.pvadvisor.model.analysis;

public enum DataCategory {
    GENERATION,
    PERFORMANCE,
    ENVIRONMENTAL,
    GENERIC;

    /**
     * Classifies a profile by priority: energy with time, then performance, then weather.
     */
    public static DataCategory classify(PatternProfile profile) {
        if (profile.hasEnergyData() && profile.hasTimeData()) {
            return GENERATION;
        } else if (profile.hasPerformanceData()) {
            return PERFORMANCE;
        } else if (profile.hasWeatherData()) {
            return ENVIRONMENTAL;
        }
        return GENERIC;
    }
}
