package org.carball.pvadvisor.narrative;

/**
 * Data families a sheet may contain, in the order they are listed in descriptions.
 */
public enum DataFeature {
    ENERGY,
    WEATHER,
    TIME,
    LOCATION,
    PERFORMANCE
}
