package org.carball.pvadvisor.model.recommendation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterType {
    DATE_RANGE("date_range"),
    NUMERIC_RANGE("numeric_range"),
    WEATHER_RANGE("weather_range");

    private final String wireName;

    FilterType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
