package org.carball.pvadvisor.model.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ColumnType {
    NUMERIC("numeric"),
    EMAIL("email"),
    DATE("date"),
    TEXT("text");

    private final String wireName;

    ColumnType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
