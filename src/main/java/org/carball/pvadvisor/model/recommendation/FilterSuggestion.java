package org.carball.pvadvisor.model.recommendation;

public record FilterSuggestion(
        FilterType type,
        String column,
        String description
) {}
