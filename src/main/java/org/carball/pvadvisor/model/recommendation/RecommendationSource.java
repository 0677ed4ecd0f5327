package org.carball.pvadvisor.model.recommendation;

public enum RecommendationSource {
    AI,
    RULE_BASED,
    NONE
}
