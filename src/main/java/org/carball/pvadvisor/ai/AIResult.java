package org.carball.pvadvisor.ai;

import lombok.Getter;
import org.carball.pvadvisor.model.recommendation.AIRecommendationResponse;

/**
 * Outcome of one gateway call: either a parsed response or a failure reason, never both.
 */
@Getter
public final class AIResult {

    private final AIRecommendationResponse response;
    private final String failureReason;

    private AIResult(AIRecommendationResponse response, String failureReason) {
        this.response = response;
        this.failureReason = failureReason;
    }

    public static AIResult parsed(AIRecommendationResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("Parsed result requires a response");
        }
        return new AIResult(response, null);
    }

    public static AIResult failed(String reason) {
        return new AIResult(null, reason != null ? reason : "unknown failure");
    }

    public boolean isSuccess() {
        return response != null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AIResult[parsed]" : "AIResult[failed: " + failureReason + "]";
    }
}
