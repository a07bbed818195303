package com.medassist.exception;

import java.util.UUID;

public class RecommendationNotFoundException extends RuntimeException {

    public RecommendationNotFoundException(UUID recommendationId) {
        super("Recommendation not found: " + recommendationId);
    }
}
