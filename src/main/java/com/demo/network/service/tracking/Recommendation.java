package com.demo.network.service.tracking;

/**
 * One advisory. Threshold advice carries the current and suggested values so an operator
 * can apply it as configuration; the others leave them null.
 */
public record Recommendation(
        RecommendationKind kind,
        String subject,
        String message,
        Double currentValue,
        Double suggestedValue
) {

    public static Recommendation advisory(RecommendationKind kind, String subject, String message) {
        return new Recommendation(kind, subject, message, null, null);
    }
}
