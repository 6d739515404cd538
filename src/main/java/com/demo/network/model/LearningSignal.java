package com.demo.network.model;

/** Prediction-versus-outcome record produced for every piece of feedback. */
public record LearningSignal(
        OpportunityCategory category,
        OpportunityType type,
        double predictedConfidence,
        double predictedImpact,
        ActualOutcome actualOutcome,
        double actualImpact,
        int rating,
        boolean success
) {
}
