package com.demo.network.service.tracking;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome statistics over suggestions created in the last {@code windowDays}. Rates are
 * percentages (0-100); the two accuracies are fractions (0-1). EXPIRED suggestions count in
 * {@code totalSuggestions} but not in {@code consideredSuggestions}, the denominator of every rate.
 */
public record SuccessMetrics(
        String accountId,
        int windowDays,
        int totalSuggestions,
        int consideredSuggestions,
        double acceptanceRate,
        double completionRate,
        double viewRate,
        double averageTimeToActionDays,
        double medianTimeToActionDays,
        double averageTimeToCompletionDays,
        double medianTimeToCompletionDays,
        Map<String, Double> successRateByCategory,
        Map<String, Double> successRateByType,
        Map<String, Double> successRateByPriority,
        int closedWithOutcome,
        double confidenceAccuracy,
        double impactAccuracy,
        double userEngagementScore,
        int actedCount,
        int acceptedCount,
        Instant computedAt
) {

    public SuccessMetrics {
        successRateByCategory = successRateByCategory == null ? Map.of() : Map.copyOf(successRateByCategory);
        successRateByType = successRateByType == null ? Map.of() : Map.copyOf(successRateByType);
        successRateByPriority = successRateByPriority == null ? Map.of() : Map.copyOf(successRateByPriority);
    }
}
