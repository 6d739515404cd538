package com.demo.network.model;

import lombok.Builder;

import java.time.Instant;

/** User-reported result of acting on an opportunity. Written once per opportunity. */
@Builder(toBuilder = true)
public record OpportunityFeedback(
        String opportunityId,
        String userId,
        int rating,
        ActualOutcome actualOutcome,
        double actualImpact,
        double timeInvestedHours,
        String freeText,
        boolean success,
        Instant createdAt
) {
}
