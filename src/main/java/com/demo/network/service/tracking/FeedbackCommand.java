package com.demo.network.service.tracking;

import com.demo.network.model.ActualOutcome;

/** What a user reports when closing an opportunity. */
public record FeedbackCommand(
        String opportunityId,
        String userId,
        int rating,
        ActualOutcome actualOutcome,
        double actualImpact,
        double timeInvestedHours,
        String freeText
) {
}
