package com.demo.network.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record Notification(
        String id,
        NotificationType type,
        String title,
        String message,
        OpportunityPriority priority,
        List<String> opportunityIds,
        String userId,
        String accountId,
        Instant createdAt,
        Map<String, Object> metadata
) {

    public Notification {
        opportunityIds = opportunityIds == null ? List.of() : List.copyOf(opportunityIds);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
