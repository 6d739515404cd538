package com.demo.network.model;

import lombok.Builder;

import java.util.EnumSet;
import java.util.Set;

/** Per-user delivery preferences. An empty category set means every category. */
@Builder(toBuilder = true)
public record NotificationSettings(
        String userId,
        String accountId,
        Set<OpportunityCategory> enabledCategories,
        double minConfidence,
        double minImpact,
        boolean dailyDigest,
        boolean realTimeAlerts,
        boolean urgentOnly
) {

    public NotificationSettings {
        enabledCategories = enabledCategories == null ? Set.of() : Set.copyOf(enabledCategories);
    }

    public static NotificationSettings defaults(String userId, String accountId) {
        return NotificationSettings.builder()
                .userId(userId)
                .accountId(accountId)
                .enabledCategories(EnumSet.of(
                        OpportunityCategory.INTRODUCTION,
                        OpportunityCategory.RECONNECTION,
                        OpportunityCategory.BUSINESS_MATCH,
                        OpportunityCategory.STRATEGIC_MOVE))
                .minConfidence(0.4)
                .minImpact(60)
                .dailyDigest(true)
                .realTimeAlerts(true)
                .urgentOnly(false)
                .build();
    }

    public boolean accepts(OpportunityCategory category) {
        return enabledCategories.isEmpty() || enabledCategories.contains(category);
    }
}
