package com.demo.network.controller.dto;

import com.demo.network.model.NotificationSettings;
import com.demo.network.model.OpportunityCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Set;

@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationSettingsRequest {
    public Set<OpportunityCategory> enabledCategories;
    public double minConfidence = 0.4;
    public double minImpact = 60;
    public boolean dailyDigest = true;
    public boolean realTimeAlerts = true;
    public boolean urgentOnly;

    public NotificationSettings toSettings(String userId, String accountId) {
        return NotificationSettings.builder()
                .userId(userId)
                .accountId(accountId)
                .enabledCategories(enabledCategories)
                .minConfidence(minConfidence)
                .minImpact(minImpact)
                .dailyDigest(dailyDigest)
                .realTimeAlerts(realTimeAlerts)
                .urgentOnly(urgentOnly)
                .build();
    }
}
