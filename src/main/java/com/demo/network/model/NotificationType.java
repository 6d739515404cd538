package com.demo.network.model;

public enum NotificationType {
    NEW_OPPORTUNITY,
    URGENT_OPPORTUNITY,
    OPPORTUNITY_EXPIRING,
    DAILY_DIGEST
}
