package com.demo.network.model;

public enum OpportunityPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
