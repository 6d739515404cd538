package com.demo.network.model;

public enum OpportunityCategory {
    INTRODUCTION,
    RECONNECTION,
    BUSINESS_MATCH,
    STRATEGIC_MOVE,
    NETWORK_EXPANSION
}
