package com.demo.network.model;

public enum OpportunityType {
    WARM_INTRODUCTION,
    DORMANT_RECONNECTION,
    ACCOUNT_EXPANSION,
    CLIENT_PROSPECT,
    PARTNERSHIP,
    KNOWLEDGE_EXCHANGE
}
