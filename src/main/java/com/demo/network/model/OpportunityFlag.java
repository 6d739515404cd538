package com.demo.network.model;

public enum OpportunityFlag {
    RECENT_JOB_CHANGE,
    ROLE_EXPANSION_POTENTIAL,
    COMPANY_GROWTH,
    RECONNECTION_OPPORTUNITY,
    DECISION_MAKER,
    WARM_INTRO_AVAILABLE
}
