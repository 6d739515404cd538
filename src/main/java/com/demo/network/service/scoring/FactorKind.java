package com.demo.network.service.scoring;

/** The six sub-scores every contact score is built from. */
public enum FactorKind {
    NETWORK_POSITION,
    RELATIONSHIP_STRENGTH,
    PROFESSIONAL_RELEVANCE,
    MUTUAL_CONNECTIONS,
    ENGAGEMENT_PATTERNS,
    OPPORTUNITY_INDICATORS
}
