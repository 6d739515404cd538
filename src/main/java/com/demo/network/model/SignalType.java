package com.demo.network.model;

/**
 * Evidence signals in declaration order. The order breaks ties when choosing the
 * dominant signal, and each signal names the relationship type it implies.
 */
public enum SignalType {
    SAME_COMPANY(RelationshipType.COLLEAGUE),
    SAME_EMAIL_DOMAIN(RelationshipType.COLLEAGUE),
    SAME_LOCATION(RelationshipType.ACQUAINTANCE),
    ROLE_SIMILARITY(RelationshipType.ACQUAINTANCE),
    MUTUAL_CONNECTIONS(RelationshipType.ACQUAINTANCE);

    private final RelationshipType impliedType;

    SignalType(RelationshipType impliedType) {
        this.impliedType = impliedType;
    }

    public RelationshipType impliedType() {
        return impliedType;
    }
}
