package com.demo.network.model;

/** Manual priority bucket assigned by the user, distinct from the computed priority score. */
public enum ContactTier {
    TIER_1,
    TIER_2,
    TIER_3;

    public boolean isHighTier() {
        return this == TIER_1 || this == TIER_2;
    }
}
