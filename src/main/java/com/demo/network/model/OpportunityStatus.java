package com.demo.network.model;

import java.util.EnumSet;
import java.util.Set;

public enum OpportunityStatus {
    PENDING,
    VIEWED,
    ACCEPTED,
    IN_PROGRESS,
    COMPLETED,
    REJECTED,
    EXPIRED;

    public static final Set<OpportunityStatus> TERMINAL = EnumSet.of(COMPLETED, REJECTED, EXPIRED);
    public static final Set<OpportunityStatus> ACCEPTED_OR_LATER = EnumSet.of(ACCEPTED, IN_PROGRESS, COMPLETED);
    public static final Set<OpportunityStatus> VIEWED_OR_LATER = EnumSet.of(VIEWED, ACCEPTED, IN_PROGRESS, COMPLETED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /** Still waiting for the user's first decision; these are what expiry sweeps and feeds look at. */
    public boolean isOpen() {
        return this == PENDING || this == VIEWED;
    }
}
