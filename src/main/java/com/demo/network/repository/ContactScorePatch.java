package com.demo.network.repository;

import com.demo.network.model.OpportunityFlag;

import java.time.Instant;
import java.util.Set;

/** The only mutation the core applies to a contact: its derived scores. */
public record ContactScorePatch(
        double priorityScore,
        double opportunityScore,
        double strategicValue,
        Set<OpportunityFlag> flags,
        Instant scoredAt
) {
}
