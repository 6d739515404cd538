package com.demo.network.service.scoring;

import com.demo.network.model.OpportunityFlag;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record ContactScores(
        String contactId,
        double priorityScore,
        double opportunityScore,
        double strategicValue,
        Set<OpportunityFlag> flags,
        List<FactorScore> factors,
        String weightsVersion,
        Instant scoredAt
) {

    public ContactScores {
        flags = flags == null ? Set.of() : Set.copyOf(flags);
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public double scoreOf(ScoreType type) {
        return switch (type) {
            case PRIORITY -> priorityScore;
            case OPPORTUNITY -> opportunityScore;
            case STRATEGIC -> strategicValue;
        };
    }
}
