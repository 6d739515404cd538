package com.demo.network.service.scoring;

import com.demo.network.exception.ValidationException;
import com.demo.network.model.OpportunityFlag;

import java.util.Set;

/** A 0-100 sub-score with the sentence that explains it. Only the opportunity factor emits flags. */
public record FactorScore(FactorKind kind, double score, String reasoning, Set<OpportunityFlag> flags) {

    public FactorScore {
        ValidationException.requirePercent(kind + " score", score);
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public static FactorScore of(FactorKind kind, double score, String reasoning) {
        return new FactorScore(kind, score, reasoning, Set.of());
    }
}
