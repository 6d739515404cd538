package com.demo.network.service.scoring;

/** One of the six sub-score calculators. Implementations are pure and deterministic. */
public interface ScoringFactor {

    FactorKind kind();

    FactorScore compute(ScoringContext context);
}
