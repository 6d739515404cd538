package com.demo.network.model;

/** Feedback values copied onto a closed opportunity for metric queries. */
public record OutcomeMetadata(ActualOutcome actualOutcome, int rating, double actualImpact, boolean success) {
}
