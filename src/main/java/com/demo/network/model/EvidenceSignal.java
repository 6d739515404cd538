package com.demo.network.model;

import com.demo.network.exception.ValidationException;

/** One similarity measurement between two contacts; {@code detail} is shown verbatim in the UI. */
public record EvidenceSignal(SignalType type, double score, String detail) {

    public EvidenceSignal {
        ValidationException.requireUnit("evidence score", score);
    }
}
