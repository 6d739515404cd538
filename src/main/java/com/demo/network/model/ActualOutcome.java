package com.demo.network.model;

public enum ActualOutcome {
    SUCCESS,
    PARTIAL_SUCCESS,
    NO_RESULT,
    NEGATIVE
}
