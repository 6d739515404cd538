package com.demo.network.model;

public enum CandidateStatus {
    PENDING,
    APPROVED,
    REJECTED
}
