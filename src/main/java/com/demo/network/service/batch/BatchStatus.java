package com.demo.network.service.batch;

public enum BatchStatus {
    COMPLETED,
    PARTIAL,
    REJECTED
}
