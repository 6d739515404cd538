package com.demo.network.service.scoring;

public enum ScoreType {
    PRIORITY,
    OPPORTUNITY,
    STRATEGIC
}
