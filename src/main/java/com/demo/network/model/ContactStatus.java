package com.demo.network.model;

public enum ContactStatus {
    ACTIVE,
    INACTIVE,
    ARCHIVED
}
