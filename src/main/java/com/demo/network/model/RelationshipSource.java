package com.demo.network.model;

public enum RelationshipSource {
    MANUAL,
    AUTO_DISCOVERY,
    IMPORT
}
