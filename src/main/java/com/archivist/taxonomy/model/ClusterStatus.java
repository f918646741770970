package com.archivist.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ClusterStatus {
    PENDING("Pending"),
    APPROVED("Approved"),
    REJECTED("Rejected"),
    DELETED("Deleted");

    private final String dbValue;

    ClusterStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static ClusterStatus fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown cluster status: " + value));
    }
}
