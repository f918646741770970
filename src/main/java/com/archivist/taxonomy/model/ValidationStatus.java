package com.archivist.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ValidationStatus {
    PENDING("Pending"),
    ACCEPTED("Accepted"),
    RECLASSIFIED("Reclassified"),
    SKIPPED("Skipped");

    private final String dbValue;

    ValidationStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static ValidationStatus fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown validation status: " + value));
    }
}
