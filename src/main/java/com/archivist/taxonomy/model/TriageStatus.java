package com.archivist.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum TriageStatus {
    FIRM_DRAFTED("FirmDrafted"),
    THIRD_PARTY("ThirdParty"),
    IRRELEVANT("Irrelevant"),
    COURT_DOC("CourtDoc"),
    UNCERTAIN("Uncertain");

    private final String dbValue;

    TriageStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public static TriageStatus fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown triage status: " + value));
    }

    // Accepts "FirmDrafted", "firm_drafted", "FIRM DRAFTED" and so on.
    public static Optional<TriageStatus> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String key = squash(label);
        return Arrays.stream(values())
            .filter(status -> squash(status.dbValue).equals(key))
            .findFirst();
    }

    private static String squash(String value) {
        return value.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
    }
}
