package com.archivist.taxonomy.batch;

import java.util.Optional;
import java.util.UUID;

public record CustomId(String entityType, UUID entityId) {

    public static final int MAX_LENGTH = 64;

    public static final String TRIAGE = "triage";
    public static final String CLUSTER = "cluster";

    public static String format(String entityType, UUID entityId) {
        return entityType + ":" + entityId;
    }

    public static Optional<CustomId> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            return Optional.empty();
        }
        try {
            return Optional.of(new CustomId(value.substring(0, separator), UUID.fromString(value.substring(separator + 1))));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public boolean is(String type) {
        return entityType.equals(type);
    }

    @Override
    public String toString() {
        return format(entityType, entityId);
    }
}
