package com.archivist.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

// Database labels are the PascalCase values of the pipeline_status enum type.
public enum PipelineStatus {
    NOT_STARTED("NotStarted"),
    EXTRACTING("Extracting"),
    TRIAGING("Triaging"),
    DEDUPLICATING("Deduplicating"),
    EMBEDDING("Embedding"),
    CLUSTERING("Clustering"),
    RE_CLUSTERING("ReClustering"),
    NAMING("Naming"),
    READY_FOR_VALIDATION("ReadyForValidation"),
    COMPLETED("Completed"),
    FAILED("Failed");

    public static final Set<PipelineStatus> RUNNABLE =
        Collections.unmodifiableSet(EnumSet.of(NOT_STARTED, FAILED));

    public static final Set<PipelineStatus> RESETTABLE =
        Collections.unmodifiableSet(EnumSet.of(FAILED, COMPLETED, READY_FOR_VALIDATION));

    public static final Set<PipelineStatus> RESUMABLE =
        Collections.unmodifiableSet(EnumSet.of(NOT_STARTED, FAILED, READY_FOR_VALIDATION, COMPLETED));

    public static final Set<PipelineStatus> IN_PROGRESS =
        Collections.unmodifiableSet(EnumSet.of(TRIAGING, DEDUPLICATING, EMBEDDING, CLUSTERING, RE_CLUSTERING, NAMING));

    private final String dbValue;

    PipelineStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String dbValue() {
        return dbValue;
    }

    public boolean isInProgress() {
        return IN_PROGRESS.contains(this) || this == EXTRACTING;
    }

    public boolean isTerminal() {
        return this == READY_FOR_VALIDATION || this == COMPLETED || this == FAILED;
    }

    public static PipelineStatus fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown pipeline status: " + value));
    }
}
