package com.archivist.taxonomy.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum PipelineStage {
    TRIAGE(PipelineStatus.TRIAGING),
    DEDUPLICATION(PipelineStatus.DEDUPLICATING),
    EMBEDDING(PipelineStatus.EMBEDDING),
    REDUCTION(PipelineStatus.CLUSTERING),
    CLUSTERING(PipelineStatus.CLUSTERING),
    NAMING(PipelineStatus.NAMING);

    private final PipelineStatus status;

    PipelineStage(PipelineStatus status) {
        this.status = status;
    }

    public PipelineStatus status() {
        return status;
    }

    public List<PipelineStage> fromHere() {
        return Arrays.stream(values())
            .filter(stage -> stage.ordinal() >= ordinal())
            .toList();
    }

    public static PipelineStage parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stage must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
            .filter(stage -> stage.name().equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown stage '" + value + "', expected one of " + Arrays.toString(values())));
    }
}
