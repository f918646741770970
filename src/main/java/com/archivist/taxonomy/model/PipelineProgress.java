package com.archivist.taxonomy.model;

import java.time.OffsetDateTime;

public record PipelineProgress(
    String stage,
    int current,
    int total,
    String message,
    OffsetDateTime updatedAt
) {

    public static PipelineProgress of(String stage, int current, int total, String message) {
        return new PipelineProgress(stage, current, total, message, OffsetDateTime.now());
    }
}
