package com.archivist.taxonomy.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ImportSession(
    UUID id,
    int totalDocuments,
    PipelineStatus pipelineStatus,
    OffsetDateTime pipelineStartedAt,
    OffsetDateTime pipelineStageStartedAt,
    OffsetDateTime pipelineCompletedAt,
    String pipelineError,
    Map<String, StageStats> pipelineStats,
    PipelineProgress pipelineProgress,
    List<String> pendingBatchHandles,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {}
