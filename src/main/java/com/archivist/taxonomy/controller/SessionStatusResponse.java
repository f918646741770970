package com.archivist.taxonomy.controller;

import com.archivist.taxonomy.model.ImportSession;
import com.archivist.taxonomy.model.PipelineProgress;
import com.archivist.taxonomy.model.PipelineStatus;
import com.archivist.taxonomy.model.StageStats;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record SessionStatusResponse(
    @JsonProperty("session_id") UUID sessionId,
    @JsonProperty("pipeline_status") PipelineStatus pipelineStatus,
    @JsonProperty("total_documents") int totalDocuments,
    @JsonProperty("started_at") OffsetDateTime startedAt,
    @JsonProperty("stage_started_at") OffsetDateTime stageStartedAt,
    @JsonProperty("completed_at") OffsetDateTime completedAt,
    String error,
    Map<String, StageStats> stats,
    PipelineProgress progress,
    @JsonProperty("pending_batch_handles") List<String> pendingBatchHandles
) {
    public static SessionStatusResponse from(ImportSession session) {
        return new SessionStatusResponse(
            session.id(),
            session.pipelineStatus(),
            session.totalDocuments(),
            session.pipelineStartedAt(),
            session.pipelineStageStartedAt(),
            session.pipelineCompletedAt(),
            session.pipelineError(),
            session.pipelineStats(),
            session.pipelineProgress(),
            session.pendingBatchHandles()
        );
    }
}
