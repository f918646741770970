package com.archivist.taxonomy.pipeline;

import com.archivist.taxonomy.model.PipelineStage;
import com.archivist.taxonomy.model.PipelineStatus;
import com.archivist.taxonomy.model.StageStats;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record PipelineRunResult(
    UUID sessionId,
    PipelineStatus status,
    List<PipelineStage> completedStages,
    Map<String, StageStats> stats,
    String error
) {

    public boolean succeeded() {
        return status == PipelineStatus.READY_FOR_VALIDATION;
    }
}
