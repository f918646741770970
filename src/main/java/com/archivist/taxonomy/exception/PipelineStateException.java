package com.archivist.taxonomy.exception;

import com.archivist.taxonomy.model.PipelineStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class PipelineStateException extends RuntimeException {
    private final UUID sessionId;
    private final PipelineStatus currentStatus;

    public PipelineStateException(UUID sessionId, PipelineStatus currentStatus, String operation) {
        super("Cannot " + operation + " session " + sessionId + " while pipeline status is "
            + (currentStatus == null ? "unknown" : currentStatus.dbValue()));
        this.sessionId = sessionId;
        this.currentStatus = currentStatus;
    }
}
