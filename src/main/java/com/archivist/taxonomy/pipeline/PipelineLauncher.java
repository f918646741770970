package com.archivist.taxonomy.pipeline;

import com.archivist.taxonomy.model.PipelineStage;
import com.archivist.taxonomy.model.StatusTransition;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Slf4j
@Component
public class PipelineLauncher {

    private final PipelineOrchestrator orchestrator;
    private final SessionRepository sessionRepository;
    private final AsyncTaskExecutor executor;

    public PipelineLauncher(PipelineOrchestrator orchestrator,
                            SessionRepository sessionRepository,
                            @Qualifier("pipelineTaskExecutor") AsyncTaskExecutor executor) {
        this.orchestrator = orchestrator;
        this.sessionRepository = sessionRepository;
        this.executor = executor;
    }

    public void launch(UUID sessionId) {
        orchestrator.claimRun(sessionId);
        schedule(sessionId, PipelineStage.TRIAGE);
    }

    public void launchFrom(UUID sessionId, PipelineStage stage, boolean force) {
        orchestrator.claimResume(sessionId, stage, force);
        schedule(sessionId, stage);
    }

    private void schedule(UUID sessionId, PipelineStage stage) {
        try {
            executor.execute(() -> {
                PipelineRunResult result = orchestrator.executeFrom(sessionId, stage);
                log.info("Background run of session {} ended with status {}", sessionId,
                    result.status() == null ? "unknown" : result.status().dbValue());
            });
        } catch (TaskRejectedException e) {
            log.error("Could not schedule pipeline run for session {}", sessionId, e);
            sessionRepository.updateSessionStatus(sessionId,
                StatusTransition.fail(stage.status(), "Pipeline run could not be scheduled: " + e.getMessage()));
            throw e;
        }
    }
}
