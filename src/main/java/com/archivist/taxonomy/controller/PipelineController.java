package com.archivist.taxonomy.controller;

import com.archivist.taxonomy.model.PipelineStage;
import com.archivist.taxonomy.model.ReclusterStats;
import com.archivist.taxonomy.pipeline.PipelineLauncher;
import com.archivist.taxonomy.pipeline.PipelineOrchestrator;
import com.archivist.taxonomy.service.BatchRecoveryService;
import com.archivist.taxonomy.service.BatchRecoveryService.RecoveryReport;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineLauncher pipelineLauncher;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final BatchRecoveryService batchRecoveryService;

    @PostMapping("/sessions/{sessionId}/pipeline/run")
    public ResponseEntity<SessionStatusResponse> run(@PathVariable UUID sessionId) {
        pipelineLauncher.launch(sessionId);
        return accepted(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/pipeline/resume")
    public ResponseEntity<SessionStatusResponse> resume(
        @PathVariable UUID sessionId,
        @Valid @RequestBody ResumeRequest request) {

        PipelineStage stage = PipelineStage.parse(request.stage());
        pipelineLauncher.launchFrom(sessionId, stage, request.force());
        return accepted(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/pipeline/reset")
    public ResponseEntity<SessionStatusResponse> reset(@PathVariable UUID sessionId) {
        pipelineOrchestrator.reset(sessionId);
        return ResponseEntity.ok(SessionStatusResponse.from(pipelineOrchestrator.getStatus(sessionId)));
    }

    @PostMapping("/sessions/{sessionId}/pipeline/recluster")
    public ResponseEntity<ReclusterStats> recluster(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(pipelineOrchestrator.recluster(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/pipeline")
    public ResponseEntity<SessionStatusResponse> getStatus(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(SessionStatusResponse.from(pipelineOrchestrator.getStatus(sessionId)));
    }

    @PostMapping("/sessions/{sessionId}/batches/recover")
    public ResponseEntity<List<RecoveryReport>> recoverSession(@PathVariable UUID sessionId) {
        return ResponseEntity.ok(batchRecoveryService.recoverSession(sessionId));
    }

    @PostMapping("/batches/recover")
    public ResponseEntity<List<RecoveryReport>> recover(@Valid @RequestBody RecoverRequest request) {
        return ResponseEntity.ok(batchRecoveryService.recover(request.handles()));
    }

    private ResponseEntity<SessionStatusResponse> accepted(UUID sessionId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(SessionStatusResponse.from(pipelineOrchestrator.getStatus(sessionId)));
    }
}
