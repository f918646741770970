package com.archivist.taxonomy.service;

import com.archivist.taxonomy.batch.BatchService;
import com.archivist.taxonomy.batch.BatchState;
import com.archivist.taxonomy.batch.BatchStatus;
import com.archivist.taxonomy.exception.BatchServiceException;
import com.archivist.taxonomy.exception.SessionNotFoundException;
import com.archivist.taxonomy.model.ImportSession;
import com.archivist.taxonomy.model.StageStats;
import com.archivist.taxonomy.model.TriageStats;
import com.archivist.taxonomy.repository.DocumentRepository;
import com.archivist.taxonomy.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Merges the results of triage batches whose pipeline run is gone. Checks each batch
 * once without waiting and only fills documents that are still untriaged, so it can be
 * run any number of times.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchRecoveryService {

    private final BatchService batchService;
    private final TriageResultWriter resultWriter;
    private final DocumentRepository documentRepository;
    private final SessionRepository sessionRepository;

    public enum RecoveryState {
        MERGED,
        NOT_READY,
        FAILED
    }

    public record RecoveryReport(
        String handle,
        RecoveryState state,
        int written,
        int skipped,
        int errored,
        String message
    ) {}

    public List<RecoveryReport> recover(List<String> handles) {
        List<RecoveryReport> reports = new ArrayList<>();
        for (String handle : handles) {
            if (handle == null || handle.isBlank()) {
                continue;
            }
            RecoveryReport report = recoverHandle(handle.strip());
            log.info("Recovery of batch {}: {} (written={}, skipped={}, errored={})",
                report.handle(), report.state(), report.written(), report.skipped(), report.errored());
            reports.add(report);
        }
        return reports;
    }

    public List<RecoveryReport> recoverSession(UUID sessionId) {
        ImportSession session = sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
        log.info("Recovering {} pending batches of session {}", session.pendingBatchHandles().size(), sessionId);
        return recover(session.pendingBatchHandles());
    }

    private RecoveryReport recoverHandle(String handle) {
        BatchStatus status;
        try {
            status = batchService.getBatchStatus(handle);
        } catch (BatchServiceException e) {
            return new RecoveryReport(handle, RecoveryState.FAILED, 0, 0, 0, e.getMessage());
        }

        if (status.state() == BatchState.IN_PROGRESS) {
            return new RecoveryReport(handle, RecoveryState.NOT_READY, 0, 0, 0,
                status.requestCounts().processing() + " requests still processing");
        }
        if (status.state() == BatchState.ERRORED) {
            return new RecoveryReport(handle, RecoveryState.FAILED, 0, 0, 0, "Batch is in an error state");
        }

        Map<TriageResultWriter.Write, Integer> writes = new EnumMap<>(TriageResultWriter.Write.class);
        try {
            batchService.streamBatchResults(handle, result -> writes.merge(resultWriter.write(result), 1, Integer::sum));
        } catch (BatchServiceException e) {
            return new RecoveryReport(handle, RecoveryState.FAILED,
                writes.getOrDefault(TriageResultWriter.Write.WRITTEN, 0),
                writes.getOrDefault(TriageResultWriter.Write.SKIPPED, 0),
                writes.getOrDefault(TriageResultWriter.Write.DOWNGRADED, 0),
                e.getMessage());
        }

        for (UUID sessionId : sessionRepository.findSessionsWithPendingHandle(handle)) {
            sessionRepository.removePendingBatchHandle(sessionId, handle);
            refreshTriageStats(sessionId);
        }

        return new RecoveryReport(handle, RecoveryState.MERGED,
            writes.getOrDefault(TriageResultWriter.Write.WRITTEN, 0),
            writes.getOrDefault(TriageResultWriter.Write.SKIPPED, 0),
            writes.getOrDefault(TriageResultWriter.Write.DOWNGRADED, 0),
            null);
    }

    // Batch counters of the original run are kept; incomplete batches are capped at the handles still pending.
    private void refreshTriageStats(UUID sessionId) {
        ImportSession session = sessionRepository.findById(sessionId).orElse(null);
        if (session == null) {
            return;
        }
        StageStats previous = session.pipelineStats().get("triage");
        int submitted = 0;
        int incomplete = 0;
        int failed = 0;
        if (previous instanceof TriageStats triage) {
            submitted = triage.batchesSubmitted();
            incomplete = triage.batchesIncomplete();
            failed = triage.batchesFailed();
        }
        incomplete = Math.min(incomplete, session.pendingBatchHandles().size());
        sessionRepository.updateSessionStats(sessionId,
            TriageStats.of(documentRepository.countByTriageStatus(sessionId), submitted, incomplete, failed));
    }
}
