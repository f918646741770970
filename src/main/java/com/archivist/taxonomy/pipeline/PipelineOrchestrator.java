package com.archivist.taxonomy.pipeline;

import com.archivist.taxonomy.exception.PipelineStateException;
import com.archivist.taxonomy.exception.SessionNotFoundException;
import com.archivist.taxonomy.model.ImportSession;
import com.archivist.taxonomy.model.PipelineStage;
import com.archivist.taxonomy.model.PipelineStatus;
import com.archivist.taxonomy.model.ReclusterStats;
import com.archivist.taxonomy.model.StageStats;
import com.archivist.taxonomy.model.StatusTransition;
import com.archivist.taxonomy.repository.SessionRepository;
import com.archivist.taxonomy.service.ClusterNamingService;
import com.archivist.taxonomy.service.ClusteringService;
import com.archivist.taxonomy.service.DeduplicationService;
import com.archivist.taxonomy.service.EmbeddingGeneratorService;
import com.archivist.taxonomy.service.ProgressReporter;
import com.archivist.taxonomy.service.ReclusterService;
import com.archivist.taxonomy.service.TriageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Drives a session through triage, deduplication, embedding, reduction, clustering and naming.
 * <p>
 * A run starts by claiming the session with a conditional status update, which is what keeps
 * two runs off the same session. Every later status change is conditional on the status this
 * run last wrote; if that check fails the session was taken over and this run stops without
 * touching it further.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final SessionRepository sessionRepository;
    private final TriageService triageService;
    private final DeduplicationService deduplicationService;
    private final EmbeddingGeneratorService embeddingGeneratorService;
    private final ClusteringService clusteringService;
    private final ClusterNamingService clusterNamingService;
    private final ReclusterService reclusterService;
    private final ProgressReporter progressReporter;

    public PipelineRunResult run(UUID sessionId) {
        claimRun(sessionId);
        return executeFrom(sessionId, PipelineStage.TRIAGE);
    }

    public PipelineRunResult runFromStage(UUID sessionId, PipelineStage stage, boolean force) {
        claimResume(sessionId, stage, force);
        return executeFrom(sessionId, stage);
    }

    public void claimRun(UUID sessionId) {
        claim(sessionId, PipelineStatus.RUNNABLE, PipelineStatus.TRIAGING, "run pipeline for");
    }

    /**
     * Claims a resume at {@code stage}. With {@code force} an in-progress session is taken over;
     * the caller asserts that the process that was running it is gone.
     */
    public void claimResume(UUID sessionId, PipelineStage stage, boolean force) {
        Set<PipelineStatus> allowed = EnumSet.copyOf(PipelineStatus.RESUMABLE);
        if (force) {
            allowed.addAll(PipelineStatus.IN_PROGRESS);
            allowed.add(PipelineStatus.EXTRACTING);
        }
        claim(sessionId, allowed, stage.status(), "resume at " + stage + " for");
        if (force) {
            log.warn("Session {} force-resumed at {}", sessionId, stage);
        }
    }

    private void claim(UUID sessionId, Set<PipelineStatus> allowed, PipelineStatus target, String operation) {
        if (!sessionRepository.updateSessionStatus(sessionId, StatusTransition.start(allowed, target))) {
            PipelineStatus current = sessionRepository.findById(sessionId)
                .map(ImportSession::pipelineStatus)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            throw new PipelineStateException(sessionId, current, operation);
        }
        log.info("Session {} claimed, status {}", sessionId, target.dbValue());
    }

    /**
     * Runs {@code first} and every later stage on a session this caller has already claimed.
     * Stage failures are recorded on the session and reported in the result, not thrown.
     */
    public PipelineRunResult executeFrom(UUID sessionId, PipelineStage first) {
        List<PipelineStage> completed = new ArrayList<>();
        Map<String, StageStats> stats = new LinkedHashMap<>();
        PipelineStatus current = first.status();
        Map<UUID, float[]> reduced = null;
        long runStarted = System.currentTimeMillis();

        try {
            for (PipelineStage stage : first.fromHere()) {
                if (stage.status() != current) {
                    advance(sessionId, current, stage.status());
                    current = stage.status();
                }

                long stageStarted = System.currentTimeMillis();
                log.info("Session {}: stage {} started", sessionId, stage);
                progressReporter.report(sessionId, stage.name().toLowerCase(), 0, 0, "Stage started");

                switch (stage) {
                    case TRIAGE -> record(stats, triageService.triage(sessionId));
                    case DEDUPLICATION -> record(stats, deduplicationService.deduplicate(sessionId));
                    case EMBEDDING -> record(stats, embeddingGeneratorService.embed(sessionId));
                    case REDUCTION -> {
                        if (clusteringService.needsClustering(sessionId)) {
                            reduced = clusteringService.reduce(sessionId);
                        }
                    }
                    case CLUSTERING -> {
                        if (clusteringService.needsClustering(sessionId)) {
                            Map<UUID, float[]> vectors = reduced != null ? reduced : clusteringService.reduce(sessionId);
                            record(stats, clusteringService.cluster(sessionId, vectors));
                        } else {
                            log.info("Session {}: every eligible document already has a cluster, skipping clustering",
                                sessionId);
                        }
                        reduced = null;
                    }
                    case NAMING -> record(stats, clusterNamingService.nameClusters(sessionId));
                }

                completed.add(stage);
                log.info("Session {}: stage {} finished in {} ms", sessionId, stage, System.currentTimeMillis() - stageStarted);
            }

            advance(sessionId, current, PipelineStatus.READY_FOR_VALIDATION);
            log.info("Session {}: pipeline finished in {} ms", sessionId, System.currentTimeMillis() - runStarted);
            return new PipelineRunResult(sessionId, PipelineStatus.READY_FOR_VALIDATION, completed, stats, null);

        } catch (OwnershipLostException e) {
            log.error("Session {}: {}; abandoning this run", sessionId, e.getMessage());
            return new PipelineRunResult(sessionId, e.found, completed, stats, e.getMessage());

        } catch (RuntimeException e) {
            String error = describe(e);
            log.error("Session {}: pipeline failed during {}: {}", sessionId, current.dbValue(), error, e);
            if (!sessionRepository.updateSessionStatus(sessionId, StatusTransition.fail(current, error))) {
                PipelineStatus found = sessionRepository.findById(sessionId)
                    .map(ImportSession::pipelineStatus)
                    .orElse(null);
                log.warn("Session {} left {} before this run could record its failure (now {}); leaving it untouched",
                    sessionId, current.dbValue(), found == null ? "no session" : found.dbValue());
                return new PipelineRunResult(sessionId, found, completed, stats, error);
            }
            return new PipelineRunResult(sessionId, PipelineStatus.FAILED, completed, stats, error);
        }
    }

    public ReclusterStats recluster(UUID sessionId) {
        if (!sessionRepository.updateSessionStatus(sessionId,
            StatusTransition.advance(PipelineStatus.READY_FOR_VALIDATION, PipelineStatus.RE_CLUSTERING))) {
            PipelineStatus current = sessionRepository.findById(sessionId)
                .map(ImportSession::pipelineStatus)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
            throw new PipelineStateException(sessionId, current, "re-cluster");
        }

        try {
            ReclusterStats stats = reclusterService.recluster(sessionId);
            sessionRepository.updateSessionStatus(sessionId,
                StatusTransition.complete(PipelineStatus.RE_CLUSTERING, PipelineStatus.READY_FOR_VALIDATION));
            return stats;
        } catch (RuntimeException e) {
            log.error("Session {}: re-clustering failed", sessionId, e);
            if (!sessionRepository.updateSessionStatus(sessionId,
                StatusTransition.fail(PipelineStatus.RE_CLUSTERING, describe(e)))) {
                log.warn("Session {} left {} before the re-clustering failure could be recorded",
                    sessionId, PipelineStatus.RE_CLUSTERING.dbValue());
            }
            throw e;
        }
    }

    public void reset(UUID sessionId) {
        if (!sessionRepository.reset(sessionId, PipelineStatus.RESETTABLE)) {
            PipelineStatus current = getStatus(sessionId).pipelineStatus();
            throw new PipelineStateException(sessionId, current, "reset");
        }
        log.info("Session {} reset to {}", sessionId, PipelineStatus.NOT_STARTED.dbValue());
    }

    public ImportSession getStatus(UUID sessionId) {
        return sessionRepository.findById(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private void advance(UUID sessionId, PipelineStatus from, PipelineStatus to) {
        StatusTransition transition = to.isTerminal()
            ? StatusTransition.complete(from, to)
            : StatusTransition.advance(from, to);
        if (!sessionRepository.updateSessionStatus(sessionId, transition)) {
            PipelineStatus found = sessionRepository.findById(sessionId)
                .map(ImportSession::pipelineStatus)
                .orElse(null);
            throw new OwnershipLostException(from, to, found);
        }
    }

    private static void record(Map<String, StageStats> stats, StageStats stageStats) {
        stats.put(stageStats.key(), stageStats);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static final class OwnershipLostException extends RuntimeException {
        private final PipelineStatus found;

        private OwnershipLostException(PipelineStatus expected, PipelineStatus target, PipelineStatus found) {
            super("expected status " + expected.dbValue() + " before moving to " + target.dbValue()
                + " but found " + (found == null ? "no session" : found.dbValue()));
            this.found = found;
        }
    }
}
