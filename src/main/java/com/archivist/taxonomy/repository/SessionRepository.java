package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.model.ImportSession;
import com.archivist.taxonomy.model.PipelineProgress;
import com.archivist.taxonomy.model.PipelineStatus;
import com.archivist.taxonomy.model.StageStats;
import com.archivist.taxonomy.model.StatusTransition;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public interface SessionRepository {
    ImportSession create(int totalDocuments);
    Optional<ImportSession> findById(UUID id);

    /**
     * Applies the transition only if the current status is one of {@code transition.from()}.
     *
     * @return false if the session was in any other status
     */
    boolean updateSessionStatus(UUID sessionId, StatusTransition transition);
    boolean reset(UUID sessionId, Set<PipelineStatus> allowed);

    void updateSessionStats(UUID sessionId, StageStats stats);
    void updateProgress(UUID sessionId, PipelineProgress progress);

    void addPendingBatchHandles(UUID sessionId, Collection<String> handles);
    void removePendingBatchHandle(UUID sessionId, String handle);
    List<UUID> findSessionsWithPendingHandle(String handle);
}
