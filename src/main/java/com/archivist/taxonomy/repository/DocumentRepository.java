package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.model.ClusterAssignment;
import com.archivist.taxonomy.model.DocumentVector;
import com.archivist.taxonomy.model.DuplicateGroup;
import com.archivist.taxonomy.model.ExtractedDocument;
import com.archivist.taxonomy.model.TriageCounts;
import com.archivist.taxonomy.model.TriageStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DocumentRepository {
    ExtractedDocument save(ExtractedDocument document);
    Optional<ExtractedDocument> findById(UUID id);
    List<ExtractedDocument> findByIds(Collection<UUID> ids);

    List<ExtractedDocument> findUntriaged(UUID sessionId);

    /**
     * Writes the triage result only if the document has not been triaged yet.
     *
     * @return true if the row was written, false if it already carried a triage status
     */
    boolean updateTriage(UUID docId, TriageStatus status, double confidence, String reason);
    TriageCounts countByTriageStatus(UUID sessionId);

    List<ExtractedDocument> findFirmDrafted(UUID sessionId);
    void markDuplicateGroups(List<DuplicateGroup> groups);

    List<ExtractedDocument> findCanonicalFirmDrafted(UUID sessionId);
    List<ExtractedDocument> findPendingEmbedding(UUID sessionId);
    void updateEmbedding(UUID docId, float[] vector);
    void markEmbeddingFailed(UUID docId, String error);

    List<DocumentVector> findEmbedded(UUID sessionId);
    int countClusterCandidatesWithoutCluster(UUID sessionId);
    void clearClusterAssignments(UUID sessionId);
    void assignClusters(List<ClusterAssignment> assignments);

    List<ExtractedDocument> findReclassified(UUID sessionId);
    int reassignToCluster(Collection<UUID> docIds, UUID clusterId);
}
