package com.archivist.taxonomy.repository;

import com.archivist.taxonomy.model.DocumentCluster;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ClusterRepository {
    DocumentCluster createCluster(UUID sessionId, List<UUID> memberIds, boolean noise, List<UUID> sampleDocumentIds);
    DocumentCluster createNamedCluster(UUID sessionId, String name, List<UUID> memberIds);
    Optional<DocumentCluster> findById(UUID id);
    List<DocumentCluster> findBySession(UUID sessionId);
    List<DocumentCluster> findUnnamed(UUID sessionId);
    List<DocumentCluster> findActiveNamed(UUID sessionId);
    void deleteBySession(UUID sessionId);
    void updateClusterName(UUID clusterId, String name);
    void markNamingFailed(UUID clusterId, String error);
    void refreshDocumentCount(UUID clusterId);
}
