package com.archivist.taxonomy.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentCluster(
    UUID id,
    UUID sessionId,
    String suggestedName,
    String namingError,
    int documentCount,
    boolean noise,
    List<UUID> sampleDocumentIds,
    ClusterStatus status,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {

    public boolean isNamed() {
        return suggestedName != null && !suggestedName.isBlank();
    }
}
