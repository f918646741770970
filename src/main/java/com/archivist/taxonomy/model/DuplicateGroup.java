package com.archivist.taxonomy.model;

import java.util.List;
import java.util.UUID;

public record DuplicateGroup(
    UUID groupId,
    String contentHash,
    UUID canonicalId,
    List<UUID> memberIds
) {

    public int duplicateCount() {
        return memberIds.size() - 1;
    }
}
