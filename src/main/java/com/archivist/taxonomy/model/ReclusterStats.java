package com.archivist.taxonomy.model;

public record ReclusterStats(
    int totalReclassified,
    int matchedToExisting,
    int newClustersCreated,
    int unmatchedDocs
) implements StageStats {

    @Override
    public String key() {
        return "recluster";
    }
}
