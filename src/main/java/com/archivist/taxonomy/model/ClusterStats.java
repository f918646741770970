package com.archivist.taxonomy.model;

public record ClusterStats(
    int clusterCount,
    int noiseCount,
    double averageClusterSize,
    int largestClusterSize,
    int clusteredDocuments,
    int reducedDimensions,
    double epsilon
) implements StageStats {

    @Override
    public String key() {
        return "clustering";
    }
}
