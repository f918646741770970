package com.archivist.taxonomy.model;

public record EmbeddingStats(
    int candidates,
    int embedded,
    int errored
) implements StageStats {

    @Override
    public String key() {
        return "embedding";
    }
}
