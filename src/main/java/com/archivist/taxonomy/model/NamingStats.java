package com.archivist.taxonomy.model;

public record NamingStats(
    int clusters,
    int named,
    int failed
) implements StageStats {

    @Override
    public String key() {
        return "naming";
    }
}
