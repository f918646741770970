package com.archivist.taxonomy.model;

public record DedupStats(
    int firmDrafted,
    int duplicateGroups,
    int duplicates,
    int canonical
) implements StageStats {

    @Override
    public String key() {
        return "dedup";
    }
}
