package com.archivist.taxonomy.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TriageStats.class, name = "triage"),
    @JsonSubTypes.Type(value = DedupStats.class, name = "dedup"),
    @JsonSubTypes.Type(value = EmbeddingStats.class, name = "embedding"),
    @JsonSubTypes.Type(value = ClusterStats.class, name = "clustering"),
    @JsonSubTypes.Type(value = NamingStats.class, name = "naming"),
    @JsonSubTypes.Type(value = ReclusterStats.class, name = "recluster")
})
public sealed interface StageStats
    permits TriageStats, DedupStats, EmbeddingStats, ClusterStats, NamingStats, ReclusterStats {

    String key();
}
