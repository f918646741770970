package com.archivist.taxonomy.batch;

public record BatchStatus(
    String handle,
    BatchState state,
    RequestCounts requestCounts
) {}
