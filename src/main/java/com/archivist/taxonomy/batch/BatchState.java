package com.archivist.taxonomy.batch;

public enum BatchState {
    IN_PROGRESS,
    ENDED,
    ERRORED
}
