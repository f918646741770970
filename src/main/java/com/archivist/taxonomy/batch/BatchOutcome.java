package com.archivist.taxonomy.batch;

public sealed interface BatchOutcome {

    String handle();

    record Completed(String handle, BatchStatus status) implements BatchOutcome {}

    record Failed(String handle, String reason) implements BatchOutcome {}

    record Incomplete(String handle, BatchStatus lastStatus) implements BatchOutcome {}
}
