package com.archivist.taxonomy.exception;

import lombok.Getter;

@Getter
public class BatchSubmissionException extends RuntimeException {
    private final int rejectedBatches;

    public BatchSubmissionException(int rejectedBatches, Throwable lastCause) {
        super("All " + rejectedBatches + " batch submissions were rejected"
            + (lastCause == null ? "" : ": " + lastCause.getMessage()), lastCause);
        this.rejectedBatches = rejectedBatches;
    }
}
