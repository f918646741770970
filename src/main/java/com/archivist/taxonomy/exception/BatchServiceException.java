package com.archivist.taxonomy.exception;

import lombok.Getter;

@Getter
public class BatchServiceException extends RuntimeException {
    private final String batchHandle;

    public BatchServiceException(String message, String batchHandle) {
        super(message);
        this.batchHandle = batchHandle;
    }

    public BatchServiceException(String message, String batchHandle, Throwable cause) {
        super(message, cause);
        this.batchHandle = batchHandle;
    }
}
