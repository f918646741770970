package com.archivist.taxonomy.batch;

public record BatchItemResult(
    String customId,
    Outcome outcome,
    String content,
    String error
) {

    public enum Outcome {
        SUCCEEDED,
        ERRORED,
        CANCELED,
        EXPIRED
    }

    public static BatchItemResult succeeded(String customId, String content) {
        return new BatchItemResult(customId, Outcome.SUCCEEDED, content, null);
    }

    public static BatchItemResult failed(String customId, Outcome outcome, String error) {
        return new BatchItemResult(customId, outcome, null, error);
    }

    public boolean isSucceeded() {
        return outcome == Outcome.SUCCEEDED;
    }
}
