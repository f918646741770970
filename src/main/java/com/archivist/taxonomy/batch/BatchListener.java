package com.archivist.taxonomy.batch;

import java.util.List;

public interface BatchListener {

    void onSubmitted(String handle, List<BatchItem> items);

    void onResult(String handle, BatchItemResult result);

    void onMerged(String handle);

    default void onBatchFinished(int finished, int total) {
    }
}
