package com.archivist.taxonomy.batch;

import java.util.List;
import java.util.function.Consumer;

public interface BatchService {

    int MAX_ITEMS_PER_BATCH = 10_000;

    String submitBatch(List<BatchItem> items);

    BatchStatus getBatchStatus(String handle);

    void streamBatchResults(String handle, Consumer<BatchItemResult> consumer);
}
