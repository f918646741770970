package com.archivist.taxonomy.support;

import com.archivist.taxonomy.batch.BatchItem;
import com.archivist.taxonomy.batch.BatchItemResult;
import com.archivist.taxonomy.batch.BatchService;
import com.archivist.taxonomy.batch.BatchState;
import com.archivist.taxonomy.batch.BatchStatus;
import com.archivist.taxonomy.batch.RequestCounts;
import com.archivist.taxonomy.exception.BatchServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Scripted batch service: answers every item with {@code responder} and reports batches as
 * ended unless told otherwise.
 */
public class FakeBatchService implements BatchService {

    private final Map<String, List<BatchItem>> batches = new ConcurrentHashMap<>();
    private final Map<String, BatchState> states = new ConcurrentHashMap<>();
    private final AtomicInteger sequence = new AtomicInteger();
    private final List<List<BatchItem>> submissions = new ArrayList<>();

    private volatile Function<BatchItem, BatchItemResult> responder =
        item -> BatchItemResult.failed(item.customId(), BatchItemResult.Outcome.ERRORED, "no responder");
    private volatile BatchState stateForNewBatches = BatchState.ENDED;
    private volatile int rejectNextSubmissions;
    private volatile boolean failResultDownloads;

    public FakeBatchService respondWith(Function<BatchItem, BatchItemResult> responder) {
        this.responder = responder;
        return this;
    }

    public FakeBatchService newBatchesIn(BatchState state) {
        this.stateForNewBatches = state;
        return this;
    }

    public FakeBatchService rejectNextSubmissions(int count) {
        this.rejectNextSubmissions = count;
        return this;
    }

    public FakeBatchService failResultDownloads(boolean fail) {
        this.failResultDownloads = fail;
        return this;
    }

    public void finish(String handle) {
        states.put(handle, BatchState.ENDED);
    }

    public List<String> handles() {
        return batches.keySet().stream().sorted().toList();
    }

    public synchronized List<List<BatchItem>> submissions() {
        return List.copyOf(submissions);
    }

    @Override
    public synchronized String submitBatch(List<BatchItem> items) {
        if (rejectNextSubmissions > 0) {
            rejectNextSubmissions--;
            throw new BatchServiceException("Submission rejected", null);
        }
        String handle = "msgbatch_" + String.format("%03d", sequence.incrementAndGet());
        batches.put(handle, List.copyOf(items));
        states.put(handle, stateForNewBatches);
        submissions.add(List.copyOf(items));
        return handle;
    }

    @Override
    public BatchStatus getBatchStatus(String handle) {
        BatchState state = states.get(handle);
        if (state == null) {
            throw new BatchServiceException("Unknown batch", handle);
        }
        int size = batches.get(handle).size();
        RequestCounts counts = state == BatchState.IN_PROGRESS
            ? new RequestCounts(size, 0, 0, 0, 0)
            : new RequestCounts(0, size, 0, 0, 0);
        return new BatchStatus(handle, state, counts);
    }

    @Override
    public void streamBatchResults(String handle, Consumer<BatchItemResult> consumer) {
        if (failResultDownloads) {
            throw new BatchServiceException("Results download failed", handle);
        }
        List<BatchItem> items = batches.get(handle);
        if (items == null) {
            throw new BatchServiceException("Unknown batch", handle);
        }
        items.forEach(item -> consumer.accept(responder.apply(item)));
    }
}
