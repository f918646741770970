package com.archivist.taxonomy.batch;

import com.archivist.taxonomy.exception.BatchServiceException;
import com.archivist.taxonomy.exception.BatchSubmissionException;
import com.archivist.taxonomy.infra.Partitions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class BatchDispatcher {

    private final BatchService batchService;
    private final BatchPoller batchPoller;

    private record Submitted(String handle, Instant submittedAt) {}

    public DispatchReport dispatch(List<BatchItem> items, int batchSize, BatchListener listener) {
        if (items.isEmpty()) {
            return DispatchReport.EMPTY;
        }

        int chunkSize = Math.min(batchSize, BatchService.MAX_ITEMS_PER_BATCH);
        List<List<BatchItem>> chunks = Partitions.of(items, chunkSize);
        List<Submitted> submitted = new ArrayList<>();
        int rejected = 0;
        BatchServiceException lastRejection = null;

        for (List<BatchItem> chunk : chunks) {
            try {
                String handle = batchService.submitBatch(chunk);
                submitted.add(new Submitted(handle, Instant.now()));
                listener.onSubmitted(handle, chunk);
            } catch (BatchServiceException e) {
                rejected++;
                lastRejection = e;
                log.warn("Batch submission of {} items rejected: {}", chunk.size(), e.getMessage());
            }
        }

        if (submitted.isEmpty()) {
            throw new BatchSubmissionException(rejected, lastRejection);
        }

        int completed = 0;
        int incomplete = 0;
        int failed = 0;
        List<String> pending = new ArrayList<>();

        for (Submitted batch : submitted) {
            BatchOutcome outcome = batchPoller.awaitCompletion(batch.handle(), batch.submittedAt());

            if (outcome instanceof BatchOutcome.Completed) {
                try {
                    batchService.streamBatchResults(batch.handle(), result -> listener.onResult(batch.handle(), result));
                    listener.onMerged(batch.handle());
                    completed++;
                } catch (BatchServiceException e) {
                    log.warn("Could not read results of batch {}: {}", batch.handle(), e.getMessage());
                    failed++;
                    pending.add(batch.handle());
                }
            } else if (outcome instanceof BatchOutcome.Incomplete) {
                incomplete++;
                pending.add(batch.handle());
            } else if (outcome instanceof BatchOutcome.Failed failedOutcome) {
                log.warn("Batch {} failed: {}", batch.handle(), failedOutcome.reason());
                failed++;
                pending.add(batch.handle());
            }

            listener.onBatchFinished(completed + incomplete + failed, submitted.size());
        }

        return new DispatchReport(submitted.size(), completed, incomplete, failed, rejected, List.copyOf(pending));
    }
}
