package com.archivist.taxonomy.batch;

import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.exception.BatchServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.CompositeRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.policy.TimeoutRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Waits for a submitted batch with exponential backoff, bounded by an attempt budget
 * and by a deadline measured from submission. Never throws for a slow or failed batch.
 */
@Slf4j
@Component
public class BatchPoller {

    private final BatchService batchService;
    private final PipelineProperties.Polling polling;
    private final Sleeper sleeper;
    private final Clock clock;

    @Autowired
    public BatchPoller(BatchService batchService, PipelineProperties properties) {
        this(batchService, properties.polling(), new ThreadWaitSleeper(), Clock.systemUTC());
    }

    public BatchPoller(BatchService batchService, PipelineProperties.Polling polling, Sleeper sleeper, Clock clock) {
        this.batchService = batchService;
        this.polling = polling;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public BatchOutcome awaitCompletion(String handle, Instant submittedAt) {
        Duration remaining = polling.maxDuration().minus(Duration.between(submittedAt, clock.instant()));
        RetryTemplate template = retryTemplate(remaining);
        AtomicReference<BatchStatus> lastStatus = new AtomicReference<>();

        try {
            BatchStatus status = template.execute(context -> {
                BatchStatus current = batchService.getBatchStatus(handle);
                lastStatus.set(current);
                if (current.state() == BatchState.IN_PROGRESS) {
                    log.debug("Batch {} still running (attempt {}, {} processing)",
                        handle, context.getRetryCount() + 1, current.requestCounts().processing());
                    throw new BatchStillRunningException(handle);
                }
                return current;
            });

            if (status.state() == BatchState.ENDED) {
                log.info("Batch {} ended: {}", handle, status.requestCounts());
                return new BatchOutcome.Completed(handle, status);
            }
            log.warn("Batch {} reported an error state", handle);
            return new BatchOutcome.Failed(handle, "Batch ended in state " + status.state());
        } catch (BatchStillRunningException e) {
            log.warn("Batch {} did not finish within the polling budget; leaving it for recovery", handle);
            return new BatchOutcome.Incomplete(handle, lastStatus.get());
        } catch (BatchServiceException e) {
            log.warn("Giving up on batch {} after status check failures: {}", handle, e.getMessage());
            return new BatchOutcome.Failed(handle, e.getMessage());
        }
    }

    private RetryTemplate retryTemplate(Duration remaining) {
        Map<Class<? extends Throwable>, Boolean> retryOn = Map.of(
            BatchStillRunningException.class, true,
            BatchServiceException.class, true
        );
        RetryPolicy retryPolicy;
        if (remaining.isNegative() || remaining.isZero()) {
            // Past the deadline already: one last look, no waiting.
            retryPolicy = new SimpleRetryPolicy(1, retryOn);
        } else {
            TimeoutRetryPolicy deadline = new TimeoutRetryPolicy();
            deadline.setTimeout(remaining.toMillis());
            CompositeRetryPolicy composite = new CompositeRetryPolicy();
            composite.setPolicies(new RetryPolicy[]{new SimpleRetryPolicy(polling.maxAttempts(), retryOn), deadline});
            retryPolicy = composite;
        }

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(polling.initialInterval().toMillis());
        backOff.setMultiplier(polling.multiplier());
        backOff.setMaxInterval(polling.maxInterval().toMillis());
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOff);
        template.setThrowLastExceptionOnExhausted(true);
        return template;
    }

    static class BatchStillRunningException extends RuntimeException {
        BatchStillRunningException(String handle) {
            super("Batch " + handle + " is still in progress");
        }
    }
}
