package com.archivist.taxonomy.batch;

import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.exception.BatchServiceException;
import com.archivist.taxonomy.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchPollerTest {

    private static final String HANDLE = "msgbatch_001";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final BatchStatus running = new BatchStatus(HANDLE, BatchState.IN_PROGRESS, new RequestCounts(7, 3, 0, 0, 0));
    private final BatchStatus ended = new BatchStatus(HANDLE, BatchState.ENDED, new RequestCounts(0, 10, 0, 0, 0));

    private BatchService batchService;
    private List<Long> sleeps;
    private BatchPoller poller;

    @BeforeEach
    void setUp() {
        batchService = mock(BatchService.class);
        sleeps = new ArrayList<>();
        poller = new BatchPoller(batchService, TestProperties.polling(), sleeps::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("An ended batch completes without waiting")
    void shouldCompleteImmediately() {
        when(batchService.getBatchStatus(HANDLE)).thenReturn(ended);

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW);

        assertThat(outcome).isEqualTo(new BatchOutcome.Completed(HANDLE, ended));
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Polls with exponential backoff until the batch ends")
    void shouldBackOffExponentially() {
        when(batchService.getBatchStatus(HANDLE)).thenReturn(running, running, running, ended);

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW);

        assertThat(outcome).isInstanceOf(BatchOutcome.Completed.class);
        assertThat(sleeps).containsExactly(10L, 20L, 40L);
    }

    @Test
    @DisplayName("Gives up after the attempt budget and reports the last status")
    void shouldReportIncompleteAfterMaxAttempts() {
        when(batchService.getBatchStatus(HANDLE)).thenReturn(running);

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW);

        assertThat(outcome).isEqualTo(new BatchOutcome.Incomplete(HANDLE, running));
        verify(batchService, times(5)).getBatchStatus(HANDLE);
        assertThat(sleeps).containsExactly(10L, 20L, 40L, 80L);
    }

    @Test
    @DisplayName("The backoff interval is capped")
    void shouldCapInterval() {
        PipelineProperties.Polling polling = new PipelineProperties.Polling(
            Duration.ofMillis(50), 3.0, Duration.ofMillis(100), Duration.ofHours(1), 4);
        poller = new BatchPoller(batchService, polling, sleeps::add, Clock.fixed(NOW, ZoneOffset.UTC));
        when(batchService.getBatchStatus(HANDLE)).thenReturn(running);

        poller.awaitCompletion(HANDLE, NOW);

        assertThat(sleeps).containsExactly(50L, 100L, 100L);
    }

    @Test
    @DisplayName("A batch past its deadline is checked once without waiting")
    void shouldCheckOnceWhenDeadlineHasPassed() {
        when(batchService.getBatchStatus(HANDLE)).thenReturn(running);

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW.minus(Duration.ofHours(2)));

        assertThat(outcome).isEqualTo(new BatchOutcome.Incomplete(HANDLE, running));
        verify(batchService, times(1)).getBatchStatus(HANDLE);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("A batch past its deadline that has ended is still merged")
    void shouldCompleteWhenDeadlineHasPassedButBatchEnded() {
        when(batchService.getBatchStatus(HANDLE)).thenReturn(ended);

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW.minus(Duration.ofHours(2)));

        assertThat(outcome).isInstanceOf(BatchOutcome.Completed.class);
    }

    @Test
    @DisplayName("An errored batch fails")
    void shouldFailOnErrorState() {
        when(batchService.getBatchStatus(HANDLE))
            .thenReturn(new BatchStatus(HANDLE, BatchState.ERRORED, RequestCounts.EMPTY));

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW);

        assertThat(outcome).isEqualTo(new BatchOutcome.Failed(HANDLE, "Batch ended in state ERRORED"));
    }

    @Test
    @DisplayName("Transient status check failures are retried")
    void shouldRetryStatusCheckFailures() {
        when(batchService.getBatchStatus(anyString()))
            .thenThrow(new BatchServiceException("Status check failed: 503", HANDLE))
            .thenReturn(ended);

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW);

        assertThat(outcome).isInstanceOf(BatchOutcome.Completed.class);
        assertThat(sleeps).containsExactly(10L);
    }

    @Test
    @DisplayName("Persistent status check failures fail the batch instead of throwing")
    void shouldFailAfterRepeatedStatusCheckFailures() {
        when(batchService.getBatchStatus(HANDLE)).thenThrow(new BatchServiceException("Status check failed: 503", HANDLE));

        BatchOutcome outcome = poller.awaitCompletion(HANDLE, NOW);

        assertThat(outcome).isEqualTo(new BatchOutcome.Failed(HANDLE, "Status check failed: 503"));
        verify(batchService, times(5)).getBatchStatus(HANDLE);
    }
}
