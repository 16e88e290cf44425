package io.github.chirino.atlas.queue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.atlas.model.QueueStatus;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class PgEnrichmentQueueTest {

    private EnrichmentQueueRepository repository;
    private PgEnrichmentQueue queue;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        repository = mock(EnrichmentQueueRepository.class);
        policy = RetryPolicy.of(Duration.ofSeconds(30), Duration.ofMinutes(30), 5);
        queue = new PgEnrichmentQueue();
        queue.repository = repository;
        queue.retryPolicy = policy;
    }

    @Test
    void fail_is_a_single_conditional_update() {
        when(repository.failProcessing(7L, true, "timeout", policy)).thenReturn("PENDING");

        assertEquals(QueueStatus.PENDING, queue.fail(7L, true, "timeout"));

        verify(repository).failProcessing(7L, true, "timeout", policy);
        verify(repository, never()).releaseStale(anyLong());
    }

    @Test
    void fail_of_an_entry_no_longer_processing_returns_null() {
        when(repository.failProcessing(anyLong(), anyBoolean(), anyString(), any()))
                .thenReturn(null);

        assertNull(queue.fail(7L, false, "boom"));
    }

    @Test
    void fail_truncates_long_errors() {
        String error = "x".repeat(5000);
        when(repository.failProcessing(eq(1L), eq(false), anyString(), eq(policy)))
                .thenReturn("FAILED");

        assertEquals(QueueStatus.FAILED, queue.fail(1L, false, error));
        verify(repository).failProcessing(1L, false, "x".repeat(2000), policy);
    }

    @Test
    void stale_sweep_fails_exhausted_entries_before_releasing_the_rest() {
        when(repository.failExhaustedStale(600L, 5)).thenReturn(2);
        when(repository.releaseStale(600L)).thenReturn(3);

        assertEquals(5, queue.reconcileStale(Duration.ofMinutes(10)));

        InOrder order = inOrder(repository);
        order.verify(repository).failExhaustedStale(600L, 5);
        order.verify(repository).releaseStale(600L);
    }

    @Test
    void purge_deletes_done_entries_older_than_retention() {
        when(repository.deleteDoneBefore(Duration.ofDays(7).toSeconds())).thenReturn(4);

        assertEquals(4, queue.purgeDone(Duration.ofDays(7)));
    }
}
