package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueEntry;
import io.github.chirino.atlas.model.QueueStatus;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Work queue of (record, enrichment kind) entries.
 *
 * <p>At most one PENDING or PROCESSING entry exists per (record, kind). Claims are exclusive:
 * two concurrent callers never receive the same entry. Delivery is at-least-once; a worker that
 * dies mid-entry leaves it PROCESSING until {@link #reconcileStale} releases it.
 */
public interface EnrichmentQueue {

    /**
     * Adds a PENDING entry unless an active one already exists for the record and kind.
     *
     * @return {@code true} if a new entry was created
     */
    boolean enqueue(UUID documentId, EnrichmentKind kind, int priority);

    /**
     * Atomically moves up to {@code batchSize} available PENDING entries of the given kind to
     * PROCESSING, highest priority first then oldest first. Kinds that need an embedding only
     * return entries whose record already has one.
     */
    List<QueueEntry> claim(EnrichmentKind kind, int batchSize);

    /**
     * PROCESSING to DONE.
     *
     * @return {@code false} if the entry was not PROCESSING (for example, reclaimed as stale)
     */
    boolean complete(long entryId);

    /**
     * Records a failed attempt. Retryable failures below the attempt ceiling go back to PENDING
     * behind a backoff; everything else becomes FAILED.
     *
     * @return the resulting status, or {@code null} if the entry was not PROCESSING
     */
    QueueStatus fail(long entryId, boolean retryable, String error);

    /**
     * Returns PROCESSING entries claimed longer than {@code threshold} ago to PENDING, or marks
     * them FAILED once they have used up their attempts.
     *
     * @return the number of entries released or failed
     */
    int reconcileStale(Duration threshold);

    /** Deletes DONE entries processed longer than {@code retention} ago. */
    int purgeDone(Duration retention);

    /** Moves FAILED entries of a kind back to PENDING with their attempts reset. */
    int requeueFailed(EnrichmentKind kind);

    /** Moves one FAILED entry back to PENDING with its attempts reset. */
    boolean requeue(long entryId);

    /** Entry counts per kind and status. */
    Map<EnrichmentKind, Map<QueueStatus, Long>> stats();
}
