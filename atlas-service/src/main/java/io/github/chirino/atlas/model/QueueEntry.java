package io.github.chirino.atlas.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of one enrichment queue row.
 *
 * <p>The in-memory queue replaces whole snapshots with compare-and-set, so every transition
 * returns a new instance instead of mutating this one.
 */
public record QueueEntry(
        long id,
        UUID documentId,
        EnrichmentKind kind,
        int priority,
        QueueStatus status,
        int attempts,
        Instant createdAt,
        Instant availableAt,
        Instant claimedAt,
        Instant processedAt,
        String lastError) {

    public static QueueEntry pending(
            long id, UUID documentId, EnrichmentKind kind, int priority, Instant now) {
        return new QueueEntry(
                id, documentId, kind, priority, QueueStatus.PENDING, 0, now, now, null, null, null);
    }

    public boolean isClaimable(Instant now) {
        return status == QueueStatus.PENDING && !availableAt.isAfter(now);
    }

    public QueueEntry claimed(Instant now) {
        return new QueueEntry(
                id,
                documentId,
                kind,
                priority,
                QueueStatus.PROCESSING,
                attempts + 1,
                createdAt,
                availableAt,
                now,
                null,
                lastError);
    }

    public QueueEntry completed(Instant now) {
        return new QueueEntry(
                id,
                documentId,
                kind,
                priority,
                QueueStatus.DONE,
                attempts,
                createdAt,
                availableAt,
                claimedAt,
                now,
                lastError);
    }

    public QueueEntry retryAt(Instant availableAt, String error) {
        return new QueueEntry(
                id,
                documentId,
                kind,
                priority,
                QueueStatus.PENDING,
                attempts,
                createdAt,
                availableAt,
                null,
                null,
                error);
    }

    public QueueEntry failed(Instant now, String error) {
        return new QueueEntry(
                id,
                documentId,
                kind,
                priority,
                QueueStatus.FAILED,
                attempts,
                createdAt,
                availableAt,
                claimedAt,
                now,
                error);
    }

    public QueueEntry released() {
        return new QueueEntry(
                id,
                documentId,
                kind,
                priority,
                QueueStatus.PENDING,
                attempts,
                createdAt,
                availableAt,
                null,
                null,
                lastError);
    }

    public QueueEntry requeued(Instant now) {
        return new QueueEntry(
                id,
                documentId,
                kind,
                priority,
                QueueStatus.PENDING,
                0,
                createdAt,
                now,
                null,
                null,
                lastError);
    }
}
