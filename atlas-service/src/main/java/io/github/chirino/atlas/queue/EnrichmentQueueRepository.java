package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.model.EnrichmentKind;
import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import java.util.List;
import java.util.UUID;

@ApplicationScoped
public class EnrichmentQueueRepository
        implements PanacheRepositoryBase<EnrichmentQueueEntity, Long> {

    @Inject EntityManager entityManager;

    /**
     * Insert a PENDING entry unless an active one exists for the record and kind. The partial
     * unique index on (document_id, kind) for active statuses makes this safe across replicas.
     */
    public boolean insertPending(UUID documentId, EnrichmentKind kind, int priority) {
        int inserted =
                entityManager
                        .createNativeQuery(
                                "INSERT INTO enrichment_queue (document_id, kind, priority,"
                                        + " status, attempts, created_at, available_at)"
                                        + " VALUES (?1, ?2, ?3, 'PENDING', 0, NOW(), NOW())"
                                        + " ON CONFLICT (document_id, kind)"
                                        + " WHERE status IN ('PENDING', 'PROCESSING') DO NOTHING")
                        .setParameter(1, documentId)
                        .setParameter(2, kind.name())
                        .setParameter(3, priority)
                        .executeUpdate();
        return inserted > 0;
    }

    /**
     * Claim ready entries using FOR UPDATE SKIP LOCKED. Safe for concurrent execution across
     * multiple replicas: a locked row is skipped, never handed out twice.
     */
    @SuppressWarnings("unchecked")
    public List<EnrichmentQueueEntity> claimReady(EnrichmentKind kind, int limit) {
        String embeddingGuard =
                kind.requiresEmbedding()
                        ? " AND EXISTS (SELECT 1 FROM documents d WHERE d.id = q.document_id"
                                + " AND d.embedding IS NOT NULL)"
                        : "";
        return entityManager
                .createNativeQuery(
                        "UPDATE enrichment_queue SET status = 'PROCESSING', claimed_at = NOW(),"
                                + " attempts = attempts + 1 WHERE id IN ("
                                + "SELECT q.id FROM enrichment_queue q"
                                + " WHERE q.kind = ?1 AND q.status = 'PENDING'"
                                + " AND q.available_at <= NOW()"
                                + embeddingGuard
                                + " ORDER BY q.priority DESC, q.created_at, q.id"
                                + " LIMIT ?2 FOR UPDATE SKIP LOCKED) RETURNING *",
                        EnrichmentQueueEntity.class)
                .setParameter(1, kind.name())
                .setParameter(2, limit)
                .getResultList();
    }

    public int completeProcessing(long id) {
        return entityManager
                .createNativeQuery(
                        "UPDATE enrichment_queue SET status = 'DONE', processed_at = NOW()"
                                + " WHERE id = ?1 AND status = 'PROCESSING'")
                .setParameter(1, id)
                .executeUpdate();
    }

    /** Fails stale PROCESSING entries that have used up their attempts. */
    public int failExhaustedStale(long thresholdSeconds, int maxAttempts) {
        return entityManager
                .createNativeQuery(
                        "UPDATE enrichment_queue SET status = 'FAILED', processed_at = NOW(),"
                                + " last_error = 'Claim expired without completion after '"
                                + " || attempts || ' attempt(s)'"
                                + " WHERE status = 'PROCESSING'"
                                + " AND claimed_at < NOW() - make_interval(secs => ?1)"
                                + " AND attempts >= ?2")
                .setParameter(1, (double) thresholdSeconds)
                .setParameter(2, maxAttempts)
                .executeUpdate();
    }

    public int releaseStale(long thresholdSeconds) {
        return entityManager
                .createNativeQuery(
                        "UPDATE enrichment_queue SET status = 'PENDING', claimed_at = NULL"
                                + " WHERE status = 'PROCESSING'"
                                + " AND claimed_at < NOW() - make_interval(secs => ?1)")
                .setParameter(1, (double) thresholdSeconds)
                .executeUpdate();
    }

    /**
     * Moves a PROCESSING entry to its next state in one conditional statement: back to PENDING
     * when a retry is allowed, FAILED otherwise. The backoff doubles the initial delay per
     * previous attempt up to the maximum delay, as {@link RetryPolicy#backoff(int)} does.
     *
     * @return the new status, or {@code null} when the entry was not PROCESSING
     */
    @SuppressWarnings("unchecked")
    public String failProcessing(long id, boolean retryable, String error, RetryPolicy policy) {
        List<Object> rows =
                entityManager
                        .createNativeQuery(
                                "UPDATE enrichment_queue SET last_error = ?2, claimed_at = NULL,"
                                        + " status = CASE WHEN ?3 AND attempts < ?4"
                                        + " THEN 'PENDING' ELSE 'FAILED' END,"
                                        + " available_at = CASE WHEN ?3 AND attempts < ?4"
                                        + " THEN NOW() + make_interval(secs => LEAST(?5"
                                        + " * power(2, GREATEST(attempts - 1, 0)), ?6))"
                                        + " ELSE available_at END,"
                                        + " processed_at = CASE WHEN ?3 AND attempts < ?4"
                                        + " THEN NULL ELSE NOW() END"
                                        + " WHERE id = ?1 AND status = 'PROCESSING'"
                                        + " RETURNING status")
                        .setParameter(1, id)
                        .setParameter(2, error)
                        .setParameter(3, retryable)
                        .setParameter(4, policy.maxAttempts())
                        .setParameter(5, (double) policy.initialDelay().toSeconds())
                        .setParameter(6, (double) policy.maxDelay().toSeconds())
                        .getResultList();
        return rows.isEmpty() ? null : (String) rows.get(0);
    }

    /** Deletes DONE entries processed before the cutoff. */
    public int deleteDoneBefore(long retentionSeconds) {
        return entityManager
                .createNativeQuery(
                        "DELETE FROM enrichment_queue WHERE status = 'DONE'"
                                + " AND processed_at < NOW() - make_interval(secs => ?1)")
                .setParameter(1, (double) retentionSeconds)
                .executeUpdate();
    }

    /**
     * Requeue FAILED entries that have no active sibling. When several FAILED entries exist for
     * the same record only the newest is requeued, so the active-entry index is never violated.
     */
    public int requeueFailed(EnrichmentKind kind, Long onlyId) {
        String idFilter = onlyId == null ? "" : " AND f.id = ?2";
        var query =
                entityManager.createNativeQuery(
                        "UPDATE enrichment_queue SET status = 'PENDING', attempts = 0,"
                                + " available_at = NOW(), claimed_at = NULL, processed_at = NULL"
                                + " WHERE id IN (SELECT DISTINCT ON (f.document_id) f.id"
                                + " FROM enrichment_queue f WHERE f.kind = ?1"
                                + " AND f.status = 'FAILED'"
                                + idFilter
                                + " AND NOT EXISTS (SELECT 1 FROM enrichment_queue a"
                                + " WHERE a.document_id = f.document_id AND a.kind = f.kind"
                                + " AND a.status IN ('PENDING', 'PROCESSING'))"
                                + " ORDER BY f.document_id, f.id DESC)");
        query.setParameter(1, kind.name());
        if (onlyId != null) {
            query.setParameter(2, onlyId);
        }
        return query.executeUpdate();
    }

    @SuppressWarnings("unchecked")
    public List<Object[]> countByKindAndStatus() {
        return entityManager
                .createNativeQuery(
                        "SELECT kind, status, COUNT(*) FROM enrichment_queue GROUP BY kind,"
                                + " status")
                .getResultList();
    }
}
