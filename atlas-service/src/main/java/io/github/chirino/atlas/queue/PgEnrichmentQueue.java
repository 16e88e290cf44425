package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueEntry;
import io.github.chirino.atlas.model.QueueStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jboss.logging.Logger;

/** Enrichment queue backed by the {@code enrichment_queue} table. */
@ApplicationScoped
public class PgEnrichmentQueue implements EnrichmentQueue {

    private static final Logger LOG = Logger.getLogger(PgEnrichmentQueue.class);

    static final Comparator<QueueEntry> CLAIM_ORDER =
            Comparator.comparingInt(QueueEntry::priority)
                    .reversed()
                    .thenComparing(QueueEntry::createdAt)
                    .thenComparingLong(QueueEntry::id);

    @Inject EnrichmentQueueRepository repository;

    @Inject RetryPolicy retryPolicy;

    @Override
    @Transactional
    public boolean enqueue(UUID documentId, EnrichmentKind kind, int priority) {
        boolean created = repository.insertPending(documentId, kind, priority);
        if (created) {
            LOG.debugf("Enqueued %s for document %s", kind, documentId);
        }
        return created;
    }

    @Override
    @Transactional
    public List<QueueEntry> claim(EnrichmentKind kind, int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }
        // UPDATE ... RETURNING does not preserve the sub-select's order.
        return repository.claimReady(kind, batchSize).stream()
                .map(EnrichmentQueueEntity::toQueueEntry)
                .sorted(CLAIM_ORDER)
                .toList();
    }

    @Override
    @Transactional
    public boolean complete(long entryId) {
        return repository.completeProcessing(entryId) > 0;
    }

    @Override
    @Transactional
    public QueueStatus fail(long entryId, boolean retryable, String error) {
        String status = repository.failProcessing(entryId, retryable, truncate(error), retryPolicy);
        if (status == null) {
            LOG.debugf("Ignoring failure for entry %d, no longer processing", entryId);
            return null;
        }
        return QueueStatus.valueOf(status);
    }

    @Override
    @Transactional
    public int reconcileStale(Duration threshold) {
        int failed =
                repository.failExhaustedStale(threshold.toSeconds(), retryPolicy.maxAttempts());
        if (failed > 0) {
            LOG.warnf("Failed %d stale entries that used up their attempts", failed);
        }
        return failed + repository.releaseStale(threshold.toSeconds());
    }

    @Override
    @Transactional
    public int purgeDone(Duration retention) {
        return repository.deleteDoneBefore(retention.toSeconds());
    }

    @Override
    @Transactional
    public int requeueFailed(EnrichmentKind kind) {
        return repository.requeueFailed(kind, null);
    }

    @Override
    @Transactional
    public boolean requeue(long entryId) {
        EnrichmentQueueEntity entity = repository.findById(entryId);
        if (entity == null) {
            return false;
        }
        return repository.requeueFailed(entity.getKind(), entryId) > 0;
    }

    @Override
    @Transactional
    public Map<EnrichmentKind, Map<QueueStatus, Long>> stats() {
        Map<EnrichmentKind, Map<QueueStatus, Long>> stats = QueueStats.zeroed();
        for (Object[] row : repository.countByKindAndStatus()) {
            EnrichmentKind kind = EnrichmentKind.valueOf((String) row[0]);
            QueueStatus status = QueueStatus.valueOf((String) row[1]);
            stats.get(kind).put(status, ((Number) row[2]).longValue());
        }
        return stats;
    }

    static String truncate(String error) {
        if (error == null || error.length() <= 2000) {
            return error;
        }
        return error.substring(0, 2000);
    }
}
