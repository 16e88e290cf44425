package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueEntry;
import io.github.chirino.atlas.model.QueueStatus;
import io.github.chirino.atlas.store.MemoryRecordStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.jboss.logging.Logger;

/**
 * In-memory enrichment queue.
 *
 * <p>Entries are immutable snapshots; every transition is a {@link ConcurrentHashMap#replace(
 * Object, Object, Object)} against the snapshot the caller read, so concurrent claimers race per
 * entry and the loser simply moves on. The active-entry index is reserved with {@code
 * putIfAbsent} before an entry becomes visible, which keeps one PENDING-or-PROCESSING entry per
 * (record, kind).
 */
@ApplicationScoped
public class MemoryEnrichmentQueue implements EnrichmentQueue {

    private static final Logger LOG = Logger.getLogger(MemoryEnrichmentQueue.class);

    private record ActiveKey(UUID documentId, EnrichmentKind kind) {}

    private final ConcurrentHashMap<Long, QueueEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ActiveKey, Long> active = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Inject MemoryRecordStore recordStore;

    @Inject RetryPolicy retryPolicy;

    Clock clock = Clock.systemUTC();

    @Override
    public boolean enqueue(UUID documentId, EnrichmentKind kind, int priority) {
        long id = sequence.incrementAndGet();
        if (active.putIfAbsent(new ActiveKey(documentId, kind), id) != null) {
            return false;
        }
        entries.put(id, QueueEntry.pending(id, documentId, kind, priority, clock.instant()));
        LOG.debugf("Enqueued %s for document %s", kind, documentId);
        return true;
    }

    @Override
    public List<QueueEntry> claim(EnrichmentKind kind, int batchSize) {
        if (batchSize <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<QueueEntry> candidates = new ArrayList<>();
        for (QueueEntry entry : entries.values()) {
            if (entry.kind() == kind && entry.isClaimable(now)) {
                candidates.add(entry);
            }
        }
        candidates.sort(PgEnrichmentQueue.CLAIM_ORDER);

        List<QueueEntry> claimed = new ArrayList<>();
        for (QueueEntry candidate : candidates) {
            if (claimed.size() >= batchSize) {
                break;
            }
            if (kind.requiresEmbedding() && !hasEmbedding(candidate.documentId())) {
                continue;
            }
            QueueEntry next = candidate.claimed(now);
            if (entries.replace(candidate.id(), candidate, next)) {
                claimed.add(next);
            }
        }
        return claimed;
    }

    @Override
    public boolean complete(long entryId) {
        while (true) {
            QueueEntry current = entries.get(entryId);
            if (current == null || current.status() != QueueStatus.PROCESSING) {
                return false;
            }
            QueueEntry next = current.completed(clock.instant());
            if (entries.replace(entryId, current, next)) {
                releaseActive(next);
                return true;
            }
        }
    }

    @Override
    public QueueStatus fail(long entryId, boolean retryable, String error) {
        while (true) {
            QueueEntry current = entries.get(entryId);
            if (current == null || current.status() != QueueStatus.PROCESSING) {
                return null;
            }
            Instant now = clock.instant();
            String message = PgEnrichmentQueue.truncate(error);
            QueueEntry next;
            if (retryable && retryPolicy.allowsRetry(current.attempts())) {
                next = current.retryAt(now.plus(retryPolicy.backoff(current.attempts())), message);
            } else {
                next = current.failed(now, message);
            }
            if (entries.replace(entryId, current, next)) {
                if (next.status() == QueueStatus.FAILED) {
                    releaseActive(next);
                }
                return next.status();
            }
        }
    }

    @Override
    public int reconcileStale(Duration threshold) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(threshold);
        int reconciled = 0;
        for (QueueEntry entry : entries.values()) {
            if (entry.status() != QueueStatus.PROCESSING
                    || entry.claimedAt() == null
                    || !entry.claimedAt().isBefore(cutoff)) {
                continue;
            }
            QueueEntry next =
                    retryPolicy.allowsRetry(entry.attempts())
                            ? entry.released()
                            : entry.failed(now, staleError(entry.attempts()));
            if (entries.replace(entry.id(), entry, next)) {
                if (next.status() == QueueStatus.FAILED) {
                    releaseActive(next);
                }
                reconciled++;
            }
        }
        return reconciled;
    }

    @Override
    public int purgeDone(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int purged = 0;
        for (QueueEntry entry : entries.values()) {
            if (entry.status() == QueueStatus.DONE
                    && entry.processedAt() != null
                    && entry.processedAt().isBefore(cutoff)
                    && entries.remove(entry.id(), entry)) {
                purged++;
            }
        }
        return purged;
    }

    static String staleError(int attempts) {
        return "Claim expired without completion after " + attempts + " attempt(s)";
    }

    @Override
    public int requeueFailed(EnrichmentKind kind) {
        int requeued = 0;
        List<QueueEntry> failed = new ArrayList<>();
        for (QueueEntry entry : entries.values()) {
            if (entry.kind() == kind && entry.status() == QueueStatus.FAILED) {
                failed.add(entry);
            }
        }
        // Newest first, so the newest failure per record wins the active slot.
        failed.sort((a, b) -> Long.compare(b.id(), a.id()));
        for (QueueEntry entry : failed) {
            if (requeue(entry)) {
                requeued++;
            }
        }
        return requeued;
    }

    @Override
    public boolean requeue(long entryId) {
        QueueEntry entry = entries.get(entryId);
        return entry != null && entry.status() == QueueStatus.FAILED && requeue(entry);
    }

    private boolean requeue(QueueEntry entry) {
        ActiveKey key = new ActiveKey(entry.documentId(), entry.kind());
        if (active.putIfAbsent(key, entry.id()) != null) {
            return false;
        }
        if (entries.replace(entry.id(), entry, entry.requeued(clock.instant()))) {
            return true;
        }
        active.remove(key, entry.id());
        return false;
    }

    @Override
    public Map<EnrichmentKind, Map<QueueStatus, Long>> stats() {
        Map<EnrichmentKind, Map<QueueStatus, Long>> stats = QueueStats.zeroed();
        for (QueueEntry entry : entries.values()) {
            stats.get(entry.kind()).merge(entry.status(), 1L, Long::sum);
        }
        return stats;
    }

    public QueueEntry get(long entryId) {
        return entries.get(entryId);
    }

    public List<QueueEntry> entries() {
        return List.copyOf(entries.values());
    }

    private void releaseActive(QueueEntry entry) {
        active.remove(new ActiveKey(entry.documentId(), entry.kind()), entry.id());
    }

    private boolean hasEmbedding(UUID documentId) {
        return recordStore.findById(documentId).map(DocumentRecord::hasEmbedding).orElse(false);
    }
}
