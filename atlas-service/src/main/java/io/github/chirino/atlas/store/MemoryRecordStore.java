package io.github.chirino.atlas.store;

import io.github.chirino.atlas.metadata.MemoryMetadataStore;
import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.DocumentSummary;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.PlanMatcher;
import io.github.chirino.atlas.query.PlanSource;
import io.github.chirino.atlas.query.QueryPlan;
import io.github.chirino.atlas.query.QueryTimeoutException;
import io.github.chirino.atlas.query.ScoredDocument;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory record store for local development and tests.
 *
 * <p>Each record is replaced atomically through {@link ConcurrentHashMap#compute}. Positioned
 * records are also kept in a date-sorted skip list that plays the part of the sorted view:
 * recency scans walk it in order and stop once {@code cap + 1} rows matched.
 */
@ApplicationScoped
public class MemoryRecordStore implements RecordStore {

    private static final int DEADLINE_CHECK_INTERVAL = 256;

    private record DateKey(LocalDate date, UUID id) {}

    private static final Comparator<DateKey> DATE_ORDER =
            Comparator.comparing(DateKey::date, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(DateKey::id);

    private final ConcurrentHashMap<UUID, DocumentRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentSkipListSet<DateKey> sortedView =
            new ConcurrentSkipListSet<>(DATE_ORDER);

    @Inject MemoryMetadataStore metadataStore;

    Clock clock = Clock.systemUTC();

    @Override
    public UpsertResult upsert(DocumentDraft draft) {
        UUID id = draft.documentId();
        String hash = draft.contentHash();
        Instant now = clock.instant();
        AtomicReference<UpsertOutcome> outcome = new AtomicReference<>();
        AtomicReference<Boolean> embeddingCurrent = new AtomicReference<>(false);
        records.compute(
                id,
                (key, existing) -> {
                    if (existing == null) {
                        outcome.set(UpsertOutcome.CREATED);
                        return new DocumentRecord(
                                id,
                                draft.source(),
                                draft.sourceId(),
                                draft.title(),
                                draft.abstractText(),
                                draft.primaryDate(),
                                null,
                                null,
                                hash,
                                null,
                                now,
                                now);
                    }
                    outcome.set(
                            hash.equals(existing.getContentHash())
                                    ? UpsertOutcome.UNCHANGED
                                    : UpsertOutcome.TEXT_CHANGED);
                    embeddingCurrent.set(
                            existing.hasEmbedding() && hash.equals(existing.getEmbeddingHash()));
                    DocumentRecord updated =
                            new DocumentRecord(
                                    id,
                                    draft.source(),
                                    draft.sourceId(),
                                    draft.title(),
                                    draft.abstractText(),
                                    draft.primaryDate(),
                                    existing.getEmbedding(),
                                    existing.getPosition(),
                                    hash,
                                    existing.getEmbeddingHash(),
                                    existing.getCreatedAt(),
                                    now);
                    reindex(existing, updated);
                    return updated;
                });
        return new UpsertResult(id, outcome.get(), embeddingCurrent.get());
    }

    @Override
    public Optional<DocumentRecord> findById(UUID id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public boolean writeEmbedding(UUID id, float[] embedding, String expectedContentHash) {
        AtomicReference<Boolean> written = new AtomicReference<>(false);
        records.computeIfPresent(
                id,
                (key, existing) -> {
                    if (!existing.getContentHash().equals(expectedContentHash)) {
                        return existing;
                    }
                    written.set(true);
                    return existing.withEmbedding(
                            embedding.clone(), expectedContentHash, clock.instant());
                });
        return written.get();
    }

    @Override
    public boolean writePosition(UUID id, Position position, String expectedEmbeddingHash) {
        AtomicReference<Boolean> written = new AtomicReference<>(false);
        records.computeIfPresent(
                id,
                (key, existing) -> {
                    boolean current =
                            Objects.equals(existing.getEmbeddingHash(), expectedEmbeddingHash);
                    if (!existing.hasEmbedding() || !current) {
                        return existing;
                    }
                    DocumentRecord updated = existing.withPosition(position, clock.instant());
                    reindex(existing, updated);
                    written.set(true);
                    return updated;
                });
        return written.get();
    }

    @Override
    public List<ScoredDocument> execute(QueryPlan plan, Duration timeout) {
        if (plan.source() == PlanSource.EMPTY) {
            return List.of();
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        PlanMatcher matcher = new PlanMatcher(plan);
        if (plan.source() == PlanSource.SORTED_VIEW) {
            return scanSortedView(plan, matcher, deadline, timeout);
        }
        return scanAll(plan, matcher, deadline, timeout);
    }

    private List<ScoredDocument> scanSortedView(
            QueryPlan plan, PlanMatcher matcher, long deadline, Duration timeout) {
        List<ScoredDocument> hits = new ArrayList<>();
        int scanned = 0;
        for (DateKey key : sortedView) {
            checkDeadline(++scanned, deadline, timeout);
            DocumentRecord record = records.get(key.id());
            if (record == null || !record.hasPosition()) {
                continue;
            }
            if (matcher.evaluate(record, Map.of()) != null) {
                hits.add(ScoredDocument.of(DocumentSummary.of(record), null));
                if (hits.size() >= plan.fetchLimit()) {
                    break;
                }
            }
        }
        return hits;
    }

    private List<ScoredDocument> scanAll(
            QueryPlan plan, PlanMatcher matcher, long deadline, Duration timeout) {
        Comparator<ScoredDocument> order = matcher.ordering();
        // Bounded heap holding the best fetchLimit hits; its head is the worst of them.
        PriorityQueue<ScoredDocument> best = new PriorityQueue<>(order.reversed());
        int scanned = 0;
        for (DocumentRecord record : records.values()) {
            checkDeadline(++scanned, deadline, timeout);
            Map<String, Object> metadata =
                    plan.needsMetadata() ? metadataStore.get(record.getId()) : Map.of();
            Double similarity = matcher.evaluate(record, metadata);
            if (similarity == null) {
                continue;
            }
            ScoredDocument hit =
                    ScoredDocument.of(
                            DocumentSummary.of(record), plan.isSemantic() ? similarity : null);
            best.add(hit);
            if (best.size() > plan.fetchLimit()) {
                best.poll();
            }
        }
        List<ScoredDocument> hits = new ArrayList<>(best);
        hits.sort(order);
        return hits;
    }

    private static void checkDeadline(int scanned, long deadline, Duration timeout) {
        if (scanned % DEADLINE_CHECK_INTERVAL == 0 && System.nanoTime() > deadline) {
            throw new QueryTimeoutException(timeout, null);
        }
    }

    private void reindex(DocumentRecord before, DocumentRecord after) {
        if (before.hasPosition()) {
            sortedView.remove(new DateKey(before.getPrimaryDate(), before.getId()));
        }
        if (after.hasPosition()) {
            sortedView.add(new DateKey(after.getPrimaryDate(), after.getId()));
        }
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
        sortedView.clear();
    }
}
