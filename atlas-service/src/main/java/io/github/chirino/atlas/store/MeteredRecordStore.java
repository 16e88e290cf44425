package io.github.chirino.atlas.store;

import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.QueryPlan;
import io.github.chirino.atlas.query.ScoredDocument;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decorator that wraps a RecordStore implementation with timing metrics. All operations are
 * recorded using Micrometer timers with the metric name "atlas.store.operation" and an
 * "operation" tag identifying the method.
 */
public class MeteredRecordStore implements RecordStore {

    private final MeterRegistry registry;
    private final RecordStore delegate;

    public MeteredRecordStore(MeterRegistry registry, RecordStore delegate) {
        this.registry = registry;
        this.delegate = delegate;
    }

    @Override
    public UpsertResult upsert(DocumentDraft draft) {
        return registry.timer("atlas.store.operation", "operation", "upsert")
                .record(() -> delegate.upsert(draft));
    }

    @Override
    public Optional<DocumentRecord> findById(UUID id) {
        return registry.timer("atlas.store.operation", "operation", "findById")
                .record(() -> delegate.findById(id));
    }

    @Override
    public boolean writeEmbedding(UUID id, float[] embedding, String expectedContentHash) {
        return registry.timer("atlas.store.operation", "operation", "writeEmbedding")
                .record(() -> delegate.writeEmbedding(id, embedding, expectedContentHash));
    }

    @Override
    public boolean writePosition(UUID id, Position position, String expectedEmbeddingHash) {
        return registry.timer("atlas.store.operation", "operation", "writePosition")
                .record(() -> delegate.writePosition(id, position, expectedEmbeddingHash));
    }

    @Override
    public List<ScoredDocument> execute(QueryPlan plan, Duration timeout) {
        return registry.timer(
                        "atlas.store.operation",
                        "operation",
                        "execute",
                        "source",
                        plan.source().name().toLowerCase())
                .record(() -> delegate.execute(plan, timeout));
    }
}
