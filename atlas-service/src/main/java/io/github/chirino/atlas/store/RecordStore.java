package io.github.chirino.atlas.store;

import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.QueryPlan;
import io.github.chirino.atlas.query.ScoredDocument;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable storage for documents and their enrichment columns.
 *
 * <p>Implementations must never store a position for a record without an embedding; {@link
 * #writePosition} is a guarded write that refuses instead.
 */
public interface RecordStore {

    /**
     * Inserts or updates the core fields of a record. Enrichment columns are left untouched.
     *
     * @return the record id and whether its embedding text is new or changed
     */
    UpsertResult upsert(DocumentDraft draft);

    Optional<DocumentRecord> findById(UUID id);

    /**
     * Stores the embedding of an existing record, provided its text has not changed since the
     * embedding was computed.
     *
     * @param expectedContentHash content hash of the text the embedding was computed from
     * @return {@code false} if the record does not exist or its text has changed since
     */
    boolean writeEmbedding(UUID id, float[] embedding, String expectedContentHash);

    /**
     * Stores the position of an existing record, provided its embedding is still the one the
     * position was computed from.
     *
     * @param expectedEmbeddingHash embedding hash of the record the position was computed from
     * @return {@code false} if the record does not exist, has no embedding, or was re-embedded
     */
    boolean writePosition(UUID id, Position position, String expectedEmbeddingHash);

    /**
     * Runs a non-empty plan, returning at most {@link QueryPlan#fetchLimit()} hits in plan order.
     *
     * @throws io.github.chirino.atlas.query.QueryTimeoutException when the timeout elapses
     */
    List<ScoredDocument> execute(QueryPlan plan, Duration timeout);
}
