package io.github.chirino.atlas.store;

import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.DocumentSummary;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.PgQueryRenderer;
import io.github.chirino.atlas.query.PgQueryRenderer.RenderedQuery;
import io.github.chirino.atlas.query.PlanSource;
import io.github.chirino.atlas.query.QueryPlan;
import io.github.chirino.atlas.query.QueryTimeoutException;
import io.github.chirino.atlas.query.ScoredDocument;
import io.github.chirino.atlas.query.VectorMath;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Query;
import jakarta.transaction.Transactional;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * PostgreSQL record store. The {@code documents} table carries a pgvector {@code embedding}
 * column and a GiST-indexed {@code point} position; a CHECK constraint rejects a position
 * without an embedding.
 */
@ApplicationScoped
public class PgRecordStore implements RecordStore {

    private static final Logger LOG = Logger.getLogger(PgRecordStore.class);

    // PostgreSQL "query_canceled", raised when statement_timeout fires.
    private static final String QUERY_CANCELED = "57014";

    private static final String SELECT_RECORD =
            "SELECT id, source, source_id, title, abstract, primary_date, embedding::text,"
                    + " position[0], position[1], content_hash, embedding_hash, created_at,"
                    + " updated_at"
                    + " FROM documents WHERE id = ?1";

    @Inject EntityManager entityManager;

    @Inject PgQueryRenderer renderer;

    @Override
    @Transactional
    public UpsertResult upsert(DocumentDraft draft) {
        UUID id = draft.documentId();
        String hash = draft.contentHash();
        @SuppressWarnings("unchecked")
        List<Object[]> rows =
                entityManager
                        .createNativeQuery(
                                "WITH previous AS (SELECT content_hash, embedding_hash FROM"
                                        + " documents WHERE id = ?1) INSERT INTO documents (id,"
                                        + " source, source_id, title, abstract, primary_date,"
                                        + " content_hash,"
                                        + " created_at, updated_at) VALUES (?1, ?2, ?3, ?4, ?5,"
                                        + " CAST(NULLIF(?6, '') AS date), ?7, NOW(), NOW())"
                                        + " ON CONFLICT (id) DO UPDATE SET source ="
                                        + " EXCLUDED.source, source_id = EXCLUDED.source_id,"
                                        + " title = EXCLUDED.title, abstract = EXCLUDED.abstract,"
                                        + " primary_date = EXCLUDED.primary_date, content_hash ="
                                        + " EXCLUDED.content_hash, updated_at = NOW()"
                                        + " RETURNING id, (SELECT content_hash FROM previous),"
                                        + " (SELECT embedding_hash FROM previous)")
                        .setParameter(1, id)
                        .setParameter(2, draft.source())
                        .setParameter(3, draft.sourceId())
                        .setParameter(4, nullToEmpty(draft.title()))
                        .setParameter(5, nullToEmpty(draft.abstractText()))
                        .setParameter(
                                6,
                                draft.primaryDate() == null ? "" : draft.primaryDate().toString())
                        .setParameter(7, hash)
                        .getResultList();
        String previousHash = rows.isEmpty() ? null : (String) rows.get(0)[1];
        String embeddingHash = rows.isEmpty() ? null : (String) rows.get(0)[2];
        UpsertOutcome outcome;
        if (previousHash == null) {
            outcome = UpsertOutcome.CREATED;
        } else if (previousHash.equals(hash)) {
            outcome = UpsertOutcome.UNCHANGED;
        } else {
            outcome = UpsertOutcome.TEXT_CHANGED;
        }
        LOG.debugf("Upserted document %s (%s)", id, outcome);
        return new UpsertResult(id, outcome, hash.equals(embeddingHash));
    }

    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public Optional<DocumentRecord> findById(UUID id) {
        List<Object[]> rows =
                entityManager.createNativeQuery(SELECT_RECORD).setParameter(1, id).getResultList();
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Object[] row = rows.get(0);
        Position position =
                row[7] == null ? null : new Position(toDouble(row[7]), toDouble(row[8]));
        return Optional.of(
                new DocumentRecord(
                        (UUID) row[0],
                        (String) row[1],
                        (String) row[2],
                        (String) row[3],
                        (String) row[4],
                        SqlValues.toLocalDate(row[5]),
                        VectorMath.parsePgVector((String) row[6]),
                        position,
                        (String) row[9],
                        (String) row[10],
                        SqlValues.toInstant(row[11]),
                        SqlValues.toInstant(row[12])));
    }

    @Override
    @Transactional
    public boolean writeEmbedding(UUID id, float[] embedding, String expectedContentHash) {
        int updated =
                entityManager
                        .createNativeQuery(
                                "UPDATE documents SET embedding = CAST(?2 AS vector),"
                                        + " embedding_hash = ?3, updated_at = NOW()"
                                        + " WHERE id = ?1 AND content_hash = ?3")
                        .setParameter(1, id)
                        .setParameter(2, VectorMath.toPgVectorLiteral(embedding))
                        .setParameter(3, expectedContentHash)
                        .executeUpdate();
        return updated > 0;
    }

    @Override
    @Transactional
    public boolean writePosition(UUID id, Position position, String expectedEmbeddingHash) {
        int updated =
                entityManager
                        .createNativeQuery(
                                "UPDATE documents SET position = point(?2, ?3), updated_at = NOW()"
                                        + " WHERE id = ?1 AND embedding IS NOT NULL"
                                        + " AND embedding_hash = ?4")
                        .setParameter(1, id)
                        .setParameter(2, position.x())
                        .setParameter(3, position.y())
                        .setParameter(4, expectedEmbeddingHash)
                        .executeUpdate();
        return updated > 0;
    }

    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public List<ScoredDocument> execute(QueryPlan plan, Duration timeout) {
        if (plan.source() == PlanSource.EMPTY) {
            return List.of();
        }
        RenderedQuery rendered = renderer.render(plan);
        for (Map.Entry<String, String> setting : rendered.settings().entrySet()) {
            entityManager
                    .createNativeQuery("SELECT set_config(?1, ?2, true)")
                    .setParameter(1, setting.getKey())
                    .setParameter(2, setting.getValue())
                    .getSingleResult();
        }
        LOG.debugf("Executing %s with %s", rendered.sql(), rendered.settings());
        Query query = entityManager.createNativeQuery(rendered.sql());
        List<Object> params = rendered.parameters();
        for (int i = 0; i < params.size(); i++) {
            query.setParameter(i + 1, params.get(i));
        }
        query.setHint("jakarta.persistence.query.timeout", (int) Math.max(1, timeout.toMillis()));

        List<Object[]> rows;
        try {
            rows = query.getResultList();
        } catch (jakarta.persistence.QueryTimeoutException e) {
            throw new QueryTimeoutException(timeout, e);
        } catch (PersistenceException e) {
            if (isQueryCanceled(e)) {
                throw new QueryTimeoutException(timeout, e);
            }
            throw e;
        }

        List<ScoredDocument> hits = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            DocumentSummary summary =
                    new DocumentSummary(
                            (UUID) row[0],
                            (String) row[1],
                            (String) row[2],
                            (String) row[3],
                            (String) row[4],
                            SqlValues.toLocalDate(row[5]),
                            new Position(toDouble(row[6]), toDouble(row[7])));
            Double similarity = plan.isSemantic() ? toDouble(row[8]) : null;
            hits.add(ScoredDocument.of(summary, similarity));
        }
        return hits;
    }

    private static boolean isQueryCanceled(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && QUERY_CANCELED.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
