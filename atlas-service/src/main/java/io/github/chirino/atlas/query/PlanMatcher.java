package io.github.chirino.atlas.query;

import io.github.chirino.atlas.model.DocumentRecord;
import java.util.Comparator;
import java.util.Map;

/**
 * Evaluates a {@link QueryPlan} against records held in memory. The predicate set is the one
 * {@link PgQueryRenderer} renders to SQL.
 */
public final class PlanMatcher {

    /** Newest first, undated last, id as the tie-break. */
    public static final Comparator<ScoredDocument> RECENCY_ORDER =
            Comparator.comparing(
                            (ScoredDocument d) -> d.document().primaryDate(),
                            Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(d -> d.document().id());

    /** Most similar first, id as the tie-break. */
    public static final Comparator<ScoredDocument> SIMILARITY_ORDER =
            Comparator.comparing((ScoredDocument d) -> d.similarity(), Comparator.reverseOrder())
                    .thenComparing(d -> d.document().id());

    private final QueryPlan plan;
    private final float[] queryVector;

    public PlanMatcher(QueryPlan plan) {
        this.plan = plan;
        this.queryVector = plan.semantic() == null ? null : plan.semantic().vector();
    }

    public Comparator<ScoredDocument> ordering() {
        return plan.ordering() == OrderingMode.SIMILARITY ? SIMILARITY_ORDER : RECENCY_ORDER;
    }

    /**
     * Returns the similarity for semantic plans, {@code NaN} for non-semantic matches, or
     * {@code null} when the record does not match.
     */
    public Double evaluate(DocumentRecord record, Map<String, Object> metadata) {
        if (!record.hasPosition()) {
            return null;
        }
        if (plan.box() != null && !plan.box().contains(record.getPosition())) {
            return null;
        }
        for (FieldFilter filter : plan.filters()) {
            if (!matches(filter, record, metadata)) {
                return null;
            }
        }
        if (plan.semantic() == null) {
            return Double.NaN;
        }
        if (!record.hasEmbedding()) {
            return null;
        }
        double similarity = VectorMath.cosineSimilarity(queryVector, record.getEmbedding());
        if (Double.isNaN(similarity) || similarity < plan.semantic().similarityFloor()) {
            return null;
        }
        return similarity;
    }

    private static boolean matches(
            FieldFilter filter, DocumentRecord record, Map<String, Object> metadata) {
        return switch (filter.field().kind()) {
            case SOURCE -> filter.matches(record.getSource());
            case PRIMARY_DATE -> filter.matches(record.getPrimaryDate());
            case METADATA -> {
                Object value = metadata == null ? null : metadata.get(filter.field().metadataKey());
                yield value != null && filter.matches(String.valueOf(value));
            }
        };
    }
}
