package io.github.chirino.atlas.query;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Renders a {@link QueryPlan} to PostgreSQL.
 *
 * <p>Spatial containment uses {@code point <@ box} (GiST-indexed), similarity uses pgvector's
 * cosine distance {@code <=>} (HNSW-indexed), metadata attributes are matched through an
 * {@code EXISTS} sub-select on {@code document_metadata}. Plans routed to the sorted view read
 * {@code mv_documents_by_date}, which only holds positioned records.
 *
 * <p>An HNSW scan hands back at most {@code hnsw.ef_search} candidates before the remaining
 * predicates are applied, which would silently shorten filtered or large semantic results.
 * Semantic plans therefore carry transaction-local settings that widen the candidate list and
 * switch on pgvector's ordered iterative scan (pgvector 0.8 or later).
 */
@ApplicationScoped
public class PgQueryRenderer {

    static final String BASE_TABLE = "documents";
    static final String SORTED_VIEW = "mv_documents_by_date";

    private static final String COLUMNS =
            "d.id, d.source, d.source_id, d.title, d.abstract, d.primary_date,"
                    + " d.position[0] AS x, d.position[1] AS y";

    static final int DEFAULT_EF_SEARCH = 40;
    static final int MAX_EF_SEARCH = 1000;
    static final int DEFAULT_MAX_SCAN_TUPLES = 100_000;

    @ConfigProperty(name = "atlas.query.hnsw.max-scan-tuples", defaultValue = "100000")
    int hnswMaxScanTuples;

    /**
     * @param settings configuration parameters to apply, transaction-local, before running the
     *     statement
     */
    public record RenderedQuery(
            String sql, List<Object> parameters, Map<String, String> settings) {}

    /** Settings that keep an HNSW index scan from dropping rows the plan should return. */
    public Map<String, String> settings(QueryPlan plan) {
        if (!plan.isSemantic()) {
            return Map.of();
        }
        int efSearch = Math.max(DEFAULT_EF_SEARCH, Math.min(MAX_EF_SEARCH, plan.fetchLimit()));
        Map<String, String> settings = new LinkedHashMap<>();
        settings.put("hnsw.ef_search", Integer.toString(efSearch));
        settings.put("hnsw.iterative_scan", "strict_order");
        int maxScanTuples = hnswMaxScanTuples > 0 ? hnswMaxScanTuples : DEFAULT_MAX_SCAN_TUPLES;
        settings.put(
                "hnsw.max_scan_tuples",
                Integer.toString(Math.max(maxScanTuples, plan.fetchLimit())));
        return settings;
    }

    public RenderedQuery render(QueryPlan plan) {
        if (plan.source() == PlanSource.EMPTY) {
            throw new IllegalArgumentException("Empty plans are not rendered");
        }
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS);

        String vectorParam = null;
        if (plan.isSemantic()) {
            vectorParam = bind(params, VectorMath.toPgVectorLiteral(plan.semantic().vector()));
            sql.append(", 1 - (d.embedding <=> CAST(")
                    .append(vectorParam)
                    .append(" AS vector)) AS similarity");
        }

        sql.append(" FROM ")
                .append(plan.source() == PlanSource.SORTED_VIEW ? SORTED_VIEW : BASE_TABLE)
                .append(" d WHERE d.position IS NOT NULL");

        for (FieldFilter filter : plan.filters()) {
            sql.append(" AND ").append(renderFilter(filter, params));
        }

        if (plan.box() != null) {
            BoundingBox box = plan.box();
            sql.append(" AND d.position <@ box(point(")
                    .append(bind(params, box.minX()))
                    .append(", ")
                    .append(bind(params, box.minY()))
                    .append("), point(")
                    .append(bind(params, box.maxX()))
                    .append(", ")
                    .append(bind(params, box.maxY()))
                    .append("))");
        }

        if (plan.isSemantic()) {
            sql.append(" AND d.embedding IS NOT NULL AND 1 - (d.embedding <=> CAST(")
                    .append(vectorParam)
                    .append(" AS vector)) >= ")
                    .append(bind(params, plan.semantic().similarityFloor()));
            sql.append(" ORDER BY d.embedding <=> CAST(")
                    .append(vectorParam)
                    .append(" AS vector), d.id");
        } else {
            sql.append(" ORDER BY d.primary_date DESC NULLS LAST, d.id");
        }

        sql.append(" LIMIT ").append(bind(params, plan.fetchLimit()));
        return new RenderedQuery(sql.toString(), params, settings(plan));
    }

    private String renderFilter(FieldFilter filter, List<Object> params) {
        FilterField field = filter.field();
        if (field.isMetadata()) {
            String key = bind(params, field.metadataKey());
            return "EXISTS (SELECT 1 FROM document_metadata m WHERE m.document_id = d.id AND "
                    + valuePredicate("m.attributes ->> " + key, filter, params)
                    + ")";
        }
        return switch (field.kind()) {
            case SOURCE -> valuePredicate("d.source", filter, params);
            case PRIMARY_DATE -> datePredicate(filter, params);
            default -> throw new IllegalStateException("Unhandled filter field " + field);
        };
    }

    private String valuePredicate(String column, FieldFilter filter, List<Object> params) {
        return switch (filter.operator()) {
            case EQUALS -> column + " = " + bind(params, filter.values().get(0));
            case IN -> {
                List<String> placeholders = new ArrayList<>();
                for (String value : filter.values()) {
                    placeholders.add(bind(params, value));
                }
                yield column + " IN (" + String.join(", ", placeholders) + ")";
            }
            case RANGE ->
                    throw new InvalidQueryException("Range filters are not supported on " + column);
        };
    }

    private String datePredicate(FieldFilter filter, List<Object> params) {
        List<String> parts = new ArrayList<>();
        if (filter.from() != null) {
            parts.add("d.primary_date >= " + bind(params, filter.from()));
        }
        if (filter.to() != null) {
            parts.add("d.primary_date <= " + bind(params, filter.to()));
        }
        return "(" + String.join(" AND ", parts) + ")";
    }

    private static String bind(List<Object> params, Object value) {
        params.add(value);
        return "?" + params.size();
    }
}
