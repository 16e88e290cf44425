package io.github.chirino.atlas.query;

import java.util.List;

/**
 * Storage-independent predicate set produced by {@link QueryPlanner}.
 *
 * <p>Every plan implicitly requires a non-null position. Semantic plans additionally require a
 * non-null embedding and the similarity floor. {@link #fetchLimit()} is one more than the cap so
 * the engine can tell a complete result from a truncated one; the limit is always applied after
 * every predicate and the ordering.
 */
public record QueryPlan(
        PlanSource source,
        List<FieldFilter> filters,
        BoundingBox box,
        SemanticQuery semantic,
        OrderingMode ordering,
        int cap) {

    public QueryPlan {
        filters = List.copyOf(filters);
    }

    public static QueryPlan empty(QuerySpec spec) {
        return new QueryPlan(
                PlanSource.EMPTY,
                spec.filters(),
                spec.box(),
                spec.semantic(),
                spec.ordering(),
                spec.cap());
    }

    public int fetchLimit() {
        return cap + 1;
    }

    public boolean isSemantic() {
        return semantic != null;
    }

    public boolean needsMetadata() {
        return filters.stream().anyMatch(f -> f.field().isMetadata());
    }
}
