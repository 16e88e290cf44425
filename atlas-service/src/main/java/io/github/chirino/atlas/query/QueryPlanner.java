package io.github.chirino.atlas.query;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Turns a {@link QuerySpec} into the narrowest index-supported {@link QueryPlan}.
 *
 * <p>Recency-ordered plans whose predicates only touch columns of the sorted projection are
 * routed to {@link PlanSource#SORTED_VIEW}, so the store can stop after {@code cap + 1} rows
 * instead of sorting every match.
 */
@ApplicationScoped
public class QueryPlanner {

    private static final Logger LOG = Logger.getLogger(QueryPlanner.class);

    public QueryPlan plan(QuerySpec spec) {
        if (spec.box() != null && spec.box().isEmpty()) {
            LOG.debugf("Empty bounding box %s, returning empty plan", spec.box());
            return QueryPlan.empty(spec);
        }
        for (FieldFilter filter : spec.filters()) {
            if (filter.isUnsatisfiable()) {
                LOG.debugf("Unsatisfiable filter %s, returning empty plan", filter);
                return QueryPlan.empty(spec);
            }
        }

        PlanSource source =
                coveredBySortedView(spec) ? PlanSource.SORTED_VIEW : PlanSource.BASE_TABLE;
        QueryPlan plan =
                new QueryPlan(
                        source,
                        spec.filters(),
                        spec.box(),
                        spec.semantic(),
                        spec.ordering(),
                        spec.cap());
        LOG.debugf(
                "Planned query: source=%s, filters=%d, bbox=%s, semantic=%s, cap=%d",
                source, spec.filters().size(), spec.box(), spec.semantic() != null, spec.cap());
        return plan;
    }

    private boolean coveredBySortedView(QuerySpec spec) {
        if (spec.semantic() != null || spec.ordering() != OrderingMode.RECENCY) {
            return false;
        }
        // The sorted projection only carries the core columns; metadata filters need the join.
        return spec.filters().stream().noneMatch(f -> f.field().isMetadata());
    }
}
