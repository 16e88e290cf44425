package io.github.chirino.atlas.query;

import java.util.List;

/**
 * Ordered hits plus whether more rows matched than the cap allowed. A truncated result is a
 * sample the caller should narrow, not an error.
 */
public record QueryResult(List<ScoredDocument> items, ResultStatus status, PlanSource source) {

    public QueryResult {
        items = List.copyOf(items);
    }

    public static QueryResult empty() {
        return new QueryResult(List.of(), ResultStatus.COMPLETE, PlanSource.EMPTY);
    }

    /** Trims a {@code cap + 1} fetch down to the cap and records whether it overflowed. */
    public static QueryResult fromFetch(List<ScoredDocument> fetched, int cap, PlanSource source) {
        if (fetched.size() > cap) {
            return new QueryResult(fetched.subList(0, cap), ResultStatus.TRUNCATED, source);
        }
        return new QueryResult(fetched, ResultStatus.COMPLETE, source);
    }

    public boolean isTruncated() {
        return status == ResultStatus.TRUNCATED;
    }
}
