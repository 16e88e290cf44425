package io.github.chirino.atlas.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable description of one viewport/filter/semantic request. Built fresh per request.
 *
 * <p>When a semantic query is present the ordering is always {@link OrderingMode#SIMILARITY};
 * asking for similarity ordering without a semantic query is rejected.
 */
public final class QuerySpec {

    public static final int MAX_CAP = 50_000;

    private final BoundingBox box;
    private final List<FieldFilter> filters;
    private final SemanticQuery semantic;
    private final OrderingMode ordering;
    private final int cap;

    private QuerySpec(Builder builder) {
        this.box = builder.box;
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.semantic = builder.semantic;
        this.cap = builder.cap;
        if (semantic != null) {
            this.ordering = OrderingMode.SIMILARITY;
        } else if (builder.ordering == OrderingMode.SIMILARITY) {
            throw new InvalidQueryException("Similarity ordering requires a semantic query");
        } else {
            this.ordering = OrderingMode.RECENCY;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public BoundingBox box() {
        return box;
    }

    public List<FieldFilter> filters() {
        return filters;
    }

    public SemanticQuery semantic() {
        return semantic;
    }

    public OrderingMode ordering() {
        return ordering;
    }

    public int cap() {
        return cap;
    }

    public static final class Builder {
        private BoundingBox box;
        private final List<FieldFilter> filters = new ArrayList<>();
        private SemanticQuery semantic;
        private OrderingMode ordering;
        private int cap = 5_000;

        private Builder() {}

        public Builder box(BoundingBox box) {
            this.box = box;
            return this;
        }

        public Builder filter(FieldFilter filter) {
            this.filters.add(filter);
            return this;
        }

        public Builder filters(List<FieldFilter> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder semantic(SemanticQuery semantic) {
            this.semantic = semantic;
            return this;
        }

        public Builder ordering(OrderingMode ordering) {
            this.ordering = ordering;
            return this;
        }

        public Builder cap(int cap) {
            if (cap < 1 || cap > MAX_CAP) {
                throw new InvalidQueryException(
                        "Limit must be between 1 and " + MAX_CAP + ", got " + cap);
            }
            this.cap = cap;
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(this);
        }
    }
}
