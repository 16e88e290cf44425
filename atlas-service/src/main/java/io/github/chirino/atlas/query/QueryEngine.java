package io.github.chirino.atlas.query;

import io.github.chirino.atlas.config.MetadataStoreSelector;
import io.github.chirino.atlas.config.RecordStoreSelector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Executes viewport/filter/semantic queries against the enriched records.
 *
 * <p>Only positioned records are ever returned. Results are capped; when more rows matched the
 * result is marked {@link ResultStatus#TRUNCATED}. A query that runs out of time fails with
 * {@link QueryTimeoutException} rather than returning a partial list.
 */
@ApplicationScoped
public class QueryEngine {

    private static final Logger LOG = Logger.getLogger(QueryEngine.class);

    @Inject QueryPlanner planner;

    @Inject RecordStoreSelector recordStoreSelector;

    @Inject MetadataStoreSelector metadataStoreSelector;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "atlas.query.timeout", defaultValue = "PT10S")
    Duration timeout;

    public QueryResult execute(QuerySpec spec) {
        QueryPlan plan = planner.plan(spec);
        if (plan.source() == PlanSource.EMPTY) {
            meterRegistry.counter("atlas.query.empty").increment();
            return QueryResult.empty();
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            List<ScoredDocument> fetched = recordStoreSelector.getStore().execute(plan, timeout);
            QueryResult result =
                    QueryResult.fromFetch(withMetadata(fetched, plan), plan.cap(), plan.source());
            status = result.status().toValue();
            if (result.isTruncated()) {
                LOG.debugf(
                        "Query truncated at %d rows (source=%s, bbox=%s)",
                        plan.cap(), plan.source(), plan.box());
            }
            return result;
        } catch (QueryTimeoutException e) {
            status = "timeout";
            LOG.warnf(
                    "Query timed out after %s (source=%s, filters=%d, semantic=%s)",
                    timeout, plan.source(), plan.filters().size(), plan.isSemantic());
            throw e;
        } finally {
            sample.stop(
                    meterRegistry.timer(
                            "atlas.query.execution",
                            "source",
                            plan.source().name().toLowerCase(),
                            "status",
                            status));
        }
    }

    private List<ScoredDocument> withMetadata(List<ScoredDocument> hits, QueryPlan plan) {
        if (hits.isEmpty()) {
            return hits;
        }
        // Only the rows that are returned need their metadata.
        List<ScoredDocument> kept = hits.size() > plan.cap() ? hits.subList(0, plan.cap()) : hits;
        List<UUID> ids = new ArrayList<>(kept.size());
        for (ScoredDocument hit : kept) {
            ids.add(hit.document().id());
        }
        Map<UUID, Map<String, Object>> metadata = metadataStoreSelector.getStore().lookup(ids);
        List<ScoredDocument> enriched = new ArrayList<>(hits.size());
        for (ScoredDocument hit : hits) {
            Map<String, Object> values = metadata.get(hit.document().id());
            enriched.add(values == null ? hit : hit.withMetadata(values));
        }
        return enriched;
    }

    public Duration timeout() {
        return timeout;
    }
}
