package io.github.chirino.atlas.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.List;

/**
 * Micrometer configuration for doc-atlas metrics.
 *
 * <ul>
 *   <li>atlas_enrichment_entries_total - processed queue entries by kind and outcome
 *   <li>atlas_query_execution_seconds_* - query latency by plan source and result status
 *   <li>atlas_store_operation_seconds_* - record store operation timing
 *   <li>agroal_* - database connection pool metrics
 * </ul>
 */
@ApplicationScoped
public class MetricsConfig {

    @Produces
    @Singleton
    public MeterFilter applicationTagFilter() {
        return MeterFilter.commonTags(List.of(Tag.of("application", "doc-atlas")));
    }

    /** Histogram buckets for latency timers so Prometheus can compute percentiles. */
    @Produces
    @Singleton
    public MeterFilter histogramFilter() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (id.getName().startsWith("http.server.requests")
                        || id.getName().startsWith("atlas.query.execution")
                        || id.getName().startsWith("atlas.store.operation")) {
                    return DistributionStatisticConfig.builder()
                            .percentiles(0.95, 0.99)
                            .percentilesHistogram(true)
                            .build()
                            .merge(config);
                }
                return config;
            }
        };
    }
}
