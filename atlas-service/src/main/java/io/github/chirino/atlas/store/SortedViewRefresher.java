package io.github.chirino.atlas.store;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Refreshes the date-sorted materialized view that serves recency-ordered queries. Newly
 * positioned records become visible to those queries at the next refresh; the view is
 * refreshed concurrently so readers are never blocked.
 */
@ApplicationScoped
public class SortedViewRefresher {

    private static final Logger LOG = Logger.getLogger(SortedViewRefresher.class);

    @ConfigProperty(name = "atlas.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject EntityManager entityManager;

    @Scheduled(
            every = "${atlas.query.sorted-view.refresh-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledRefresh() {
        if (!datastoreType.trim().toLowerCase().startsWith("postgres")) {
            return;
        }
        try {
            refresh();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Refreshing mv_documents_by_date failed, will retry next interval");
        }
    }

    @Transactional
    public void refresh() {
        long start = System.currentTimeMillis();
        entityManager
                .createNativeQuery("REFRESH MATERIALIZED VIEW CONCURRENTLY mv_documents_by_date")
                .executeUpdate();
        LOG.debugf("Refreshed mv_documents_by_date in %dms", System.currentTimeMillis() - start);
    }
}
