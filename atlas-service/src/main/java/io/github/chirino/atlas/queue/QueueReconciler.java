package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.config.EnrichmentQueueSelector;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Releases entries whose worker died mid-processing. Together with at-least-once delivery this
 * means a crash delays an entry by at most the stale threshold plus one interval. Also purges
 * finished entries once they are older than the retention period.
 */
@ApplicationScoped
public class QueueReconciler {

    private static final Logger LOG = Logger.getLogger(QueueReconciler.class);

    @Inject EnrichmentQueueSelector queueSelector;

    @ConfigProperty(name = "atlas.queue.stale-threshold", defaultValue = "PT10M")
    Duration staleThreshold;

    @ConfigProperty(name = "atlas.queue.done-retention", defaultValue = "P7D")
    Duration doneRetention;

    @Scheduled(
            every = "${atlas.queue.reconcile-interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void reconcile() {
        int released = reconcileNow();
        if (released > 0) {
            LOG.warnf(
                    "Reconciled %d stale enrichment entries claimed more than %s ago",
                    released, staleThreshold);
        }
    }

    public int reconcileNow() {
        return queueSelector.getQueue().reconcileStale(staleThreshold);
    }

    @Scheduled(
            every = "${atlas.queue.purge-interval:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void purge() {
        try {
            int purged = purgeNow();
            if (purged > 0) {
                LOG.infof(
                        "Purged %d finished enrichment entries older than %s",
                        purged, doneRetention);
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Purging finished enrichment entries failed, will retry next interval");
        }
    }

    public int purgeNow() {
        return queueSelector.getQueue().purgeDone(doneRetention);
    }
}
