package io.github.chirino.atlas.worker;

import io.github.chirino.atlas.config.MetadataStoreSelector;
import io.github.chirino.atlas.metadata.MetadataEnricher;
import io.github.chirino.atlas.metadata.MetadataEnrichers;
import io.github.chirino.atlas.metadata.MetadataStore;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueEntry;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Merges source-specific derived attributes into a record's metadata using the enricher that
 * supports the record's source. Only the derived keys are written.
 */
@ApplicationScoped
public class MetadataWorker extends EnrichmentWorker {

    private static final Logger LOG = Logger.getLogger(MetadataWorker.class);

    @Inject MetadataEnrichers enrichers;

    @Inject MetadataStoreSelector metadataStoreSelector;

    @ConfigProperty(name = "atlas.enrichment.metadata.parallelism", defaultValue = "2")
    int parallelism;

    @ConfigProperty(name = "atlas.enrichment.metadata.batch-size", defaultValue = "100")
    int batchSize;

    @ConfigProperty(name = "atlas.enrichment.max-batches-per-run", defaultValue = "10")
    int maxBatchesPerRun;

    @Scheduled(
            every = "${atlas.enrichment.metadata.interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void run() {
        drain();
    }

    @Override
    protected EnrichmentKind kind() {
        return EnrichmentKind.METADATA;
    }

    @Override
    protected int parallelism() {
        return parallelism;
    }

    @Override
    protected int batchSize() {
        return batchSize;
    }

    @Override
    protected int maxBatchesPerRun() {
        return maxBatchesPerRun;
    }

    @Override
    protected boolean isReady() {
        return !enrichers.isEmpty();
    }

    @Override
    protected Outcome process(QueueEntry entry) throws EnrichmentFailure {
        DocumentRecord record =
                store().findById(entry.documentId())
                        .orElseThrow(
                                () ->
                                        EnrichmentFailure.permanent(
                                                "Document " + entry.documentId() + " not found"));
        MetadataEnricher enricher =
                enrichers
                        .forSource(record.getSource())
                        .orElseThrow(
                                () ->
                                        EnrichmentFailure.permanent(
                                                "No metadata enricher for source "
                                                        + record.getSource()));

        MetadataStore metadata = metadataStoreSelector.getStore();
        Map<String, Object> current = metadata.get(record.getId());
        Map<String, Object> derived =
                providerCalls.call(
                        "Metadata enricher " + enricher.name(),
                        () -> enricher.enrich(record, current));
        if (derived == null || derived.isEmpty()) {
            LOG.debugf("Enricher %s derived nothing for %s", enricher.name(), record.getId());
            return Outcome.DONE;
        }
        metadata.merge(record.getId(), record.getSource(), derived);
        return Outcome.DONE;
    }

    @PreDestroy
    void shutdown() {
        shutdownPool();
    }
}
