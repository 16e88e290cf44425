package io.github.chirino.atlas.worker;

import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.model.QueueEntry;
import io.github.chirino.atlas.projection.ProjectionException;
import io.github.chirino.atlas.projection.ProjectionModel;
import io.github.chirino.atlas.projection.ProjectionModelRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Objects;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Places embedded records on the 2-D map by applying the cached projection model. Positions are
 * computed one record at a time against a fixed model, so existing points never move when new
 * records arrive. A position is only stored against the embedding it was computed from; when the
 * record is re-embedded meanwhile the entry is resubmitted. Without a model this worker does not
 * claim.
 */
@ApplicationScoped
public class ProjectionWorker extends EnrichmentWorker {

    private static final Logger LOG = Logger.getLogger(ProjectionWorker.class);

    @Inject ProjectionModelRegistry modelRegistry;

    @ConfigProperty(name = "atlas.enrichment.projection.parallelism", defaultValue = "2")
    int parallelism;

    @ConfigProperty(name = "atlas.enrichment.projection.batch-size", defaultValue = "256")
    int batchSize;

    @ConfigProperty(name = "atlas.enrichment.max-batches-per-run", defaultValue = "10")
    int maxBatchesPerRun;

    @Scheduled(
            every = "${atlas.enrichment.projection.interval:10s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void run() {
        drain();
    }

    @Override
    protected EnrichmentKind kind() {
        return EnrichmentKind.PROJECTION;
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
        return modelRegistry.current().isPresent();
    }

    @Override
    protected Outcome process(QueueEntry entry) throws EnrichmentFailure {
        ProjectionModel model =
                modelRegistry
                        .current()
                        .orElseThrow(
                                () -> EnrichmentFailure.retryable("No projection model loaded"));
        DocumentRecord record =
                store().findById(entry.documentId())
                        .orElseThrow(
                                () ->
                                        EnrichmentFailure.permanent(
                                                "Document " + entry.documentId() + " not found"));
        if (!record.hasEmbedding()) {
            throw EnrichmentFailure.retryable(
                    "Document " + record.getId() + " has no embedding yet");
        }

        Position position;
        try {
            position = model.project(record.getEmbedding());
        } catch (ProjectionException e) {
            throw EnrichmentFailure.permanent(e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw EnrichmentFailure.permanent(
                    "Projection model " + model.version() + " produced an invalid point", e);
        }

        if (!store().writePosition(record.getId(), position, record.getEmbeddingHash())) {
            DocumentRecord current =
                    store().findById(record.getId())
                            .orElseThrow(
                                    () ->
                                            EnrichmentFailure.permanent(
                                                    "Document " + record.getId() + " was removed"));
            if (current.hasEmbedding()
                    && !Objects.equals(current.getEmbeddingHash(), record.getEmbeddingHash())) {
                LOG.debugf(
                        "Document %s was re-embedded while projecting, resubmitting",
                        record.getId());
                return Outcome.RESUBMIT;
            }
            throw EnrichmentFailure.retryable(
                    "Position of document " + record.getId() + " was not written");
        }
        return Outcome.DONE;
    }

    @PreDestroy
    void shutdown() {
        shutdownPool();
    }
}
