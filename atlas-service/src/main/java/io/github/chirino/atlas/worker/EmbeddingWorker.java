package io.github.chirino.atlas.worker;

import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import io.github.chirino.atlas.embedding.EmbeddingService;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueEntry;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Computes embeddings for EMBEDDING entries, then queues the record for projection. The
 * projection entry is only created after the embedding is stored.
 */
@ApplicationScoped
public class EmbeddingWorker extends EnrichmentWorker {

    private static final Logger LOG = Logger.getLogger(EmbeddingWorker.class);

    @Inject EmbeddingService embeddingService;

    @ConfigProperty(name = "atlas.embedding.dimensions", defaultValue = "1536")
    int dimensions;

    @ConfigProperty(name = "atlas.enrichment.embedding.parallelism", defaultValue = "4")
    int parallelism;

    @ConfigProperty(name = "atlas.enrichment.embedding.batch-size", defaultValue = "32")
    int batchSize;

    @ConfigProperty(name = "atlas.enrichment.max-batches-per-run", defaultValue = "10")
    int maxBatchesPerRun;

    @Scheduled(
            every = "${atlas.enrichment.embedding.interval:10s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void run() {
        drain();
    }

    @Override
    protected EnrichmentKind kind() {
        return EnrichmentKind.EMBEDDING;
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
        return embeddingService.isEnabled();
    }

    @Override
    protected Outcome process(QueueEntry entry) throws EnrichmentFailure {
        DocumentRecord record =
                store().findById(entry.documentId())
                        .orElseThrow(
                                () ->
                                        EnrichmentFailure.permanent(
                                                "Document " + entry.documentId() + " not found"));
        String text = record.embeddingText();
        if (text.isBlank()) {
            throw EnrichmentFailure.permanent("Document has no text to embed");
        }

        float[] embedding;
        try {
            embedding =
                    providerCalls.call(
                            "Embedding " + embeddingService.modelId(),
                            () -> embeddingService.embed(text));
        } catch (EmbeddingProviderException e) {
            throw e.isTransient()
                    ? EnrichmentFailure.retryable(e.getMessage(), e)
                    : EnrichmentFailure.permanent(e.getMessage(), e);
        }
        if (embedding == null || embedding.length != dimensions) {
            throw EnrichmentFailure.permanent(
                    "Embedding provider returned "
                            + (embedding == null ? 0 : embedding.length)
                            + " dimensions, expected "
                            + dimensions);
        }

        if (!store().writeEmbedding(record.getId(), embedding, record.getContentHash())) {
            if (store().findById(record.getId()).isEmpty()) {
                throw EnrichmentFailure.permanent("Document " + record.getId() + " was removed");
            }
            LOG.debugf("Text of document %s changed while embedding, resubmitting", record.getId());
            return Outcome.RESUBMIT;
        }
        queue().enqueue(record.getId(), EnrichmentKind.PROJECTION, entry.priority());
        return Outcome.DONE;
    }

    @PreDestroy
    void shutdown() {
        shutdownPool();
    }
}
