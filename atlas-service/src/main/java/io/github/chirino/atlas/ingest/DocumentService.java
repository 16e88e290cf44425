package io.github.chirino.atlas.ingest;

import io.github.chirino.atlas.config.EnrichmentQueueSelector;
import io.github.chirino.atlas.config.MetadataStoreSelector;
import io.github.chirino.atlas.config.RecordStoreSelector;
import io.github.chirino.atlas.metadata.MetadataEnrichers;
import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.queue.EnrichmentQueue;
import io.github.chirino.atlas.store.ResourceNotFoundException;
import io.github.chirino.atlas.store.UpsertOutcome;
import io.github.chirino.atlas.store.UpsertResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import java.util.Map;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Write path for ingested records. Every write that creates a record or changes its embedding
 * text queues an EMBEDDING entry, in the same transaction as the record itself. A write with
 * unchanged text queues nothing unless the record still lacks an embedding for that text.
 * Records of a source with a metadata enricher get a METADATA entry on every write, since the
 * write replaces the derived attributes along with the rest of the metadata.
 */
@ApplicationScoped
public class DocumentService {

    private static final Logger LOG = Logger.getLogger(DocumentService.class);

    @Inject RecordStoreSelector recordStoreSelector;

    @Inject MetadataStoreSelector metadataStoreSelector;

    @Inject EnrichmentQueueSelector queueSelector;

    @Inject MetadataEnrichers metadataEnrichers;

    @ConfigProperty(name = "atlas.enrichment.default-priority", defaultValue = "0")
    int defaultPriority;

    public record WriteResult(UUID id, boolean created, boolean enqueued) {}

    public WriteResult upsert(DocumentDraft draft) {
        return upsert(draft, defaultPriority);
    }

    @Transactional
    public WriteResult upsert(DocumentDraft draft, int priority) {
        UpsertResult result = recordStoreSelector.getStore().upsert(draft);
        metadataStoreSelector.getStore().put(result.id(), draft.source(), draft.metadata());

        EnrichmentQueue queue = queueSelector.getQueue();
        boolean enqueued = false;
        if (result.needsEmbedding()) {
            enqueued = queue.enqueue(result.id(), EnrichmentKind.EMBEDDING, priority);
        }
        if (metadataEnrichers.forSource(draft.source()).isPresent()) {
            queue.enqueue(result.id(), EnrichmentKind.METADATA, priority);
        }
        LOG.debugf(
                "Stored %s:%s as %s (%s, enqueued=%s)",
                draft.source(), draft.sourceId(), result.id(), result.outcome(), enqueued);
        return new WriteResult(result.id(), result.outcome() == UpsertOutcome.CREATED, enqueued);
    }

    public DocumentRecord get(UUID id) {
        return recordStoreSelector
                .getStore()
                .findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("document", id));
    }

    public Map<String, Object> metadata(UUID id) {
        return metadataStoreSelector.getStore().get(id);
    }
}
