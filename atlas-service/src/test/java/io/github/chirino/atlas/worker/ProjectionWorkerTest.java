package io.github.chirino.atlas.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.atlas.config.TestBackend;
import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.model.QueueEntry;
import io.github.chirino.atlas.model.QueueStatus;
import io.github.chirino.atlas.projection.LinearProjectionModel;
import io.github.chirino.atlas.projection.ProjectionModel;
import io.github.chirino.atlas.projection.ProjectionModelRegistry;
import io.github.chirino.atlas.projection.ProjectionModels;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectionWorkerTest {

    private TestBackend backend;

    @BeforeEach
    void setUp() {
        backend = new TestBackend();
    }

    private UUID embedded(String sourceId, float[] embedding) {
        DocumentDraft draft = new DocumentDraft("arxiv", sourceId, "Title", "Abstract", null, null);
        UUID id = backend.records.upsert(draft).id();
        backend.records.writeEmbedding(id, embedding, draft.contentHash());
        backend.queue.enqueue(id, EnrichmentKind.PROJECTION, 0);
        return id;
    }

    private QueueEntry onlyEntry() {
        return backend.queue.entries().get(0);
    }

    @Test
    void places_embedded_documents_with_the_current_model() {
        UUID id = embedded("1", new float[] {0.25f, -0.5f, 0.9f});
        ProjectionWorker worker =
                Workers.projection(
                        backend, ProjectionModels.registry(ProjectionModels.identity("v1", 3)));

        assertEquals(1, worker.drain());

        DocumentRecord record = backend.records.findById(id).orElseThrow();
        assertEquals(new Position(0.25, -0.5), record.getPosition());
        assertEquals(QueueStatus.DONE, onlyEntry().status());
    }

    @Test
    void idles_without_a_model() {
        UUID id = embedded("1", new float[] {1, 0, 0});
        ProjectionModelRegistry registry = ProjectionModels.registry(null);
        ProjectionWorker worker = Workers.projection(backend, registry);

        assertEquals(0, worker.drain());
        assertEquals(QueueStatus.PENDING, onlyEntry().status());
        assertEquals(0, onlyEntry().attempts());

        registry.publish(ProjectionModels.identity("v1", 3));
        assertEquals(1, worker.drain());
        assertTrue(backend.records.findById(id).orElseThrow().hasPosition());
    }

    @Test
    void dimension_mismatch_fails_permanently() {
        UUID id = embedded("1", new float[] {1, 0, 0, 0});
        ProjectionWorker worker =
                Workers.projection(
                        backend, ProjectionModels.registry(ProjectionModels.identity("v1", 3)));

        worker.drain();

        assertEquals(QueueStatus.FAILED, onlyEntry().status());
        assertTrue(onlyEntry().lastError().contains("expects 3"));
        assertFalse(backend.records.findById(id).orElseThrow().hasPosition());
    }

    @Test
    void positions_do_not_move_when_more_documents_arrive() {
        ProjectionWorker worker =
                Workers.projection(
                        backend, ProjectionModels.registry(ProjectionModels.identity("v1", 3)));
        UUID first = embedded("1", new float[] {0.1f, 0.2f, 0.3f});
        worker.drain();
        Position before = backend.records.findById(first).orElseThrow().getPosition();

        for (int i = 2; i < 20; i++) {
            embedded(String.valueOf(i), new float[] {i, -i, 0});
        }
        worker.drain();

        assertEquals(before, backend.records.findById(first).orElseThrow().getPosition());
    }

    @Test
    void re_embedding_during_projection_resubmits_instead_of_storing_a_stale_position() {
        UUID id = embedded("1", new float[] {0.25f, -0.5f, 0.9f});
        LinearProjectionModel identity = ProjectionModels.identity("v1", 3);
        AtomicBoolean raced = new AtomicBoolean();
        // Re-embeds the record the first time it is projected, like a concurrent text change
        // followed by an embedding worker run.
        ProjectionModel racing =
                new ProjectionModel() {
                    @Override
                    public String version() {
                        return "v1";
                    }

                    @Override
                    public int inputDimensions() {
                        return 3;
                    }

                    @Override
                    public Position project(float[] embedding) {
                        if (raced.compareAndSet(false, true)) {
                            DocumentDraft changed =
                                    new DocumentDraft(
                                            "arxiv", "1", "Title", "Revised", null, null);
                            backend.records.upsert(changed);
                            backend.records.writeEmbedding(
                                    id, new float[] {-0.75f, 0.5f, 0.1f}, changed.contentHash());
                            assertFalse(backend.queue.enqueue(id, EnrichmentKind.PROJECTION, 0));
                        }
                        return identity.project(embedding);
                    }
                };
        ProjectionWorker worker = Workers.projection(backend, ProjectionModels.registry(racing));

        worker.drain();

        assertFalse(backend.records.findById(id).orElseThrow().hasPosition());
        List<QueueEntry> open =
                backend.queue.entries().stream()
                        .filter(e -> e.status() == QueueStatus.PENDING)
                        .toList();
        assertEquals(1, open.size());

        worker.drain();

        assertEquals(
                new Position(-0.75, 0.5),
                backend.records.findById(id).orElseThrow().getPosition());
        assertEquals(
                1.0,
                backend.meterRegistry
                        .counter(
                                "atlas.enrichment.entries",
                                "kind",
                                "projection",
                                "outcome",
                                "resubmitted")
                        .count());
    }
}
