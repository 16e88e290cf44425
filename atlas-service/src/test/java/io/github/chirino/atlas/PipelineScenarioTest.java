package io.github.chirino.atlas;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.atlas.cluster.Cluster;
import io.github.chirino.atlas.cluster.ClusterAnalyzer;
import io.github.chirino.atlas.cluster.ClusterAnalyzers;
import io.github.chirino.atlas.cluster.ClusterResult;
import io.github.chirino.atlas.cluster.DisabledClusterSummarizer;
import io.github.chirino.atlas.cluster.LabelStatus;
import io.github.chirino.atlas.config.TestBackend;
import io.github.chirino.atlas.embedding.HashEmbeddingService;
import io.github.chirino.atlas.ingest.DocumentService;
import io.github.chirino.atlas.ingest.DocumentServices;
import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentText;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.model.QueueStatus;
import io.github.chirino.atlas.projection.ProjectionModels;
import io.github.chirino.atlas.query.BoundingBox;
import io.github.chirino.atlas.query.QueryEngine;
import io.github.chirino.atlas.query.QueryEngines;
import io.github.chirino.atlas.query.QueryResult;
import io.github.chirino.atlas.query.QuerySpec;
import io.github.chirino.atlas.query.ScoredDocument;
import io.github.chirino.atlas.query.SemanticQuery;
import io.github.chirino.atlas.worker.EmbeddingWorker;
import io.github.chirino.atlas.worker.ProjectionWorker;
import io.github.chirino.atlas.worker.Workers;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/** Ingest, enrich, query and cluster against the in-memory datastore. */
class PipelineScenarioTest {

    private static final int DIMENSIONS = 256;

    private static final String[] TOPICS = {
        "graph neural network message passing",
        "protein structure folding prediction",
        "quantum error correction qubits"
    };

    @Test
    void ingested_documents_become_searchable_and_clusterable() {
        TestBackend backend = new TestBackend();
        HashEmbeddingService embeddings = new HashEmbeddingService(DIMENSIONS);
        DocumentService documents = DocumentServices.service(backend);

        for (int t = 0; t < TOPICS.length; t++) {
            for (int i = 0; i < 6; i++) {
                documents.upsert(
                        new DocumentDraft(
                                "arxiv",
                                t + "-" + i,
                                TOPICS[t] + " study " + i,
                                TOPICS[t],
                                LocalDate.of(2024, 1, 1).plusDays(t * 10 + i),
                                Map.of("topic", String.valueOf(t))));
            }
        }

        QueryEngine engine = QueryEngines.engine(backend);
        assertTrue(engine.execute(QuerySpec.builder().build()).items().isEmpty());

        EmbeddingWorker embedding = Workers.embedding(backend, embeddings);
        ProjectionWorker projection =
                Workers.projection(
                        backend,
                        ProjectionModels.registry(ProjectionModels.spread("v1", DIMENSIONS)));
        assertEquals(18, embedding.drain());
        assertEquals(18, projection.drain());
        assertTrue(
                backend.queue.entries().stream().allMatch(e -> e.status() == QueueStatus.DONE));

        QueryResult newest = engine.execute(QuerySpec.builder().cap(5).build());
        assertEquals(5, newest.items().size());
        assertTrue(newest.isTruncated());
        assertEquals(LocalDate.of(2024, 1, 26), newest.items().get(0).document().primaryDate());

        QuerySpec semantic =
                QuerySpec.builder()
                        .semantic(new SemanticQuery(embeddings.embed("protein folding"), 0.45))
                        .cap(10)
                        .build();
        QueryResult related = engine.execute(semantic);
        assertEquals(6, related.items().size());
        assertFalse(related.isTruncated());
        for (ScoredDocument hit : related.items()) {
            assertTrue(hit.document().title().startsWith("protein"));
            assertEquals("1", hit.metadata().get("topic"));
        }

        ClusterAnalyzer analyzer =
                ClusterAnalyzers.analyzer(
                        engine, new DisabledClusterSummarizer(), backend.meterRegistry);
        ClusterResult clusters = analyzer.analyze(QuerySpec.builder().build(), 3);
        assertEquals(18, clusters.pointCount());
        assertEquals(3, clusters.effectiveK());
        assertEquals(LabelStatus.DISABLED, clusters.labelStatus());
        assertEquals(18, clusters.clusters().stream().mapToInt(Cluster::size).sum());
    }

    private static long entries(TestBackend backend, EnrichmentKind kind) {
        return backend.queue.entries().stream().filter(e -> e.kind() == kind).count();
    }

    @Test
    void three_records_flow_through_both_stages_and_answer_spatial_and_semantic_queries() {
        TestBackend backend = new TestBackend();
        HashEmbeddingService embeddings = new HashEmbeddingService(DIMENSIONS);
        DocumentService documents = DocumentServices.service(backend);
        String[][] texts = {
            {"Sparse attention transformers", "long context language modelling"},
            {"Coral reef bleaching", "ocean temperature anomalies"},
            {"Medieval trade routes", "silk road caravans"}
        };
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            ids.add(
                    documents
                            .upsert(
                                    new DocumentDraft(
                                            "arxiv",
                                            "r" + i,
                                            texts[i][0],
                                            texts[i][1],
                                            LocalDate.of(2024, 3, 1 + i),
                                            Map.of()))
                            .id());
        }

        EmbeddingWorker embedding = Workers.embedding(backend, embeddings);
        ProjectionWorker projection =
                Workers.projection(
                        backend,
                        ProjectionModels.registry(ProjectionModels.spread("v1", DIMENSIONS)));
        assertEquals(3, entries(backend, EnrichmentKind.EMBEDDING));
        assertEquals(0, entries(backend, EnrichmentKind.PROJECTION));
        assertEquals(0, projection.drain());

        assertEquals(3, embedding.drain());
        assertEquals(3, entries(backend, EnrichmentKind.EMBEDDING));
        assertEquals(3, entries(backend, EnrichmentKind.PROJECTION));

        assertEquals(3, projection.drain());
        QueryEngine engine = QueryEngines.engine(backend);
        QueryResult unbounded = engine.execute(QuerySpec.builder().cap(10).build());
        QueryResult universe =
                engine.execute(
                        QuerySpec.builder()
                                .box(BoundingBox.of(-1e9, -1e9, 1e9, 1e9))
                                .cap(10)
                                .build());
        assertEquals(3, unbounded.items().size());
        assertEquals(ids(unbounded), ids(universe));

        Position first = backend.records.findById(ids.get(0)).orElseThrow().getPosition();
        double margin = Double.MAX_VALUE;
        for (UUID other : ids.subList(1, ids.size())) {
            Position p = backend.records.findById(other).orElseThrow().getPosition();
            double distance = Math.max(Math.abs(p.x() - first.x()), Math.abs(p.y() - first.y()));
            margin = Math.min(margin, distance);
        }
        double half = margin / 2;
        QueryResult single =
                engine.execute(
                        QuerySpec.builder()
                                .box(
                                        BoundingBox.of(
                                                first.x() - half,
                                                first.y() - half,
                                                first.x() + half,
                                                first.y() + half))
                                .cap(10)
                                .build());
        assertEquals(List.of(ids.get(0)), ids(single));

        float[] query = embeddings.embed(DocumentText.embeddingText(texts[1][0], texts[1][1]));
        for (int cap : new int[] {1, 2, 10, 100}) {
            QueryResult similar =
                    engine.execute(
                            QuerySpec.builder()
                                    .semantic(new SemanticQuery(query, 0.9))
                                    .cap(cap)
                                    .build());
            assertEquals(List.of(ids.get(1)), ids(similar));
            assertFalse(similar.isTruncated());
        }
    }

    private static List<UUID> ids(QueryResult result) {
        return result.items().stream().map(hit -> hit.document().id()).toList();
    }
}
