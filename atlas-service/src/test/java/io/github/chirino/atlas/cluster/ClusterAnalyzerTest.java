package io.github.chirino.atlas.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import io.github.chirino.atlas.model.DocumentSummary;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.InvalidQueryException;
import io.github.chirino.atlas.query.PlanSource;
import io.github.chirino.atlas.query.QueryEngine;
import io.github.chirino.atlas.query.QueryResult;
import io.github.chirino.atlas.query.QuerySpec;
import io.github.chirino.atlas.query.ResultStatus;
import io.github.chirino.atlas.query.ScoredDocument;
import io.github.chirino.atlas.worker.ProviderCallExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ClusterAnalyzerTest {

    private ClusterSummarizer summarizer;
    private SimpleMeterRegistry meterRegistry;
    private ClusterAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        summarizer = mock(ClusterSummarizer.class);
        when(summarizer.isEnabled()).thenReturn(true);
        when(summarizer.modelId()).thenReturn("mock");
        meterRegistry = new SimpleMeterRegistry();

        analyzer = new ClusterAnalyzer();
        analyzer.summarizer = summarizer;
        analyzer.providerCalls = ProviderCallExecutor.withTimeout(Duration.ofSeconds(5));
        analyzer.meterRegistry = meterRegistry;
        analyzer.minPointsPerCluster = 5;
        analyzer.maxClusters = 50;
        analyzer.maxIterations = 300;
        analyzer.restarts = 10;
        analyzer.seed = 42;
        analyzer.titlesPerCluster = 3;
    }

    /** Three tight groups of ten around (0,0), (10,0) and (0,10). */
    private static List<DocumentSummary> threeGroups() {
        List<DocumentSummary> documents = new ArrayList<>();
        Position[] centers = {new Position(0, 0), new Position(10, 0), new Position(0, 10)};
        String[] topics = {"Graphs", "Proteins", "Qubits"};
        for (int g = 0; g < centers.length; g++) {
            for (int i = 0; i < 10; i++) {
                double angle = i * Math.PI / 5;
                documents.add(
                        new DocumentSummary(
                                UUID.nameUUIDFromBytes((topics[g] + i).getBytes()),
                                "arxiv",
                                topics[g] + i,
                                topics[g] + " paper " + i,
                                "",
                                null,
                                new Position(
                                        centers[g].x() + Math.cos(angle) * (1 + i % 3) * 0.2,
                                        centers[g].y() + Math.sin(angle) * (1 + i % 3) * 0.2)));
            }
        }
        return documents;
    }

    @Test
    void partitions_points_into_cells_that_contain_them() {
        when(summarizer.complete(anyString())).thenReturn("1. a\n2. b\n3. c");
        List<DocumentSummary> documents = threeGroups();

        ClusterResult result = analyzer.cluster(documents, 3, false);

        assertEquals(3, result.effectiveK());
        assertEquals(30, result.pointCount());
        Set<UUID> seen = new HashSet<>();
        for (Cluster cluster : result.clusters()) {
            assertEquals(10, cluster.size());
            for (UUID id : cluster.memberIds()) {
                assertTrue(seen.add(id), "each point belongs to exactly one cluster");
                DocumentSummary member =
                        documents.stream().filter(d -> d.id().equals(id)).findFirst().orElseThrow();
                assertTrue(VoronoiPartitioner.contains(cluster.boundary(), member.position()));
                String topic = member.sourceId().replaceAll("\\d", "");
                assertTrue(
                        cluster.representativeTitles().stream().allMatch(t -> t.startsWith(topic)));
            }
            assertEquals(3, cluster.representativeTitles().size());
        }
        assertEquals(30, seen.size());
    }

    @Test
    void labels_every_cluster() {
        when(summarizer.complete(anyString()))
                .thenReturn("1. Graph learning\n2. Protein folding\n3. Quantum computing");

        ClusterResult result = analyzer.cluster(threeGroups(), 3, false);

        assertEquals(LabelStatus.LABELED, result.labelStatus());
        assertTrue(result.clusters().stream().allMatch(c -> c.label() != null));
    }

    @Test
    void short_answer_is_partial() {
        when(summarizer.complete(anyString())).thenReturn("1. Graph learning");

        ClusterResult result = analyzer.cluster(threeGroups(), 3, false);

        assertEquals(LabelStatus.PARTIAL, result.labelStatus());
        assertEquals("Graph learning", result.clusters().get(0).label());
        assertNull(result.clusters().get(2).label());
    }

    @Test
    void summarizer_failure_keeps_geometry() {
        when(summarizer.complete(anyString()))
                .thenThrow(new EmbeddingProviderException("rate limited", true));

        ClusterResult result = analyzer.cluster(threeGroups(), 3, true);

        assertEquals(LabelStatus.UNAVAILABLE, result.labelStatus());
        assertEquals(3, result.clusters().size());
        assertTrue(result.inputTruncated());
        assertEquals(
                1.0,
                meterRegistry.counter("atlas.cluster.labels", "status", "unavailable").count());
    }

    @Test
    void disabled_summarizer_is_not_called() {
        when(summarizer.isEnabled()).thenReturn(false);

        ClusterResult result = analyzer.cluster(threeGroups(), 3, false);

        assertEquals(LabelStatus.DISABLED, result.labelStatus());
        verify(summarizer, never()).complete(anyString());
    }

    @Test
    void k_is_clamped_by_point_density_and_maximum() {
        assertEquals(2, analyzer.effectiveK(12, 10));
        assertEquals(1, analyzer.effectiveK(3, 4));
        assertEquals(4, analyzer.effectiveK(1000, 4));
        analyzer.maxClusters = 6;
        assertEquals(6, analyzer.effectiveK(1000, 40));
    }

    @Test
    void k_below_one_is_rejected() {
        assertThrows(InvalidQueryException.class, () -> analyzer.cluster(threeGroups(), 0, false));
    }

    @Test
    void empty_input_is_skipped() {
        ClusterResult result = analyzer.cluster(List.of(), 5, false);

        assertEquals(LabelStatus.SKIPPED, result.labelStatus());
        assertEquals(0, result.effectiveK());
        assertTrue(result.clusters().isEmpty());
    }

    @Test
    void analyze_clusters_the_query_result() {
        when(summarizer.isEnabled()).thenReturn(false);
        List<ScoredDocument> hits = new ArrayList<>();
        for (DocumentSummary document : threeGroups()) {
            hits.add(ScoredDocument.of(document, null));
        }
        QueryEngine engine = mock(QueryEngine.class);
        QuerySpec spec = QuerySpec.builder().build();
        when(engine.execute(spec))
                .thenReturn(new QueryResult(hits, ResultStatus.TRUNCATED, PlanSource.SORTED_VIEW));
        analyzer.queryEngine = engine;

        ClusterResult result = analyzer.analyze(spec, 3);

        assertEquals(30, result.pointCount());
        assertTrue(result.inputTruncated());
    }
}
