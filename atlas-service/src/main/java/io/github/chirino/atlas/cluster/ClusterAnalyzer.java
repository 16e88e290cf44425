package io.github.chirino.atlas.cluster;

import io.github.chirino.atlas.model.DocumentSummary;
import io.github.chirino.atlas.model.Position;
import io.github.chirino.atlas.query.InvalidQueryException;
import io.github.chirino.atlas.query.QueryEngine;
import io.github.chirino.atlas.query.QueryResult;
import io.github.chirino.atlas.query.QuerySpec;
import io.github.chirino.atlas.query.ScoredDocument;
import io.github.chirino.atlas.worker.ProviderCallExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Partitions a query result set into K spatial clusters with Voronoi boundaries and asks the
 * summarizer for a short label per cluster.
 *
 * <p>Labelling is best effort: when the summarizer is disabled, fails or times out, the
 * geometric result is still returned and {@link ClusterResult#labelStatus()} says why the labels
 * are missing.
 */
@ApplicationScoped
public class ClusterAnalyzer {

    private static final Logger LOG = Logger.getLogger(ClusterAnalyzer.class);

    @Inject QueryEngine queryEngine;

    @Inject ClusterSummarizer summarizer;

    @Inject ProviderCallExecutor providerCalls;

    @Inject MeterRegistry meterRegistry;

    @ConfigProperty(name = "atlas.cluster.min-points-per-cluster", defaultValue = "5")
    int minPointsPerCluster;

    @ConfigProperty(name = "atlas.cluster.max-clusters", defaultValue = "50")
    int maxClusters;

    @ConfigProperty(name = "atlas.cluster.max-iterations", defaultValue = "300")
    int maxIterations;

    @ConfigProperty(name = "atlas.cluster.restarts", defaultValue = "10")
    int restarts;

    @ConfigProperty(name = "atlas.cluster.seed", defaultValue = "42")
    long seed;

    @ConfigProperty(name = "atlas.cluster.titles-per-cluster", defaultValue = "10")
    int titlesPerCluster;

    /** Runs the query and clusters whatever it returned. */
    public ClusterResult analyze(QuerySpec spec, int requestedK) {
        validateK(requestedK);
        QueryResult result = queryEngine.execute(spec);
        List<DocumentSummary> documents = new ArrayList<>(result.items().size());
        for (ScoredDocument item : result.items()) {
            documents.add(item.document());
        }
        return cluster(documents, requestedK, result.isTruncated());
    }

    public ClusterResult cluster(
            List<DocumentSummary> documents, int requestedK, boolean inputTruncated) {
        validateK(requestedK);
        int effectiveK = effectiveK(documents.size(), requestedK);
        if (documents.isEmpty()) {
            return new ClusterResult(
                    List.of(), LabelStatus.SKIPPED, requestedK, 0, 0, inputTruncated);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        List<Position> points = new ArrayList<>(documents.size());
        for (DocumentSummary document : documents) {
            points.add(document.position());
        }
        KMeans.Result fit = new KMeans(seed, maxIterations, restarts).fit(points, effectiveK);
        List<Cluster> clusters = buildClusters(documents, points, fit);
        sample.stop(meterRegistry.timer("atlas.cluster.analysis"));

        LOG.debugf(
                "Clustered %d points into %d clusters (requested=%d, effective=%d)",
                documents.size(), clusters.size(), requestedK, effectiveK);

        return label(clusters, requestedK, effectiveK, documents.size(), inputTruncated);
    }

    int effectiveK(int pointCount, int requestedK) {
        if (pointCount == 0) {
            return 0;
        }
        int byDensity = Math.max(1, pointCount / Math.max(1, minPointsPerCluster));
        return Math.max(1, Math.min(requestedK, Math.min(byDensity, maxClusters)));
    }

    private static void validateK(int requestedK) {
        if (requestedK < 1) {
            throw new InvalidQueryException("k must be at least 1, got " + requestedK);
        }
    }

    private List<Cluster> buildClusters(
            List<DocumentSummary> documents, List<Position> points, KMeans.Result fit) {
        double[] extent = paddedExtent(points);
        List<List<Position>> cells =
                VoronoiPartitioner.partition(
                        fit.centroids(), extent[0], extent[1], extent[2], extent[3]);

        List<List<Integer>> members = new ArrayList<>(fit.clusterCount());
        for (int c = 0; c < fit.clusterCount(); c++) {
            members.add(new ArrayList<>());
        }
        int[] assignments = fit.assignments();
        for (int i = 0; i < assignments.length; i++) {
            members.get(assignments[i]).add(i);
        }

        List<Cluster> clusters = new ArrayList<>(fit.clusterCount());
        for (int c = 0; c < fit.clusterCount(); c++) {
            Position centroid = fit.centroids().get(c);
            List<UUID> ids = new ArrayList<>(members.get(c).size());
            for (int index : members.get(c)) {
                ids.add(documents.get(index).id());
            }
            clusters.add(
                    new Cluster(
                            c,
                            ids,
                            centroid,
                            cells.get(c),
                            null,
                            representativeTitles(documents, members.get(c), centroid)));
        }
        return clusters;
    }

    private List<String> representativeTitles(
            List<DocumentSummary> documents, List<Integer> members, Position centroid) {
        List<Integer> ordered = new ArrayList<>(members);
        Comparator<Integer> byDistance =
                Comparator.comparingDouble(
                        i -> documents.get(i).position().distanceSquared(centroid));
        ordered.sort(byDistance.thenComparing(i -> documents.get(i).id()));
        List<String> titles = new ArrayList<>();
        for (int index : ordered) {
            if (titles.size() >= titlesPerCluster) {
                break;
            }
            String title = documents.get(index).title();
            if (title != null && !title.isBlank()) {
                titles.add(title.strip());
            }
        }
        return titles;
    }

    /** The extent of the points, grown a little so no point sits on the outer edge. */
    static double[] paddedExtent(List<Position> points) {
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (Position p : points) {
            minX = Math.min(minX, p.x());
            minY = Math.min(minY, p.y());
            maxX = Math.max(maxX, p.x());
            maxY = Math.max(maxY, p.y());
        }
        double pad = Math.max(1e-6, 0.01 * Math.max(maxX - minX, maxY - minY));
        return new double[] {minX - pad, minY - pad, maxX + pad, maxY + pad};
    }

    private ClusterResult label(
            List<Cluster> clusters,
            int requestedK,
            int effectiveK,
            int pointCount,
            boolean inputTruncated) {
        if (!summarizer.isEnabled()) {
            return new ClusterResult(
                    clusters,
                    LabelStatus.DISABLED,
                    requestedK,
                    effectiveK,
                    pointCount,
                    inputTruncated);
        }

        List<List<String>> titles = new ArrayList<>(clusters.size());
        for (Cluster cluster : clusters) {
            titles.add(cluster.representativeTitles());
        }
        String prompt = SummaryPrompt.build(titles);

        List<String> labels;
        try {
            String answer =
                    providerCalls.call(
                            "cluster summary (" + summarizer.modelId() + ")",
                            () -> summarizer.complete(prompt));
            labels = SummaryResponseParser.parse(answer, clusters.size());
        } catch (RuntimeException e) {
            LOG.warnf(
                    "Cluster labelling failed for %d clusters via %s: %s",
                    clusters.size(), summarizer.modelId(), e.getMessage());
            meterRegistry.counter("atlas.cluster.labels", "status", "unavailable").increment();
            return new ClusterResult(
                    clusters,
                    LabelStatus.UNAVAILABLE,
                    requestedK,
                    effectiveK,
                    pointCount,
                    inputTruncated);
        }

        List<Cluster> labeled = new ArrayList<>(clusters.size());
        int missing = 0;
        for (int i = 0; i < clusters.size(); i++) {
            String value = labels.get(i);
            if (value == null) {
                missing++;
            }
            labeled.add(clusters.get(i).withLabel(value));
        }
        LabelStatus status = missing == 0 ? LabelStatus.LABELED : LabelStatus.PARTIAL;
        meterRegistry.counter("atlas.cluster.labels", "status", status.toValue()).increment();
        return new ClusterResult(
                labeled, status, requestedK, effectiveK, pointCount, inputTruncated);
    }
}
