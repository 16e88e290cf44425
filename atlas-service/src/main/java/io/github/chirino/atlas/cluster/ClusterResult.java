package io.github.chirino.atlas.cluster;

import java.util.List;

/**
 * Clusters computed for one request. Never persisted.
 *
 * @param requestedK the K the caller asked for
 * @param effectiveK the K after clamping to the point count and the configured maximum
 * @param inputTruncated whether the clustered result set was itself cut at the query cap
 */
public record ClusterResult(
        List<Cluster> clusters,
        LabelStatus labelStatus,
        int requestedK,
        int effectiveK,
        int pointCount,
        boolean inputTruncated) {

    public ClusterResult {
        clusters = List.copyOf(clusters);
    }
}
