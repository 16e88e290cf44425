package io.github.chirino.atlas.cluster;

import io.github.chirino.atlas.model.Position;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Deterministic 2-D k-means: k-means++ seeding from a fixed seed, Lloyd iterations, several
 * restarts keeping the lowest inertia. Points go to the nearest centroid, ties to the lowest
 * index. Clusters that end up empty are dropped, so the result may have fewer than k clusters.
 */
public final class KMeans {

    public record Result(List<Position> centroids, int[] assignments, double inertia) {

        public int clusterCount() {
            return centroids.size();
        }
    }

    private final long seed;
    private final int maxIterations;
    private final int restarts;

    public KMeans(long seed, int maxIterations, int restarts) {
        if (maxIterations < 1 || restarts < 1) {
            throw new IllegalArgumentException("maxIterations and restarts must be positive");
        }
        this.seed = seed;
        this.maxIterations = maxIterations;
        this.restarts = restarts;
    }

    public Result fit(List<Position> points, int k) {
        if (points.isEmpty()) {
            return new Result(List.of(), new int[0], 0.0);
        }
        int clusters = Math.max(1, Math.min(k, points.size()));
        Result best = null;
        for (int run = 0; run < restarts; run++) {
            Result result = fitOnce(points, clusters, new Random(seed + run));
            if (best == null || result.inertia() < best.inertia()) {
                best = result;
            }
        }
        return best;
    }

    private Result fitOnce(List<Position> points, int k, Random random) {
        Position[] centroids = seed(points, k, random);
        int[] assignments = new int[points.size()];
        Arrays.fill(assignments, -1);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            boolean changed = assign(points, centroids, assignments);
            if (!changed && iteration > 0) {
                break;
            }
            centroids = recompute(points, centroids, assignments);
        }
        assign(points, centroids, assignments);
        return compact(points, centroids, assignments);
    }

    /** k-means++: each next seed is drawn with probability proportional to squared distance. */
    private static Position[] seed(List<Position> points, int k, Random random) {
        Position[] centroids = new Position[k];
        centroids[0] = points.get(random.nextInt(points.size()));
        double[] distances = new double[points.size()];
        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < points.size(); i++) {
                double nearest = Double.MAX_VALUE;
                for (int j = 0; j < c; j++) {
                    nearest = Math.min(nearest, points.get(i).distanceSquared(centroids[j]));
                }
                distances[i] = nearest;
                total += nearest;
            }
            if (total == 0.0) {
                // Every point coincides with a chosen seed.
                centroids[c] = centroids[0];
                continue;
            }
            double target = random.nextDouble() * total;
            int chosen = points.size() - 1;
            for (int i = 0; i < points.size(); i++) {
                target -= distances[i];
                if (target <= 0.0) {
                    chosen = i;
                    break;
                }
            }
            centroids[c] = points.get(chosen);
        }
        return centroids;
    }

    private static boolean assign(List<Position> points, Position[] centroids, int[] assignments) {
        boolean changed = false;
        for (int i = 0; i < points.size(); i++) {
            int nearest = nearest(points.get(i), centroids);
            if (assignments[i] != nearest) {
                assignments[i] = nearest;
                changed = true;
            }
        }
        return changed;
    }

    static int nearest(Position point, Position[] centroids) {
        int best = 0;
        double bestDistance = point.distanceSquared(centroids[0]);
        for (int c = 1; c < centroids.length; c++) {
            double distance = point.distanceSquared(centroids[c]);
            if (distance < bestDistance) {
                best = c;
                bestDistance = distance;
            }
        }
        return best;
    }

    private static Position[] recompute(
            List<Position> points, Position[] centroids, int[] assignments) {
        double[] sumX = new double[centroids.length];
        double[] sumY = new double[centroids.length];
        int[] counts = new int[centroids.length];
        for (int i = 0; i < points.size(); i++) {
            int c = assignments[i];
            sumX[c] += points.get(i).x();
            sumY[c] += points.get(i).y();
            counts[c]++;
        }
        Position[] next = new Position[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            // An empty cluster keeps its centroid and is dropped at the end if still empty.
            next[c] =
                    counts[c] == 0
                            ? centroids[c]
                            : new Position(sumX[c] / counts[c], sumY[c] / counts[c]);
        }
        return next;
    }

    private static Result compact(List<Position> points, Position[] centroids, int[] assignments) {
        int[] counts = new int[centroids.length];
        for (int a : assignments) {
            counts[a]++;
        }
        int[] remap = new int[centroids.length];
        List<Position> kept = new ArrayList<>();
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] > 0) {
                remap[c] = kept.size();
                kept.add(centroids[c]);
            } else {
                remap[c] = -1;
            }
        }
        int[] compacted = new int[assignments.length];
        double inertia = 0.0;
        for (int i = 0; i < assignments.length; i++) {
            compacted[i] = remap[assignments[i]];
            inertia += points.get(i).distanceSquared(centroids[assignments[i]]);
        }
        return new Result(List.copyOf(kept), compacted, inertia);
    }
}
