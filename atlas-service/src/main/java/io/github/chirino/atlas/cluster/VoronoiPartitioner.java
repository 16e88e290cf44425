package io.github.chirino.atlas.cluster;

import io.github.chirino.atlas.model.Position;
import java.util.ArrayList;
import java.util.List;

/**
 * Voronoi cells of a set of centroids, clipped to a rectangle. Each cell starts as the rectangle
 * and is cut by the perpendicular bisector half-plane towards every other centroid, so cells are
 * convex, share edges without overlapping, and contain every point nearest to their centroid.
 */
public final class VoronoiPartitioner {

    private static final double EPSILON = 1e-12;

    private VoronoiPartitioner() {}

    /**
     * @return one polygon per centroid, vertices in counter-clockwise order, not closed
     */
    public static List<List<Position>> partition(
            List<Position> centroids, double minX, double minY, double maxX, double maxY) {
        List<Position> rectangle =
                List.of(
                        new Position(minX, minY),
                        new Position(maxX, minY),
                        new Position(maxX, maxY),
                        new Position(minX, maxY));
        List<List<Position>> cells = new ArrayList<>(centroids.size());
        for (int i = 0; i < centroids.size(); i++) {
            List<Position> cell = rectangle;
            Position ci = centroids.get(i);
            for (int j = 0; j < centroids.size() && !cell.isEmpty(); j++) {
                if (i == j) {
                    continue;
                }
                cell = clip(cell, ci, centroids.get(j));
            }
            cells.add(List.copyOf(cell));
        }
        return cells;
    }

    /**
     * Keeps the part of {@code polygon} at least as close to {@code own} as to {@code other}:
     * {@code 2 p.(other - own) <= |other|^2 - |own|^2}.
     */
    static List<Position> clip(List<Position> polygon, Position own, Position other) {
        double a = 2 * (other.x() - own.x());
        double b = 2 * (other.y() - own.y());
        double c =
                other.x() * other.x()
                        + other.y() * other.y()
                        - own.x() * own.x()
                        - own.y() * own.y();
        if (Math.abs(a) < EPSILON && Math.abs(b) < EPSILON) {
            return polygon;
        }
        List<Position> result = new ArrayList<>(polygon.size() + 1);
        for (int i = 0; i < polygon.size(); i++) {
            Position current = polygon.get(i);
            Position next = polygon.get((i + 1) % polygon.size());
            double currentValue = a * current.x() + b * current.y() - c;
            double nextValue = a * next.x() + b * next.y() - c;
            boolean currentInside = currentValue <= EPSILON;
            boolean nextInside = nextValue <= EPSILON;
            if (currentInside) {
                addDistinct(result, current);
            }
            if (currentInside != nextInside) {
                double t = currentValue / (currentValue - nextValue);
                addDistinct(
                        result,
                        new Position(
                                current.x() + t * (next.x() - current.x()),
                                current.y() + t * (next.y() - current.y())));
            }
        }
        if (result.size() > 1 && nearlyEqual(result.get(0), result.get(result.size() - 1))) {
            result.remove(result.size() - 1);
        }
        return result.size() < 3 ? List.of() : result;
    }

    private static void addDistinct(List<Position> polygon, Position vertex) {
        if (polygon.isEmpty() || !nearlyEqual(polygon.get(polygon.size() - 1), vertex)) {
            polygon.add(vertex);
        }
    }

    private static boolean nearlyEqual(Position a, Position b) {
        return a.distanceSquared(b) < EPSILON * EPSILON;
    }

    /** Containment test for the convex cells built here; points on an edge count as inside. */
    public static boolean contains(List<Position> polygon, Position point) {
        if (polygon.size() < 3) {
            return false;
        }
        // Convex, counter-clockwise: inside means left of (or on) every edge.
        for (int i = 0; i < polygon.size(); i++) {
            Position p = polygon.get(i);
            Position q = polygon.get((i + 1) % polygon.size());
            double cross =
                    (q.x() - p.x()) * (point.y() - p.y()) - (q.y() - p.y()) * (point.x() - p.x());
            if (cross < -1e-9) {
                return false;
            }
        }
        return true;
    }
}
