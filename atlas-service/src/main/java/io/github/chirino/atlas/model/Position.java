package io.github.chirino.atlas.model;

/** A point in the 2-D projection space. */
public record Position(double x, double y) {

    public Position {
        if (Double.isNaN(x) || Double.isNaN(y) || Double.isInfinite(x) || Double.isInfinite(y)) {
            throw new IllegalArgumentException(
                    "Position coordinates must be finite: " + x + ", " + y);
        }
    }

    public double distanceSquared(Position other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return dx * dx + dy * dy;
    }
}
