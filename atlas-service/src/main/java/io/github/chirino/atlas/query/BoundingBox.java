package io.github.chirino.atlas.query;

import io.github.chirino.atlas.model.Position;

/**
 * Axis-aligned viewport in projection space. Corners may be given in any order; they are
 * normalized to min/max on construction.
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    public BoundingBox {
        if (!Double.isFinite(minX)
                || !Double.isFinite(minY)
                || !Double.isFinite(maxX)
                || !Double.isFinite(maxY)) {
            throw new InvalidQueryException("Bounding box coordinates must be finite numbers");
        }
        if (minX > maxX) {
            double t = minX;
            minX = maxX;
            maxX = t;
        }
        if (minY > maxY) {
            double t = minY;
            minY = maxY;
            maxY = t;
        }
    }

    public static BoundingBox of(double x1, double y1, double x2, double y2) {
        return new BoundingBox(x1, y1, x2, y2);
    }

    /** Parses the {@code "x1,y1,x2,y2"} form accepted by the query API. */
    public static BoundingBox parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new InvalidQueryException(
                    "Invalid bbox format: " + value + " (expected 4 comma-separated values)");
        }
        try {
            return new BoundingBox(
                    Double.parseDouble(parts[0].trim()),
                    Double.parseDouble(parts[1].trim()),
                    Double.parseDouble(parts[2].trim()),
                    Double.parseDouble(parts[3].trim()));
        } catch (NumberFormatException e) {
            throw new InvalidQueryException("Invalid bbox coordinates: " + value);
        }
    }

    /** A box with zero width or height selects nothing. */
    public boolean isEmpty() {
        return minX == maxX || minY == maxY;
    }

    public boolean contains(Position position) {
        return position.x() >= minX
                && position.x() <= maxX
                && position.y() >= minY
                && position.y() <= maxY;
    }
}
