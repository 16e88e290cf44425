package io.github.chirino.atlas.query;

import java.util.Locale;

public enum OrderingMode {
    /** Newest primary date first. */
    RECENCY,
    /** Highest similarity to the semantic query vector first. */
    SIMILARITY;

    public static OrderingMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OrderingMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("Unknown ordering: " + value);
        }
    }
}
