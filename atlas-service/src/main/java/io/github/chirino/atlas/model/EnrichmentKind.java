package io.github.chirino.atlas.model;

import java.util.Locale;

/** The kind of derived value a queue entry asks a worker to compute. */
public enum EnrichmentKind {
    EMBEDDING("embedding", false),
    PROJECTION("projection", true),
    METADATA("metadata", false);

    private final String value;
    private final boolean requiresEmbedding;

    EnrichmentKind(String value, boolean requiresEmbedding) {
        this.value = value;
        this.requiresEmbedding = requiresEmbedding;
    }

    /** Column value used by the queue table and the REST API. */
    public String toValue() {
        return value;
    }

    /** Whether entries of this kind may only be claimed once the record has an embedding. */
    public boolean requiresEmbedding() {
        return requiresEmbedding;
    }

    public static EnrichmentKind fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Enrichment kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EnrichmentKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown enrichment kind: " + value);
    }
}
