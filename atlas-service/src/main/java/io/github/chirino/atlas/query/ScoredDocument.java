package io.github.chirino.atlas.query;

import io.github.chirino.atlas.model.DocumentSummary;
import java.util.Map;

/**
 * One query hit. {@code similarity} is only present for semantic queries; {@code metadata} is
 * filled in from the per-source side table after the store returns.
 */
public record ScoredDocument(
        DocumentSummary document, Map<String, Object> metadata, Double similarity) {

    public ScoredDocument {
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static ScoredDocument of(DocumentSummary document, Double similarity) {
        return new ScoredDocument(document, Map.of(), similarity);
    }

    public ScoredDocument withMetadata(Map<String, Object> metadata) {
        return new ScoredDocument(document, metadata, similarity);
    }
}
