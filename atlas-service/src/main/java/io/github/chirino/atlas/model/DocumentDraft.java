package io.github.chirino.atlas.model;

import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/** Incoming record content from an ingestion source, before enrichment. */
public record DocumentDraft(
        String source,
        String sourceId,
        String title,
        String abstractText,
        LocalDate primaryDate,
        Map<String, Object> metadata) {

    public DocumentDraft {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId is required");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public UUID documentId() {
        return DocumentText.documentId(source, sourceId);
    }

    public String contentHash() {
        return DocumentText.contentHash(title, abstractText);
    }
}
