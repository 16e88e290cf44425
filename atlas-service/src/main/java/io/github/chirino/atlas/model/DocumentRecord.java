package io.github.chirino.atlas.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A stored document with its optional enrichment columns.
 *
 * <p>A record never carries a position without an embedding: the position is derived from the
 * embedding by the projection worker.
 */
public final class DocumentRecord {

    private final UUID id;
    private final String source;
    private final String sourceId;
    private final String title;
    private final String abstractText;
    private final LocalDate primaryDate;
    private final float[] embedding;
    private final Position position;
    private final String contentHash;
    private final String embeddingHash;
    private final Instant createdAt;
    private final Instant updatedAt;

    public DocumentRecord(
            UUID id,
            String source,
            String sourceId,
            String title,
            String abstractText,
            LocalDate primaryDate,
            float[] embedding,
            Position position,
            String contentHash,
            String embeddingHash,
            Instant createdAt,
            Instant updatedAt) {
        if (position != null && embedding == null) {
            throw new IllegalStateException("Document " + id + " has a position but no embedding");
        }
        this.id = Objects.requireNonNull(id, "id");
        this.source = source;
        this.sourceId = sourceId;
        this.title = title;
        this.abstractText = abstractText;
        this.primaryDate = primaryDate;
        this.embedding = embedding;
        this.position = position;
        this.contentHash = contentHash;
        this.embeddingHash = embeddingHash;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public UUID getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTitle() {
        return title;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public LocalDate getPrimaryDate() {
        return primaryDate;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public Position getPosition() {
        return position;
    }

    public String getContentHash() {
        return contentHash;
    }

    /**
     * Content hash of the text the stored embedding was computed from. It differs from {@link
     * #getContentHash()} while a changed text waits for its new embedding.
     */
    public String getEmbeddingHash() {
        return embeddingHash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public boolean hasPosition() {
        return position != null;
    }

    /** Text sent to the embedding provider: title and abstract joined by a blank line. */
    public String embeddingText() {
        return DocumentText.embeddingText(title, abstractText);
    }

    public DocumentRecord withEmbedding(float[] embedding, String embeddingHash, Instant now) {
        return new DocumentRecord(
                id,
                source,
                sourceId,
                title,
                abstractText,
                primaryDate,
                embedding,
                position,
                contentHash,
                embeddingHash,
                createdAt,
                now);
    }

    public DocumentRecord withPosition(Position position, Instant now) {
        return new DocumentRecord(
                id,
                source,
                sourceId,
                title,
                abstractText,
                primaryDate,
                embedding,
                position,
                contentHash,
                embeddingHash,
                createdAt,
                now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentRecord other)) {
            return false;
        }
        return id.equals(other.id)
                && Objects.equals(source, other.source)
                && Objects.equals(sourceId, other.sourceId)
                && Objects.equals(title, other.title)
                && Objects.equals(abstractText, other.abstractText)
                && Objects.equals(primaryDate, other.primaryDate)
                && Arrays.equals(embedding, other.embedding)
                && Objects.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentRecord{id="
                + id
                + ", source="
                + source
                + ", sourceId="
                + sourceId
                + ", hasEmbedding="
                + hasEmbedding()
                + ", position="
                + position
                + "}";
    }
}
