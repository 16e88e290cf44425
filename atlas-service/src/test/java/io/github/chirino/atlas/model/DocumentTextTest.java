package io.github.chirino.atlas.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DocumentTextTest {

    @Test
    void embedding_text_joins_title_and_abstract() {
        assertEquals("Title\n\nAbstract", DocumentText.embeddingText(" Title ", "Abstract\n"));
        assertEquals("Abstract", DocumentText.embeddingText(null, "Abstract"));
        assertEquals("Title", DocumentText.embeddingText("Title", "  "));
        assertEquals("", DocumentText.embeddingText(null, null));
    }

    @Test
    void content_hash_ignores_surrounding_whitespace_but_not_content() {
        String hash = DocumentText.contentHash("Title", "Abstract");

        assertEquals(64, hash.length());
        assertEquals(hash, DocumentText.contentHash(" Title", "Abstract "));
        assertNotEquals(hash, DocumentText.contentHash("Title", "Another abstract"));
    }

    @Test
    void document_id_is_stable_per_source_pair() {
        UUID id = DocumentText.documentId("arxiv", "2401.00001");

        assertEquals(id, DocumentText.documentId("arxiv", "2401.00001"));
        assertNotEquals(id, DocumentText.documentId("pubmed", "2401.00001"));
        DocumentDraft draft = new DocumentDraft("arxiv", "2401.00001", "t", "a", null, null);
        assertEquals(id, draft.documentId());
    }

    @Test
    void draft_requires_source_identity() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new DocumentDraft(" ", "1", "t", "a", null, null));
        assertThrows(
                IllegalArgumentException.class,
                () -> new DocumentDraft("arxiv", null, "t", "a", null, null));
    }

    @Test
    void record_cannot_hold_position_without_embedding() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        assertThrows(
                IllegalStateException.class,
                () ->
                        new DocumentRecord(
                                UUID.randomUUID(),
                                "arxiv",
                                "1",
                                "t",
                                "a",
                                null,
                                null,
                                new Position(0, 0),
                                "hash",
                                null,
                                now,
                                now));
    }

    @Test
    void position_rejects_non_finite_coordinates() {
        assertThrows(IllegalArgumentException.class, () -> new Position(Double.NaN, 0));
        assertThrows(
                IllegalArgumentException.class, () -> new Position(0, Double.POSITIVE_INFINITY));
    }
}
