package io.github.chirino.atlas.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/** Helpers for the text fields that drive embedding. */
public final class DocumentText {

    private DocumentText() {}

    public static String embeddingText(String title, String abstractText) {
        String t = title == null ? "" : title.strip();
        String a = abstractText == null ? "" : abstractText.strip();
        if (t.isEmpty()) {
            return a;
        }
        if (a.isEmpty()) {
            return t;
        }
        return t + "\n\n" + a;
    }

    /** SHA-256 of the embedding text; a change means the embedding must be recomputed. */
    public static String contentHash(String title, String abstractText) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash =
                    digest.digest(
                            embeddingText(title, abstractText).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Stable record id for a (source, source-local id) pair. */
    public static UUID documentId(String source, String sourceId) {
        return UUID.nameUUIDFromBytes((source + ":" + sourceId).getBytes(StandardCharsets.UTF_8));
    }
}
