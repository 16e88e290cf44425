package io.github.chirino.atlas.store;

import java.util.UUID;

/**
 * Outcome of a record write.
 *
 * @param embeddingCurrent whether the stored embedding was computed from the text just written
 */
public record UpsertResult(UUID id, UpsertOutcome outcome, boolean embeddingCurrent) {

    /**
     * New or changed text needs an embedding, and so does unchanged text whose embedding is
     * missing or stale, for example because an earlier write never got its entry queued.
     */
    public boolean needsEmbedding() {
        return outcome.needsEmbedding() || !embeddingCurrent;
    }
}
