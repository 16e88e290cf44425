package io.github.chirino.atlas.store;

public enum UpsertOutcome {
    CREATED,
    TEXT_CHANGED,
    UNCHANGED;

    /** New or changed text needs a (re)computed embedding. */
    public boolean needsEmbedding() {
        return this != UNCHANGED;
    }
}
