package io.github.chirino.atlas.cluster;

public enum LabelStatus {
    /** Every cluster received a label. */
    LABELED,
    /** The summarizer answered but some clusters could not be matched to a label. */
    PARTIAL,
    /** The summarizer failed or timed out; clusters are returned without labels. */
    UNAVAILABLE,
    /** No summarizer is configured. */
    DISABLED,
    /** There was nothing to label. */
    SKIPPED;

    public String toValue() {
        return name().toLowerCase();
    }
}
