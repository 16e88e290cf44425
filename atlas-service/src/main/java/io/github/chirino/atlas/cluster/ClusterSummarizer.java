package io.github.chirino.atlas.cluster;

/** Turns a labelling prompt into a free-text answer. Failures are reported by exception. */
public interface ClusterSummarizer {

    boolean isEnabled();

    String complete(String prompt);

    String modelId();
}
