package io.github.chirino.atlas.cluster;

public class DisabledClusterSummarizer implements ClusterSummarizer {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String complete(String prompt) {
        throw new IllegalStateException("Cluster summarization is disabled");
    }

    @Override
    public String modelId() {
        return "none";
    }
}
