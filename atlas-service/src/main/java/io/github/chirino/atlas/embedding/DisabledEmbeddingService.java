package io.github.chirino.atlas.embedding;

public class DisabledEmbeddingService implements EmbeddingService {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public float[] embed(String text) {
        throw new EmbeddingProviderException(
                "Embedding is disabled (atlas.embedding.type=none)", true);
    }

    @Override
    public int dimensions() {
        return 0;
    }

    @Override
    public String modelId() {
        return "none";
    }
}
