package io.github.chirino.atlas.embedding;

/**
 * Maps text to a fixed-length vector. Calls may block on a remote provider; callers bound them
 * with a timeout and never hold a lock across one.
 */
public interface EmbeddingService {

    boolean isEnabled();

    /**
     * @throws EmbeddingProviderException when the provider rejects the input or is unavailable
     */
    float[] embed(String text);

    int dimensions();

    String modelId();
}
