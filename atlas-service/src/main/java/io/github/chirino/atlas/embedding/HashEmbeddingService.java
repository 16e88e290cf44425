package io.github.chirino.atlas.embedding;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Deterministic bag-of-tokens embedding: each token is hashed (FNV-1a) into a signed bucket and
 * the vector is L2-normalized. Texts sharing tokens get high cosine similarity, which is enough
 * for development and tests without a model download.
 */
public class HashEmbeddingService implements EmbeddingService {

    private final int dimensions;

    public HashEmbeddingService(int dimensions) {
        this.dimensions = Math.max(8, dimensions);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw EmbeddingProviderException.permanent("Cannot embed blank text");
        }
        float[] vector = new float[dimensions];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            int hash = stableHash(token);
            int index = Math.floorMod(hash, dimensions);
            float sign = (hash & 1) == 0 ? 1.0f : -1.0f;
            vector[index] += sign;
        }
        normalize(vector);
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "hash/fnv1a-" + dimensions;
    }

    private int stableHash(String token) {
        byte[] data = token.getBytes(StandardCharsets.UTF_8);
        int hash = 0x811C9DC5;
        for (byte b : data) {
            hash ^= b & 0xff;
            hash *= 0x01000193;
        }
        return hash;
    }

    private void normalize(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += v * v;
        }
        if (sum <= 0.0) {
            return;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < vector.length; i++) {
            vector[i] = vector[i] / norm;
        }
    }
}
