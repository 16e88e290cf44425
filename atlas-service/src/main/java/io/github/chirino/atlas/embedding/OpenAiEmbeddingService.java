package io.github.chirino.atlas.embedding;

import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;

public class OpenAiEmbeddingService implements EmbeddingService {

    private final OpenAiEmbeddingModel model;
    private final String modelName;
    private final int dimensions;

    public OpenAiEmbeddingService(
            String apiKey, String modelName, String baseUrl, Integer dimensions, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                    "atlas.embedding.openai.api-key is required when embedding type is openai");
        }
        this.modelName = modelName;

        var builder =
                OpenAiEmbeddingModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .baseUrl(baseUrl)
                        .timeout(timeout)
                        // retries are owned by the enrichment queue
                        .maxRetries(0);

        if (dimensions != null && dimensions > 0) {
            builder.dimensions(dimensions);
            this.dimensions = dimensions;
        } else {
            this.dimensions = inferDimensions(modelName);
        }

        this.model = builder.build();
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
        try {
            return model.embed(text).content().vector();
        } catch (RuntimeException e) {
            throw EmbeddingProviderException.wrap(modelId(), e);
        }
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelId() {
        return "openai/" + modelName;
    }

    private static int inferDimensions(String modelName) {
        return switch (modelName) {
            case "text-embedding-3-small" -> 1536;
            case "text-embedding-3-large" -> 3072;
            case "text-embedding-ada-002" -> 1536;
            default -> 1536;
        };
    }
}
