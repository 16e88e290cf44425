package io.github.chirino.atlas.cluster;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import java.time.Duration;

public class OpenAiClusterSummarizer implements ClusterSummarizer {

    private final ChatModel model;
    private final String modelName;

    public OpenAiClusterSummarizer(
            String apiKey, String modelName, String baseUrl, Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                    "atlas.cluster.summarizer.openai.api-key is required when summarizer type is"
                            + " openai");
        }
        this.modelName = modelName;
        this.model =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(modelName)
                        .baseUrl(baseUrl)
                        .timeout(timeout)
                        .temperature(0.0)
                        .maxRetries(0)
                        .build();
    }

    OpenAiClusterSummarizer(ChatModel model, String modelName) {
        this.model = model;
        this.modelName = modelName;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public String complete(String prompt) {
        try {
            return model.chat(prompt);
        } catch (RuntimeException e) {
            throw EmbeddingProviderException.wrap(modelId(), e);
        }
    }

    @Override
    public String modelId() {
        return "openai/" + modelName;
    }
}
