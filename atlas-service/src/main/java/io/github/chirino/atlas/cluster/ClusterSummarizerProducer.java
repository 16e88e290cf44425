package io.github.chirino.atlas.cluster;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class ClusterSummarizerProducer {

    @ConfigProperty(name = "atlas.cluster.summarizer.type", defaultValue = "none")
    String summarizerType;

    @ConfigProperty(name = "atlas.cluster.summarizer.openai.api-key")
    Optional<String> openaiApiKey;

    // Fallback: picks up the generic OPENAI_API_KEY env var
    @ConfigProperty(name = "openai.api.key")
    Optional<String> genericOpenaiApiKey;

    @ConfigProperty(
            name = "atlas.cluster.summarizer.openai.model-name",
            defaultValue = "gpt-4o-mini")
    String openaiModelName;

    @ConfigProperty(
            name = "atlas.cluster.summarizer.openai.base-url",
            defaultValue = "https://api.openai.com/v1")
    String openaiBaseUrl;

    @ConfigProperty(name = "atlas.cluster.summarizer.timeout", defaultValue = "PT20S")
    Duration timeout;

    @Produces
    @Singleton
    public ClusterSummarizer clusterSummarizer() {
        return switch (summarizerType.trim().toLowerCase()) {
            case "openai" ->
                    new OpenAiClusterSummarizer(
                            openaiApiKey.or(() -> genericOpenaiApiKey).orElse(null),
                            openaiModelName,
                            openaiBaseUrl,
                            timeout);
            case "none" -> new DisabledClusterSummarizer();
            default ->
                    throw new IllegalStateException(
                            "Unsupported cluster summarizer type: "
                                    + summarizerType
                                    + ". Valid values: openai, none");
        };
    }
}
