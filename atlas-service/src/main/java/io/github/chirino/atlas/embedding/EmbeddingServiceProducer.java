package io.github.chirino.atlas.embedding;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class EmbeddingServiceProducer {

    private static final Logger LOG = Logger.getLogger(EmbeddingServiceProducer.class);

    @ConfigProperty(name = "atlas.embedding.type", defaultValue = "local")
    String embeddingType;

    @ConfigProperty(name = "atlas.embedding.dimensions", defaultValue = "1536")
    int dimensions;

    @ConfigProperty(name = "atlas.embedding.openai.api-key")
    Optional<String> openaiApiKey;

    // Fallback: picks up the generic OPENAI_API_KEY env var
    @ConfigProperty(name = "openai.api.key")
    Optional<String> genericOpenaiApiKey;

    @ConfigProperty(
            name = "atlas.embedding.openai.model-name",
            defaultValue = "text-embedding-3-small")
    String openaiModelName;

    @ConfigProperty(
            name = "atlas.embedding.openai.base-url",
            defaultValue = "https://api.openai.com/v1")
    String openaiBaseUrl;

    @ConfigProperty(name = "atlas.enrichment.provider-timeout", defaultValue = "PT30S")
    Duration providerTimeout;

    @Produces
    @Singleton
    public EmbeddingService embeddingService() {
        EmbeddingService service =
                switch (embeddingType.trim().toLowerCase()) {
                    case "local" -> new LocalEmbeddingService();
                    case "openai" ->
                            new OpenAiEmbeddingService(
                                    openaiApiKey.or(() -> genericOpenaiApiKey).orElse(null),
                                    openaiModelName,
                                    openaiBaseUrl,
                                    dimensions,
                                    providerTimeout);
                    case "hash" -> new HashEmbeddingService(dimensions);
                    case "none" -> new DisabledEmbeddingService();
                    default ->
                            throw new IllegalStateException(
                                    "Unsupported embedding type: "
                                            + embeddingType
                                            + ". Valid values: local, openai, hash, none");
                };
        if (service.isEnabled() && service.dimensions() != dimensions) {
            throw new IllegalStateException(
                    "Embedding model "
                            + service.modelId()
                            + " produces "
                            + service.dimensions()
                            + " dimensions but atlas.embedding.dimensions="
                            + dimensions);
        }
        LOG.infof("Using embedding model %s (%d dimensions)", service.modelId(), dimensions);
        return service;
    }
}
