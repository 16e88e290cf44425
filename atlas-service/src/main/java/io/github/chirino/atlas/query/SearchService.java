package io.github.chirino.atlas.query;

import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import io.github.chirino.atlas.embedding.EmbeddingService;
import io.github.chirino.atlas.worker.ProviderCallExecutor;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/** Resolves free-text semantic queries to vectors through the embedding provider. */
@ApplicationScoped
public class SearchService {

    private static final Logger LOG = Logger.getLogger(SearchService.class);

    @Inject EmbeddingService embeddingService;

    @Inject ProviderCallExecutor providerCalls;

    /**
     * Embeds {@code text} for use as a semantic query. Returns {@code null} for blank text.
     *
     * @throws SemanticSearchUnavailableException if the text cannot be embedded; the caller
     *     must not fall back to unranked results
     */
    public SemanticQuery semanticQuery(String text, double similarityFloor) {
        if (text == null || text.isBlank()) {
            return null;
        }
        if (!embeddingService.isEnabled()) {
            throw new SemanticSearchUnavailableException(
                    "Semantic search is disabled: no embedding model is configured", null);
        }
        float[] vector;
        try {
            vector =
                    providerCalls.call(
                            "Query embedding", () -> embeddingService.embed(text.strip()));
        } catch (EmbeddingProviderException e) {
            LOG.warnf(
                    "Could not embed search text with %s: %s",
                    embeddingService.modelId(), e.getMessage());
            throw new SemanticSearchUnavailableException(
                    "Semantic search is temporarily unavailable: " + e.getMessage(), e);
        }
        if (vector == null || vector.length != embeddingService.dimensions()) {
            throw new SemanticSearchUnavailableException(
                    "Embedding model "
                            + embeddingService.modelId()
                            + " returned an unusable vector",
                    null);
        }
        return new SemanticQuery(vector, similarityFloor);
    }
}
