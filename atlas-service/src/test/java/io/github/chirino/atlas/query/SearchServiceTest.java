package io.github.chirino.atlas.query;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.atlas.embedding.DisabledEmbeddingService;
import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import io.github.chirino.atlas.embedding.EmbeddingService;
import io.github.chirino.atlas.worker.ProviderCallExecutor;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchServiceTest {

    private EmbeddingService embeddingService;
    private SearchService service;

    @BeforeEach
    void setUp() {
        embeddingService = mock(EmbeddingService.class);
        when(embeddingService.isEnabled()).thenReturn(true);
        when(embeddingService.dimensions()).thenReturn(2);
        when(embeddingService.modelId()).thenReturn("mock");
        service = new SearchService();
        service.embeddingService = embeddingService;
        service.providerCalls = ProviderCallExecutor.withTimeout(Duration.ofSeconds(5));
    }

    @Test
    void embeds_stripped_text() {
        when(embeddingService.embed("graph networks")).thenReturn(new float[] {0.6f, 0.8f});

        SemanticQuery query = service.semanticQuery("  graph networks ", 0.3);

        assertArrayEquals(new float[] {0.6f, 0.8f}, query.vector());
        assertEquals(0.3, query.similarityFloor());
    }

    @Test
    void blank_text_means_no_semantic_query() {
        assertNull(service.semanticQuery("   ", 0.0));
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    void provider_failure_is_not_degraded_to_unranked_results() {
        when(embeddingService.embed(anyString()))
                .thenThrow(new EmbeddingProviderException("upstream 503", true));

        assertThrows(
                SemanticSearchUnavailableException.class,
                () -> service.semanticQuery("graph", 0.0));
    }

    @Test
    void wrong_dimensionality_is_unavailable() {
        when(embeddingService.embed(anyString())).thenReturn(new float[3]);

        assertThrows(
                SemanticSearchUnavailableException.class,
                () -> service.semanticQuery("graph", 0.0));
    }

    @Test
    void disabled_embedding_rejects_semantic_text() {
        service.embeddingService = new DisabledEmbeddingService();

        assertThrows(
                SemanticSearchUnavailableException.class,
                () -> service.semanticQuery("graph", 0.0));
    }

    @Test
    void floor_is_validated() {
        when(embeddingService.embed(anyString())).thenReturn(new float[] {1f, 0f});

        assertThrows(InvalidQueryException.class, () -> service.semanticQuery("graph", 1.5));
    }
}
