package io.github.chirino.atlas.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EmbeddingServiceProducerTest {

    private EmbeddingServiceProducer createProducer(String type, int dimensions) {
        EmbeddingServiceProducer producer = new EmbeddingServiceProducer();
        producer.embeddingType = type;
        producer.dimensions = dimensions;
        producer.openaiApiKey = Optional.empty();
        producer.genericOpenaiApiKey = Optional.empty();
        producer.openaiModelName = "text-embedding-3-small";
        producer.openaiBaseUrl = "https://api.openai.com/v1";
        producer.providerTimeout = Duration.ofSeconds(30);
        return producer;
    }

    @Test
    void selects_local_when_dimensions_match() {
        EmbeddingService service = createProducer("local", 384).embeddingService();

        assertInstanceOf(LocalEmbeddingService.class, service);
        assertEquals(384, service.dimensions());
        assertEquals("local/all-MiniLM-L6-v2", service.modelId());
    }

    @Test
    void rejects_dimension_mismatch() {
        IllegalStateException ex =
                assertThrows(
                        IllegalStateException.class,
                        createProducer("local", 1536)::embeddingService);
        assertTrue(ex.getMessage().contains("atlas.embedding.dimensions=1536"));
    }

    @Test
    void selects_disabled_for_none() {
        EmbeddingService service = createProducer("none", 1536).embeddingService();

        assertInstanceOf(DisabledEmbeddingService.class, service);
        assertFalse(service.isEnabled());
        assertEquals("none", service.modelId());
    }

    @Test
    void selects_hash_with_configured_dimensions() {
        EmbeddingService service = createProducer("hash", 64).embeddingService();

        assertInstanceOf(HashEmbeddingService.class, service);
        assertEquals(64, service.embed("some text").length);
    }

    @Test
    void openai_requires_api_key() {
        EmbeddingServiceProducer producer = createProducer("openai", 1536);

        assertThrows(IllegalStateException.class, producer::embeddingService);
    }

    @Test
    void openai_falls_back_to_generic_api_key() {
        EmbeddingServiceProducer producer = createProducer("openai", 512);
        producer.genericOpenaiApiKey = Optional.of("sk-generic-key");

        EmbeddingService service = producer.embeddingService();

        assertInstanceOf(OpenAiEmbeddingService.class, service);
        assertEquals(512, service.dimensions());
        assertEquals("openai/text-embedding-3-small", service.modelId());
    }

    @Test
    void rejects_unknown_type() {
        EmbeddingServiceProducer producer = createProducer("cohere", 1536);

        IllegalStateException ex =
                assertThrows(IllegalStateException.class, producer::embeddingService);
        assertTrue(ex.getMessage().contains("cohere"));
    }
}
