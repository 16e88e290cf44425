package io.github.chirino.atlas.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EnrichmentQueueSelectorTest {

    @Test
    void selects_memory_queue() {
        TestBackend backend = new TestBackend();

        assertSame(backend.queue, backend.queueSelector.getQueue());
        assertFalse(backend.queueSelector.isPostgres());
    }

    @Test
    void postgres_is_the_default() {
        EnrichmentQueueSelector selector = new EnrichmentQueueSelector();
        selector.datastoreType = null;

        assertTrue(selector.isPostgres());
    }

    @Test
    void rejects_unknown_datastore_type() {
        TestBackend backend = new TestBackend();
        backend.queueSelector.datastoreType = "redis";

        assertThrows(IllegalStateException.class, backend.queueSelector::getQueue);
    }

    @Test
    void metadata_selector_follows_datastore_type() {
        TestBackend backend = new TestBackend();

        assertSame(backend.metadata, backend.metadataStoreSelector.getStore());
        backend.metadataStoreSelector.datastoreType = "postgres";
        // The PostgreSQL bean is unavailable in this fixture.
        assertThrows(IllegalStateException.class, backend.metadataStoreSelector::getStore);
    }
}
