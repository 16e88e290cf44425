package io.github.chirino.atlas.config;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.github.chirino.atlas.MutableClock;
import io.github.chirino.atlas.metadata.MemoryMetadataStore;
import io.github.chirino.atlas.metadata.PgMetadataStore;
import io.github.chirino.atlas.queue.MemoryEnrichmentQueue;
import io.github.chirino.atlas.queue.MemoryQueues;
import io.github.chirino.atlas.queue.PgEnrichmentQueue;
import io.github.chirino.atlas.queue.RetryPolicy;
import io.github.chirino.atlas.store.MemoryRecordStore;
import io.github.chirino.atlas.store.MemoryStores;
import io.github.chirino.atlas.store.PgRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import java.time.Duration;

/**
 * The in-memory datastore wired the way the selectors resolve it with {@code
 * atlas.datastore.type=memory}. PostgreSQL beans are mocks that fail if anything touches them.
 */
public final class TestBackend {

    public final MutableClock clock = MutableClock.startingAt("2024-06-01T12:00:00Z");
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MemoryMetadataStore metadata = new MemoryMetadataStore();
    public final MemoryRecordStore records = MemoryStores.recordStore(metadata, clock);
    public final RetryPolicy retryPolicy =
            RetryPolicy.of(Duration.ofSeconds(30), Duration.ofMinutes(30), 3);
    public final MemoryEnrichmentQueue queue = MemoryQueues.queue(records, retryPolicy, clock);

    public final RecordStoreSelector recordStoreSelector = new RecordStoreSelector();
    public final MetadataStoreSelector metadataStoreSelector = new MetadataStoreSelector();
    public final EnrichmentQueueSelector queueSelector = new EnrichmentQueueSelector();

    public TestBackend() {
        recordStoreSelector.datastoreType = "memory";
        recordStoreSelector.pgRecordStore = unusable(PgRecordStore.class);
        recordStoreSelector.memoryRecordStore = instance(records);
        recordStoreSelector.meterRegistry = meterRegistry;
        recordStoreSelector.init();

        metadataStoreSelector.datastoreType = "memory";
        metadataStoreSelector.pgMetadataStore = unusable(PgMetadataStore.class);
        metadataStoreSelector.memoryMetadataStore = instance(metadata);

        queueSelector.datastoreType = "memory";
        queueSelector.pgQueue = unusable(PgEnrichmentQueue.class);
        queueSelector.memoryQueue = instance(queue);
    }

    @SuppressWarnings("unchecked")
    static <T> Instance<T> instance(T value) {
        Instance<T> instance = mock(Instance.class);
        when(instance.get()).thenReturn(value);
        return instance;
    }

    @SuppressWarnings("unchecked")
    static <T> Instance<T> unusable(Class<T> type) {
        Instance<T> instance = mock(Instance.class);
        when(instance.get())
                .thenThrow(new IllegalStateException(type.getSimpleName() + " is not available"));
        return instance;
    }
}
