package io.github.chirino.atlas.store;

import io.github.chirino.atlas.metadata.MemoryMetadataStore;
import java.time.Clock;

/** Wires in-memory stores for tests outside this package. */
public final class MemoryStores {

    private MemoryStores() {}

    public static MemoryRecordStore recordStore(MemoryMetadataStore metadata, Clock clock) {
        MemoryRecordStore store = new MemoryRecordStore();
        store.metadataStore = metadata;
        store.clock = clock;
        return store;
    }
}
