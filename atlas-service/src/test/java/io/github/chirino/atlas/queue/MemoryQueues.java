package io.github.chirino.atlas.queue;

import io.github.chirino.atlas.store.MemoryRecordStore;
import java.time.Clock;

/** Wires in-memory queues for tests outside this package. */
public final class MemoryQueues {

    private MemoryQueues() {}

    public static MemoryEnrichmentQueue queue(
            MemoryRecordStore records, RetryPolicy retryPolicy, Clock clock) {
        MemoryEnrichmentQueue queue = new MemoryEnrichmentQueue();
        queue.recordStore = records;
        queue.retryPolicy = retryPolicy;
        queue.clock = clock;
        return queue;
    }
}
