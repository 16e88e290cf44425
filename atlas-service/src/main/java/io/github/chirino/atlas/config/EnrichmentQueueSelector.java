package io.github.chirino.atlas.config;

import io.github.chirino.atlas.queue.EnrichmentQueue;
import io.github.chirino.atlas.queue.MemoryEnrichmentQueue;
import io.github.chirino.atlas.queue.PgEnrichmentQueue;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class EnrichmentQueueSelector {

    @ConfigProperty(name = "atlas.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject Instance<PgEnrichmentQueue> pgQueue;

    @Inject Instance<MemoryEnrichmentQueue> memoryQueue;

    public boolean isPostgres() {
        String type = datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase();
        return "postgres".equals(type) || "postgresql".equals(type);
    }

    public EnrichmentQueue getQueue() {
        String type = datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase();
        return switch (type) {
            case "postgres", "postgresql" -> pgQueue.get();
            case "memory" -> memoryQueue.get();
            default ->
                    throw new IllegalStateException(
                            "Unsupported atlas.datastore.type: " + datastoreType);
        };
    }
}
