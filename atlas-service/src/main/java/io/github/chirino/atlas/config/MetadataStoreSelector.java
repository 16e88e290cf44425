package io.github.chirino.atlas.config;

import io.github.chirino.atlas.metadata.MemoryMetadataStore;
import io.github.chirino.atlas.metadata.MetadataStore;
import io.github.chirino.atlas.metadata.PgMetadataStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class MetadataStoreSelector {

    @ConfigProperty(name = "atlas.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject Instance<PgMetadataStore> pgMetadataStore;

    @Inject Instance<MemoryMetadataStore> memoryMetadataStore;

    public MetadataStore getStore() {
        String type = datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase();
        return switch (type) {
            case "postgres", "postgresql" -> pgMetadataStore.get();
            case "memory" -> memoryMetadataStore.get();
            default ->
                    throw new IllegalStateException(
                            "Unsupported atlas.datastore.type: " + datastoreType);
        };
    }
}
