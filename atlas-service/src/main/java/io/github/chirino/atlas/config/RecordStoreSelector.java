package io.github.chirino.atlas.config;

import io.github.chirino.atlas.store.MemoryRecordStore;
import io.github.chirino.atlas.store.MeteredRecordStore;
import io.github.chirino.atlas.store.PgRecordStore;
import io.github.chirino.atlas.store.RecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class RecordStoreSelector {

    @ConfigProperty(name = "atlas.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject Instance<PgRecordStore> pgRecordStore;

    @Inject Instance<MemoryRecordStore> memoryRecordStore;

    @Inject MeterRegistry meterRegistry;

    private RecordStore meteredStore;

    @PostConstruct
    void init() {
        RecordStore delegate = selectDelegate();
        meteredStore = new MeteredRecordStore(meterRegistry, delegate);
    }

    public RecordStore getStore() {
        return meteredStore;
    }

    private RecordStore selectDelegate() {
        String type = datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase();
        if ("postgres".equals(type) || "postgresql".equals(type)) {
            return pgRecordStore.get();
        }
        if ("memory".equals(type)) {
            return memoryRecordStore.get();
        }
        throw new IllegalStateException("Unsupported atlas.datastore.type: " + datastoreType);
    }
}
