package io.github.chirino.atlas.metadata;

import java.util.List;

/** Enricher lookups built without CDI. */
public final class Enrichers {

    private Enrichers() {}

    public static MetadataEnrichers of(MetadataEnricher... enrichers) {
        MetadataEnrichers registry = new MetadataEnrichers();
        registry.enrichers = List.of(enrichers);
        return registry;
    }
}
