package io.github.chirino.atlas.ingest;

import io.github.chirino.atlas.config.TestBackend;
import io.github.chirino.atlas.metadata.CountryMetadataEnricher;
import io.github.chirino.atlas.metadata.Enrichers;

/** Wires the write path for tests outside this package. */
public final class DocumentServices {

    private DocumentServices() {}

    public static DocumentService service(TestBackend backend) {
        DocumentService service = new DocumentService();
        service.recordStoreSelector = backend.recordStoreSelector;
        service.metadataStoreSelector = backend.metadataStoreSelector;
        service.queueSelector = backend.queueSelector;
        service.metadataEnrichers = Enrichers.of(new CountryMetadataEnricher());
        return service;
    }
}
