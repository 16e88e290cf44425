package io.github.chirino.atlas.metadata;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Per-source attributes kept beside the core record. They are resolved at query time and never
 * become part of the record type itself.
 */
public interface MetadataStore {

    /** Replaces the attributes of one record. An empty map removes them. */
    void put(UUID documentId, String source, Map<String, Object> attributes);

    /**
     * Adds or overwrites the given attributes, leaving every other attribute of the record in
     * place. Null values are ignored.
     */
    void merge(UUID documentId, String source, Map<String, Object> attributes);

    Map<String, Object> get(UUID documentId);

    /** Attributes for each id that has any; ids without metadata are absent from the result. */
    Map<UUID, Map<String, Object>> lookup(Collection<UUID> documentIds);
}
