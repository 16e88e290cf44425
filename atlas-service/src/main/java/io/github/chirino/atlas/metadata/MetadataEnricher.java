package io.github.chirino.atlas.metadata;

import io.github.chirino.atlas.model.DocumentRecord;
import java.util.Map;

/**
 * Derives additional attributes for records of one source from what they were ingested with.
 * Derived attributes are merged into the record's metadata by the METADATA worker.
 */
public interface MetadataEnricher {

    /** Short name used in logs and failure messages. */
    String name();

    boolean supports(String source);

    /**
     * @param current the record's metadata as stored right now
     * @return attributes to merge; an empty map leaves the metadata unchanged
     */
    Map<String, Object> enrich(DocumentRecord record, Map<String, Object> current);
}
