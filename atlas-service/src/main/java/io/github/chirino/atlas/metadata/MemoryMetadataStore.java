package io.github.chirino.atlas.metadata;

import jakarta.enterprise.context.ApplicationScoped;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class MemoryMetadataStore implements MetadataStore {

    private final Map<UUID, Map<String, Object>> attributes = new ConcurrentHashMap<>();

    @Override
    public void put(UUID documentId, String source, Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            attributes.remove(documentId);
            return;
        }
        Map<String, Object> copy = new HashMap<>(values);
        copy.values().removeIf(v -> v == null);
        attributes.put(documentId, Map.copyOf(copy));
    }

    @Override
    public void merge(UUID documentId, String source, Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return;
        }
        attributes.compute(
                documentId,
                (id, existing) -> {
                    Map<String, Object> merged =
                            existing == null ? new HashMap<>() : new HashMap<>(existing);
                    values.forEach(
                            (key, value) -> {
                                if (value != null) {
                                    merged.put(key, value);
                                }
                            });
                    return Map.copyOf(merged);
                });
    }

    @Override
    public Map<String, Object> get(UUID documentId) {
        return attributes.getOrDefault(documentId, Map.of());
    }

    @Override
    public Map<UUID, Map<String, Object>> lookup(Collection<UUID> documentIds) {
        Map<UUID, Map<String, Object>> result = new HashMap<>();
        for (UUID id : documentIds) {
            Map<String, Object> values = attributes.get(id);
            if (values != null) {
                result.put(id, values);
            }
        }
        return result;
    }
}
