package io.github.chirino.atlas.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jboss.logging.Logger;

/** Metadata side table {@code document_metadata}, one jsonb document per record. */
@ApplicationScoped
public class PgMetadataStore implements MetadataStore {

    private static final Logger LOG = Logger.getLogger(PgMetadataStore.class);
    private static final TypeReference<Map<String, Object>> ATTRIBUTES_TYPE =
            new TypeReference<>() {};

    @Inject EntityManager entityManager;

    @Inject ObjectMapper objectMapper;

    @Override
    @Transactional
    public void put(UUID documentId, String source, Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            entityManager
                    .createNativeQuery("DELETE FROM document_metadata WHERE document_id = ?1")
                    .setParameter(1, documentId)
                    .executeUpdate();
            return;
        }
        entityManager
                .createNativeQuery(
                        "INSERT INTO document_metadata (document_id, source, attributes)"
                                + " VALUES (?1, ?2, CAST(?3 AS jsonb))"
                                + " ON CONFLICT (document_id) DO UPDATE SET"
                                + " source = EXCLUDED.source, attributes = EXCLUDED.attributes")
                .setParameter(1, documentId)
                .setParameter(2, source)
                .setParameter(3, toJson(attributes))
                .executeUpdate();
    }

    @Override
    @Transactional
    public void merge(UUID documentId, String source, Map<String, Object> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return;
        }
        Map<String, Object> present = new HashMap<>(attributes);
        present.values().removeIf(v -> v == null);
        entityManager
                .createNativeQuery(
                        "INSERT INTO document_metadata (document_id, source, attributes)"
                                + " VALUES (?1, ?2, CAST(?3 AS jsonb))"
                                + " ON CONFLICT (document_id) DO UPDATE SET"
                                + " attributes = document_metadata.attributes"
                                + " || EXCLUDED.attributes")
                .setParameter(1, documentId)
                .setParameter(2, source)
                .setParameter(3, toJson(present))
                .executeUpdate();
    }

    @Override
    @Transactional
    public Map<String, Object> get(UUID documentId) {
        return lookup(List.of(documentId)).getOrDefault(documentId, Map.of());
    }

    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public Map<UUID, Map<String, Object>> lookup(Collection<UUID> documentIds) {
        if (documentIds.isEmpty()) {
            return Map.of();
        }
        UUID[] ids = documentIds.toArray(UUID[]::new);
        List<Object[]> rows =
                entityManager
                        .createNativeQuery(
                                "SELECT document_id, attributes::text FROM document_metadata"
                                        + " WHERE document_id = ANY(:ids)")
                        .setParameter("ids", ids)
                        .getResultList();
        Map<UUID, Map<String, Object>> result = new HashMap<>();
        for (Object[] row : rows) {
            UUID id = (UUID) row[0];
            result.put(id, fromJson(id, (String) row[1]));
        }
        return result;
    }

    private String toJson(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable to JSON", e);
        }
    }

    private Map<String, Object> fromJson(UUID id, String json) {
        try {
            return objectMapper.readValue(json, ATTRIBUTES_TYPE);
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Ignoring unreadable metadata for document %s", id);
            return Map.of();
        }
    }
}
