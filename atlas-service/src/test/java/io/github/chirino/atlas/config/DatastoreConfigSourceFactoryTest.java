package io.github.chirino.atlas.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.smallrye.config.ConfigSourceContext;
import io.smallrye.config.ConfigValue;
import java.util.Map;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.junit.jupiter.api.Test;

class DatastoreConfigSourceFactoryTest {

    private ConfigSource configure(Map<String, String> values) {
        ConfigSourceContext context = mock(ConfigSourceContext.class);
        values.forEach(
                (key, value) ->
                        when(context.getValue(key))
                                .thenReturn(
                                        ConfigValue.builder()
                                                .withName(key)
                                                .withValue(value)
                                                .build()));
        return new DatastoreConfigSourceFactory().getConfigSources(context).iterator().next();
    }

    @Test
    void memory_datastore_disables_liquibase_and_uses_dummy_url() {
        ConfigSource source = configure(Map.of("atlas.datastore.type", "memory"));

        assertEquals("false", source.getValue("quarkus.liquibase.migrate-at-start"));
        assertEquals(
                "jdbc:postgresql://unused:5432/unused",
                source.getValue("quarkus.datasource.jdbc.url"));
        assertEquals(275, source.getOrdinal());
    }

    @Test
    void memory_datastore_keeps_devservices_url() {
        ConfigSource source =
                configure(
                        Map.of(
                                "atlas.datastore.type", "memory",
                                "quarkus.datasource.devservices.enabled", "true"));

        assertNull(source.getValue("quarkus.datasource.jdbc.url"));
    }

    @Test
    void postgres_datastore_migrates_at_start_by_default() {
        ConfigSource source = configure(Map.of());

        assertEquals("true", source.getValue("quarkus.liquibase.migrate-at-start"));
        assertNull(source.getValue("quarkus.datasource.jdbc.url"));
    }

    @Test
    void postgres_datastore_honours_migrate_flag() {
        ConfigSource source =
                configure(
                        Map.of(
                                "atlas.datastore.type", "postgres",
                                "atlas.datastore.migrate-at-start", "false"));

        assertEquals("false", source.getValue("quarkus.liquibase.migrate-at-start"));
    }

    @Test
    void passes_embedding_dimensions_to_changelog() {
        assertEquals(
                "1536",
                configure(Map.of())
                        .getValue("quarkus.liquibase.change-log-parameters.embedding_dimensions"));
        assertEquals(
                "384",
                configure(Map.of("atlas.embedding.dimensions", "384"))
                        .getValue("quarkus.liquibase.change-log-parameters.embedding_dimensions"));
    }
}
