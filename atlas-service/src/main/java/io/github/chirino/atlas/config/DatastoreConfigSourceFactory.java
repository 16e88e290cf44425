package io.github.chirino.atlas.config;

import io.smallrye.config.ConfigSourceContext;
import io.smallrye.config.ConfigSourceFactory;
import io.smallrye.config.ConfigValue;
import io.smallrye.config.PropertiesConfigSource;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.spi.ConfigSource;

/**
 * Derives Quarkus datasource and Liquibase settings from {@code atlas.datastore.type}.
 *
 * <p>With {@code memory}, a dummy JDBC URL keeps Hibernate ORM and the datasource bean active
 * without opening a connection, and Liquibase is switched off. The selectors resolve PostgreSQL
 * beans lazily through {@code Instance<>}, so none of them is touched.
 *
 * <p>With {@code postgres}, {@code atlas.datastore.migrate-at-start} (default {@code true})
 * drives {@code quarkus.liquibase.migrate-at-start}, and the embedding dimensionality is passed
 * to the changelog as the {@code embedding_dimensions} parameter.
 */
public class DatastoreConfigSourceFactory implements ConfigSourceFactory {

    private static final String DATASTORE_TYPE = "atlas.datastore.type";
    private static final String MIGRATE_AT_START = "atlas.datastore.migrate-at-start";
    private static final String EMBEDDING_DIMENSIONS = "atlas.embedding.dimensions";

    // Above application.properties (250), below system properties (300) and env vars (400).
    private static final int ORDINAL = 275;

    @Override
    public Iterable<ConfigSource> getConfigSources(ConfigSourceContext context) {
        String type = getStringValue(context, DATASTORE_TYPE, "postgres");
        String migrateAtStart = getStringValue(context, MIGRATE_AT_START, "true");

        Map<String, String> properties = new HashMap<>();
        if ("memory".equals(type)) {
            String devServicesEnabled =
                    getStringValue(context, "quarkus.datasource.devservices.enabled", "false");
            if (!"true".equals(devServicesEnabled)) {
                properties.put(
                        "quarkus.datasource.jdbc.url", "jdbc:postgresql://unused:5432/unused");
                properties.put("quarkus.datasource.jdbc.initial-size", "0");
                properties.put("quarkus.datasource.jdbc.min-size", "0");
                properties.put("quarkus.datasource.jdbc.max-size", "1");
            }
            properties.put("quarkus.liquibase.migrate-at-start", "false");
        } else {
            properties.put("quarkus.liquibase.migrate-at-start", migrateAtStart);
        }
        properties.put(
                "quarkus.liquibase.change-log-parameters.embedding_dimensions",
                getStringValue(context, EMBEDDING_DIMENSIONS, "1536"));

        return List.of(new PropertiesConfigSource(properties, "datastore-auto-config", ORDINAL));
    }

    private static String getStringValue(
            ConfigSourceContext context, String key, String defaultValue) {
        ConfigValue value = context.getValue(key);
        return (value != null && value.getValue() != null)
                ? value.getValue().trim().toLowerCase()
                : defaultValue;
    }
}
