package io.github.chirino.atlas.query;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A filterable field: one of the indexed record columns, or an attribute of the per-source
 * metadata side table ({@code metadata.<key>}).
 */
public final class FilterField {

    public enum Kind {
        SOURCE,
        PRIMARY_DATE,
        METADATA
    }

    private static final String METADATA_PREFIX = "metadata.";
    private static final Pattern METADATA_KEY = Pattern.compile("[A-Za-z0-9_]{1,64}");

    public static final FilterField SOURCE = new FilterField(Kind.SOURCE, null);
    public static final FilterField PRIMARY_DATE = new FilterField(Kind.PRIMARY_DATE, null);

    private final Kind kind;
    private final String metadataKey;

    private FilterField(Kind kind, String metadataKey) {
        this.kind = kind;
        this.metadataKey = metadataKey;
    }

    public static FilterField metadata(String key) {
        if (key == null || !METADATA_KEY.matcher(key).matches()) {
            throw new InvalidQueryException("Invalid metadata attribute name: " + key);
        }
        return new FilterField(Kind.METADATA, key);
    }

    public static FilterField parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidQueryException("Filter field is required");
        }
        String trimmed = name.trim();
        if (trimmed.startsWith(METADATA_PREFIX)) {
            return metadata(trimmed.substring(METADATA_PREFIX.length()));
        }
        return switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "source" -> SOURCE;
            case "primary_date", "date" -> PRIMARY_DATE;
            default -> throw new InvalidQueryException("Unknown filter field: " + name);
        };
    }

    public Kind kind() {
        return kind;
    }

    public String metadataKey() {
        return metadataKey;
    }

    public boolean isMetadata() {
        return kind == Kind.METADATA;
    }

    public String displayName() {
        return switch (kind) {
            case SOURCE -> "source";
            case PRIMARY_DATE -> "primary_date";
            case METADATA -> METADATA_PREFIX + metadataKey;
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterField other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(metadataKey, other.metadataKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, metadataKey);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
