package io.github.chirino.atlas.metadata;

import io.github.chirino.atlas.model.DocumentRecord;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the country of an OpenAlex work from the country code of its first institution and
 * groups it as United States, China or the rest of the world. Works without a recognizable code
 * are recorded as {@value #UNKNOWN} so they are not enriched again.
 */
@ApplicationScoped
public class CountryMetadataEnricher implements MetadataEnricher {

    static final String SOURCE = "openalex";
    static final String COUNTRY = "country";
    static final String COUNTRY_GROUP = "country_group";
    static final String UNKNOWN = "Unknown";
    static final String REST_OF_WORLD = "Rest of the World";

    private static final Set<String> ISO_COUNTRIES = Set.of(Locale.getISOCountries());

    @Override
    public String name() {
        return "country";
    }

    @Override
    public boolean supports(String source) {
        return SOURCE.equalsIgnoreCase(source);
    }

    @Override
    public Map<String, Object> enrich(DocumentRecord record, Map<String, Object> current) {
        String code = countryCode(current);
        if (code == null || !ISO_COUNTRIES.contains(code)) {
            return Map.of(COUNTRY, UNKNOWN, COUNTRY_GROUP, UNKNOWN);
        }
        String name = new Locale("", code).getDisplayCountry(Locale.ENGLISH);
        return Map.of(COUNTRY, name, COUNTRY_GROUP, group(code, name));
    }

    /** First institution's {@code country_code}, else the flat {@code institution_country_code}. */
    static String countryCode(Map<String, Object> attributes) {
        if (attributes == null) {
            return null;
        }
        if (attributes.get("institutions") instanceof List<?> institutions
                && !institutions.isEmpty()
                && institutions.get(0) instanceof Map<?, ?> first) {
            String code = normalize(first.get("country_code"));
            if (code != null) {
                return code;
            }
        }
        return normalize(attributes.get("institution_country_code"));
    }

    private static String group(String code, String name) {
        return switch (code) {
            case "US", "CN" -> name;
            default -> REST_OF_WORLD;
        };
    }

    private static String normalize(Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            return null;
        }
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
