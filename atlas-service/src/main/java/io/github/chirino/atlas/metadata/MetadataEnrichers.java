package io.github.chirino.atlas.metadata;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/** The {@link MetadataEnricher} beans deployed in this application, looked up by source. */
@ApplicationScoped
public class MetadataEnrichers {

    private static final Logger LOG = Logger.getLogger(MetadataEnrichers.class);

    @Inject Instance<MetadataEnricher> instances;

    List<MetadataEnricher> enrichers = List.of();

    @PostConstruct
    void init() {
        enrichers = instances.stream().toList();
        LOG.infof(
                "Metadata enrichers: %s",
                enrichers.stream().map(MetadataEnricher::name).toList());
    }

    public Optional<MetadataEnricher> forSource(String source) {
        return enrichers.stream().filter(e -> e.supports(source)).findFirst();
    }

    public boolean isEmpty() {
        return enrichers.isEmpty();
    }
}
