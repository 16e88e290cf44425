package io.github.chirino.atlas.projection;

import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Holds the projection model in use. The model is loaded once and only ever replaced by an
 * atomic reference swap when the artifact on disk carries a different version, so workers always
 * see a complete model. A failed reload keeps the current model.
 */
@ApplicationScoped
public class ProjectionModelRegistry {

    private static final Logger LOG = Logger.getLogger(ProjectionModelRegistry.class);

    public enum State {
        READY,
        MISSING,
        FAILED
    }

    @ConfigProperty(name = "atlas.projection.model-path")
    Optional<String> modelPath;

    @Inject ProjectionModelLoader loader;

    private final AtomicReference<ProjectionModel> current = new AtomicReference<>();
    private volatile String lastError;

    @PostConstruct
    void init() {
        reload();
    }

    @Scheduled(
            every = "${atlas.projection.reload-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledReload() {
        reload();
    }

    /**
     * Re-reads the artifact and swaps it in if its version differs.
     *
     * @return {@code true} if a new model was published
     */
    public boolean reload() {
        if (modelPath.isEmpty() || modelPath.get().isBlank()) {
            lastError = "atlas.projection.model-path is not configured";
            return false;
        }
        ProjectionModel loaded;
        try {
            loaded = loader.load(Path.of(modelPath.get()));
        } catch (ProjectionException e) {
            lastError = e.getMessage();
            if (current.get() == null) {
                LOG.warnf(
                        "Projection model unavailable, projection is degraded: %s",
                        e.getMessage());
            } else {
                LOG.warnf(
                        "Keeping projection model %s, reload failed: %s",
                        current.get().version(), e.getMessage());
            }
            return false;
        }
        lastError = null;
        ProjectionModel previous = current.get();
        if (previous != null && previous.version().equals(loaded.version())) {
            return false;
        }
        current.set(loaded);
        LOG.infof(
                "Loaded projection model %s (%d input dimensions)%s",
                loaded.version(),
                loaded.inputDimensions(),
                previous == null ? "" : ", replacing " + previous.version());
        return true;
    }

    /** Publishes a model directly, e.g. one built in code. */
    public void publish(ProjectionModel model) {
        current.set(model);
        lastError = null;
    }

    public Optional<ProjectionModel> current() {
        return Optional.ofNullable(current.get());
    }

    public State state() {
        if (current.get() != null) {
            return State.READY;
        }
        return modelPath.filter(p -> !p.isBlank()).isPresent() ? State.FAILED : State.MISSING;
    }

    public String lastError() {
        return lastError;
    }
}
