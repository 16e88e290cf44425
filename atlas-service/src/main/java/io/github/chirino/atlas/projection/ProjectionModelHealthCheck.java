package io.github.chirino.atlas.projection;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/** Reports DEGRADED (down) while no projection model is loaded; the projection worker idles. */
@Readiness
@ApplicationScoped
public class ProjectionModelHealthCheck implements HealthCheck {

    static final String NAME = "projection-model";

    @Inject ProjectionModelRegistry registry;

    @Override
    public HealthCheckResponse call() {
        return registry.current()
                .map(
                        model ->
                                HealthCheckResponse.named(NAME)
                                        .up()
                                        .withData("version", model.version())
                                        .withData("inputDimensions", model.inputDimensions())
                                        .build())
                .orElseGet(this::degraded);
    }

    private HealthCheckResponse degraded() {
        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named(NAME)
                        .down()
                        .withData("status", "DEGRADED")
                        .withData("state", registry.state().name());
        if (registry.lastError() != null) {
            builder.withData("error", registry.lastError());
        }
        return builder.build();
    }
}
