package io.github.chirino.atlas.api;

import io.github.chirino.atlas.projection.ProjectionModelRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;

@Path("/v1/health")
public class HealthResource {

    @Inject ProjectionModelRegistry projectionModels;

    /** Liveness plus whether positions can currently be computed. */
    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        boolean ready = projectionModels.state() == ProjectionModelRegistry.State.READY;
        body.put("status", ready ? "ok" : "degraded");
        body.put("projectionModel", projectionModels.state().name().toLowerCase());
        return body;
    }
}
