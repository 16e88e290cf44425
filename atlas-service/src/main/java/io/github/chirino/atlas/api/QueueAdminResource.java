package io.github.chirino.atlas.api;

import io.github.chirino.atlas.api.dto.ErrorResponse;
import io.github.chirino.atlas.config.EnrichmentQueueSelector;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueStatus;
import io.github.chirino.atlas.queue.QueueReconciler;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/** Operator endpoints for inspecting and unblocking the enrichment queue. */
@Path("/v1/admin/queue")
@Produces(MediaType.APPLICATION_JSON)
public class QueueAdminResource {

    private static final Logger LOG = Logger.getLogger(QueueAdminResource.class);

    @Inject EnrichmentQueueSelector queueSelector;

    @Inject QueueReconciler reconciler;

    @GET
    @Path("/stats")
    public Map<String, Map<String, Long>> stats() {
        Map<String, Map<String, Long>> body = new LinkedHashMap<>();
        for (Map.Entry<EnrichmentKind, Map<QueueStatus, Long>> kind :
                queueSelector.getQueue().stats().entrySet()) {
            Map<String, Long> counts = new LinkedHashMap<>();
            for (Map.Entry<QueueStatus, Long> status : kind.getValue().entrySet()) {
                counts.put(status.getKey().toValue(), status.getValue());
            }
            body.put(kind.getKey().toValue(), counts);
        }
        return body;
    }

    @POST
    @Path("/{kind}/requeue-failed")
    public Response requeueFailed(@PathParam("kind") String kind) {
        EnrichmentKind enrichmentKind;
        try {
            enrichmentKind = EnrichmentKind.fromValue(kind);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        }
        int requeued = queueSelector.getQueue().requeueFailed(enrichmentKind);
        LOG.infof("Requeued %d failed %s entries", requeued, enrichmentKind.toValue());
        return Response.ok(Map.of("kind", enrichmentKind.toValue(), "requeued", requeued))
                .build();
    }

    @POST
    @Path("/entries/{id}/requeue")
    public Response requeue(@PathParam("id") long id) {
        if (!queueSelector.getQueue().requeue(id)) {
            ErrorResponse error =
                    new ErrorResponse(
                            "Not found",
                            "not_found",
                            Map.of("resource", "failed queue entry", "id", String.valueOf(id)));
            return Response.status(Response.Status.NOT_FOUND).entity(error).build();
        }
        LOG.infof("Requeued failed queue entry %d", id);
        return Response.ok(Map.of("id", id, "requeued", true)).build();
    }

    @POST
    @Path("/reconcile")
    public Map<String, Integer> reconcile() {
        return Map.of("released", reconciler.reconcileNow());
    }

    private Response badRequest(String message) {
        ErrorResponse error =
                new ErrorResponse("Bad request", "bad_request", Map.of("message", message));
        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
