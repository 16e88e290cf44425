package io.github.chirino.atlas.api;

import io.github.chirino.atlas.api.dto.ErrorResponse;
import io.github.chirino.atlas.query.InvalidQueryException;
import io.github.chirino.atlas.query.QueryTimeoutException;
import io.github.chirino.atlas.query.SemanticSearchUnavailableException;
import io.github.chirino.atlas.store.ResourceNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps domain exceptions to structured JSON error responses and logs unhandled exceptions with
 * full stack traces.
 */
public class GlobalExceptionMapper {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @ServerExceptionMapper
    public Response handleConstraintViolation(ConstraintViolationException e) {
        List<Map<String, String>> violations =
                e.getConstraintViolations().stream()
                        .map(
                                v ->
                                        Map.of(
                                                "field", extractFieldName(v),
                                                "message", v.getMessage()))
                        .toList();
        return error(
                Response.Status.BAD_REQUEST,
                "Validation failed",
                "validation_error",
                Map.of("violations", violations));
    }

    private String extractFieldName(ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @ServerExceptionMapper
    public Response handleInvalidQuery(InvalidQueryException e) {
        return error(
                Response.Status.BAD_REQUEST,
                "Invalid query",
                "invalid_query",
                Map.of("message", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response handleNotFound(ResourceNotFoundException e) {
        return error(
                Response.Status.NOT_FOUND,
                "Not found",
                "not_found",
                Map.of("resource", e.getResource(), "id", e.getId()));
    }

    @ServerExceptionMapper
    public Response handleQueryTimeout(QueryTimeoutException e) {
        return error(
                Response.Status.GATEWAY_TIMEOUT,
                "Query timed out",
                "query_timeout",
                Map.of(
                        "timeoutMs",
                        e.getTimeout().toMillis(),
                        "message",
                        "Narrow the viewport or add filters and retry."));
    }

    @ServerExceptionMapper
    public Response handleSemanticSearchUnavailable(SemanticSearchUnavailableException e) {
        return error(
                Response.Status.SERVICE_UNAVAILABLE,
                "Semantic search unavailable",
                "semantic_search_unavailable",
                Map.of("message", e.getMessage()));
    }

    @ServerExceptionMapper
    public Response handleException(Exception e) {
        // For WebApplicationException (includes JAX-RS responses), preserve the original status
        if (e instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            if (status >= 500) {
                LOG.errorf(e, "Server error %d", status);
            }
            return wae.getResponse();
        }

        LOG.errorf(e, "Unhandled exception");
        return error(
                Response.Status.INTERNAL_SERVER_ERROR,
                "Internal server error",
                "internal_error",
                Map.of(
                        "message",
                        e.getMessage() != null ? e.getMessage() : e.getClass().getName()));
    }

    private static Response error(
            Response.Status status, String message, String code, Map<String, Object> details) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message, code, details))
                .build();
    }
}
