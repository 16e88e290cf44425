package io.github.chirino.atlas.api;

import io.github.chirino.atlas.api.dto.DocumentRequest;
import io.github.chirino.atlas.api.dto.DocumentWriteResponse;
import io.github.chirino.atlas.api.dto.ErrorResponse;
import io.github.chirino.atlas.ingest.DocumentService;
import io.github.chirino.atlas.model.DocumentDraft;
import io.github.chirino.atlas.model.DocumentRecord;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.UUID;

@Path("/v1/documents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DocumentResource {

    @Inject DocumentService documentService;

    /**
     * Creates or updates a record identified by {@code (source, sourceId)}. Responds 201 when the
     * record is new and 200 otherwise; a change of title or abstract queues re-enrichment.
     */
    @POST
    public Response upsert(@Valid DocumentRequest request) {
        DocumentDraft draft;
        try {
            draft =
                    new DocumentDraft(
                            request.getSource(),
                            request.getSourceId(),
                            request.getTitle(),
                            request.getAbstractText(),
                            parseDate(request.getPrimaryDate()),
                            request.getMetadata());
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (DateTimeParseException e) {
            return badRequest("Invalid primaryDate (expected yyyy-MM-dd): " + e.getParsedString());
        }

        DocumentService.WriteResult result =
                request.getPriority() == null
                        ? documentService.upsert(draft)
                        : documentService.upsert(draft, request.getPriority());
        DocumentWriteResponse body =
                new DocumentWriteResponse(
                        result.id().toString(), result.created(), result.enqueued());
        return Response.status(result.created() ? Response.Status.CREATED : Response.Status.OK)
                .entity(body)
                .build();
    }

    @GET
    @Path("/{id}")
    public Response get(@PathParam("id") String id) {
        UUID documentId;
        try {
            documentId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            return badRequest("Invalid document id: " + id);
        }
        DocumentRecord record = documentService.get(documentId);
        return Response.ok(
                        QueryRequestMapper.toResponse(record, documentService.metadata(documentId)))
                .build();
    }

    private static LocalDate parseDate(String value) {
        return value == null || value.isBlank() ? null : LocalDate.parse(value.trim());
    }

    private Response badRequest(String message) {
        ErrorResponse error =
                new ErrorResponse("Bad request", "bad_request", Map.of("message", message));
        return Response.status(Response.Status.BAD_REQUEST).entity(error).build();
    }
}
