package io.github.chirino.atlas.api;

import io.github.chirino.atlas.api.dto.SearchRequest;
import io.github.chirino.atlas.api.dto.SearchResponse;
import io.github.chirino.atlas.query.QueryEngine;
import io.github.chirino.atlas.query.QueryResult;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/v1/search")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SearchResource {

    @Inject QueryRequestMapper mapper;

    @Inject QueryEngine queryEngine;

    /**
     * Viewport, filter and semantic query over positioned records. {@code status} is {@code
     * truncated} when more records matched than the limit allowed.
     */
    @POST
    public SearchResponse search(@Valid SearchRequest request) {
        QueryResult result = queryEngine.execute(mapper.toSpec(request));
        SearchResponse response = new SearchResponse();
        response.setData(QueryRequestMapper.toResponses(result.items()));
        response.setStatus(result.status().toValue());
        response.setSource(result.source().name().toLowerCase());
        return response;
    }
}
