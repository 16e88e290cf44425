package io.github.chirino.atlas.api;

import io.github.chirino.atlas.api.dto.DocumentResponse;
import io.github.chirino.atlas.api.dto.FilterDto;
import io.github.chirino.atlas.api.dto.SearchRequest;
import io.github.chirino.atlas.model.DocumentRecord;
import io.github.chirino.atlas.model.DocumentSummary;
import io.github.chirino.atlas.query.BoundingBox;
import io.github.chirino.atlas.query.FieldFilter;
import io.github.chirino.atlas.query.FilterField;
import io.github.chirino.atlas.query.InvalidQueryException;
import io.github.chirino.atlas.query.OrderingMode;
import io.github.chirino.atlas.query.QuerySpec;
import io.github.chirino.atlas.query.ScoredDocument;
import io.github.chirino.atlas.query.SearchService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Converts between the JSON request/response shapes and the query types. */
@ApplicationScoped
public class QueryRequestMapper {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Inject SearchService searchService;

    public QuerySpec toSpec(SearchRequest request) {
        QuerySpec.Builder builder = QuerySpec.builder();
        builder.box(BoundingBox.parse(request.getBbox()));
        if (request.getFilters() != null) {
            for (FilterDto filter : request.getFilters()) {
                builder.filter(toFilter(filter));
            }
        }
        builder.ordering(OrderingMode.fromValue(request.getOrdering()));
        if (request.getLimit() != null) {
            builder.cap(request.getLimit());
        }
        // Embed last so malformed requests never reach the provider.
        double floor =
                request.getSimilarityThreshold() == null ? 0.0 : request.getSimilarityThreshold();
        builder.semantic(searchService.semanticQuery(request.getSemanticText(), floor));
        return builder.build();
    }

    static FieldFilter toFilter(FilterDto dto) {
        if (dto == null) {
            throw new InvalidQueryException("Filter must not be null");
        }
        FilterField field = FilterField.parse(dto.getField());
        if (dto.getValues() != null) {
            return FieldFilter.in(field, dto.getValues());
        }
        if (dto.getValue() != null) {
            return FieldFilter.equalTo(field, dto.getValue());
        }
        if (dto.getFrom() != null || dto.getTo() != null) {
            return FieldFilter.between(field, date(dto.getFrom()), date(dto.getTo()));
        }
        throw new InvalidQueryException("Filter on " + field + " needs a value, values or a range");
    }

    private static LocalDate date(String value) {
        return value == null || value.isBlank() ? null : FieldFilter.parseDate(value);
    }

    static DocumentResponse toResponse(ScoredDocument hit) {
        DocumentResponse response = summary(hit.document());
        response.setSimilarity(hit.similarity());
        response.setMetadata(hit.metadata());
        return response;
    }

    static DocumentResponse toResponse(DocumentRecord record, Map<String, Object> metadata) {
        DocumentResponse response = summary(DocumentSummary.of(record));
        response.setEmbedded(record.hasEmbedding());
        response.setMetadata(metadata);
        response.setCreatedAt(format(record.getCreatedAt()));
        response.setUpdatedAt(format(record.getUpdatedAt()));
        return response;
    }

    private static String format(Instant instant) {
        return instant == null ? null : ISO_FORMATTER.format(instant.atOffset(ZoneOffset.UTC));
    }

    private static DocumentResponse summary(DocumentSummary document) {
        DocumentResponse response = new DocumentResponse();
        response.setId(document.id().toString());
        response.setSource(document.source());
        response.setSourceId(document.sourceId());
        response.setTitle(document.title());
        response.setAbstractText(document.abstractText());
        if (document.primaryDate() != null) {
            response.setPrimaryDate(document.primaryDate().toString());
        }
        if (document.position() != null) {
            response.setEmbedded(true);
            response.setX(document.position().x());
            response.setY(document.position().y());
        }
        return response;
    }

    static List<DocumentResponse> toResponses(List<ScoredDocument> hits) {
        List<DocumentResponse> responses = new ArrayList<>(hits.size());
        for (ScoredDocument hit : hits) {
            responses.add(toResponse(hit));
        }
        return responses;
    }
}
