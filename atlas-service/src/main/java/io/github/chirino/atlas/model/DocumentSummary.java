package io.github.chirino.atlas.model;

import java.time.LocalDate;
import java.util.UUID;

/** The columns a query returns for each positioned record; the embedding is not carried. */
public record DocumentSummary(
        UUID id,
        String source,
        String sourceId,
        String title,
        String abstractText,
        LocalDate primaryDate,
        Position position) {

    public static DocumentSummary of(DocumentRecord record) {
        return new DocumentSummary(
                record.getId(),
                record.getSource(),
                record.getSourceId(),
                record.getTitle(),
                record.getAbstractText(),
                record.getPrimaryDate(),
                record.getPosition());
    }
}
