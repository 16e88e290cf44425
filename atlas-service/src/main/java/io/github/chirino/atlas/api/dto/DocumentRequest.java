package io.github.chirino.atlas.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

public class DocumentRequest {

    @NotBlank
    @Size(max = 64)
    private String source;

    @NotBlank
    @Size(max = 512)
    private String sourceId;

    private String title;

    @JsonProperty("abstract")
    private String abstractText;

    /** ISO date, {@code yyyy-MM-dd}. */
    private String primaryDate;

    private Map<String, Object> metadata;

    private Integer priority;

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public void setAbstractText(String abstractText) {
        this.abstractText = abstractText;
    }

    public String getPrimaryDate() {
        return primaryDate;
    }

    public void setPrimaryDate(String primaryDate) {
        this.primaryDate = primaryDate;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Integer getPriority() {
        return priority;
    }

    public void setPriority(Integer priority) {
        this.priority = priority;
    }
}
