package io.github.chirino.atlas.api.dto;

import java.util.List;

public class SearchResponse {

    private List<DocumentResponse> data;
    private String status;
    private String source;

    public List<DocumentResponse> getData() {
        return data;
    }

    public void setData(List<DocumentResponse> data) {
        this.data = data;
    }

    /** {@code complete} or {@code truncated}. */
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }
}
