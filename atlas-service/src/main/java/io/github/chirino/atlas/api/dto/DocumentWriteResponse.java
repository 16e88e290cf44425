package io.github.chirino.atlas.api.dto;

public class DocumentWriteResponse {

    private String id;
    private boolean created;
    private boolean enqueued;

    public DocumentWriteResponse() {}

    public DocumentWriteResponse(String id, boolean created, boolean enqueued) {
        this.id = id;
        this.created = created;
        this.enqueued = enqueued;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public boolean isCreated() {
        return created;
    }

    public void setCreated(boolean created) {
        this.created = created;
    }

    public boolean isEnqueued() {
        return enqueued;
    }

    public void setEnqueued(boolean enqueued) {
        this.enqueued = enqueued;
    }
}
