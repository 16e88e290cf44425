package io.github.chirino.atlas.store;

public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String id;

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = String.valueOf(id);
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
