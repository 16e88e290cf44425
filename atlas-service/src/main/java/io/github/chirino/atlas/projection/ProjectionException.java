package io.github.chirino.atlas.projection;

/** Raised when a model cannot be loaded or cannot be applied to an embedding. */
public class ProjectionException extends RuntimeException {

    public ProjectionException(String message) {
        super(message);
    }

    public ProjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
