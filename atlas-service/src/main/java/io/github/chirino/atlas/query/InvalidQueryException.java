package io.github.chirino.atlas.query;

/** Raised for malformed query input; mapped to HTTP 400. */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }
}
