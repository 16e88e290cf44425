package io.github.chirino.atlas.query;

/**
 * Raised when the query text could not be turned into a vector. Semantic requests fail instead
 * of degrading to unranked results.
 */
public class SemanticSearchUnavailableException extends RuntimeException {

    public SemanticSearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
