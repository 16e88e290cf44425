package io.github.chirino.atlas.embedding;

import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

/**
 * Failure of an embedding or summarization provider call. Transient failures (timeouts, rate
 * limits, connection problems) are worth retrying; permanent ones (rejected input, bad
 * credentials, wrong dimensionality) are not.
 */
public class EmbeddingProviderException extends RuntimeException {

    private final boolean transientFailure;

    public EmbeddingProviderException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public EmbeddingProviderException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static EmbeddingProviderException permanent(String message) {
        return new EmbeddingProviderException(message, false);
    }

    /** Wraps a provider failure, classifying it by type. */
    public static EmbeddingProviderException wrap(String modelId, Throwable cause) {
        if (cause instanceof EmbeddingProviderException epe) {
            return epe;
        }
        return new EmbeddingProviderException(
                modelId + " call failed: " + cause.getMessage(), isTransient(cause), cause);
    }

    public static boolean isTransient(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof EmbeddingProviderException epe) {
                return epe.isTransient();
            }
            if (t instanceof NonRetriableException || t instanceof IllegalArgumentException) {
                return false;
            }
            if (t instanceof RetriableException
                    || t instanceof IOException
                    || t instanceof UncheckedIOException
                    || t instanceof TimeoutException) {
                return true;
            }
        }
        // Unclassified failures are retried until the attempt ceiling parks them.
        return true;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
