package io.github.chirino.atlas.worker;

/** A classified failure of one queue entry. */
public class EnrichmentFailure extends Exception {

    private final boolean retryable;

    private EnrichmentFailure(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static EnrichmentFailure retryable(String message) {
        return new EnrichmentFailure(message, true, null);
    }

    public static EnrichmentFailure retryable(String message, Throwable cause) {
        return new EnrichmentFailure(message, true, cause);
    }

    public static EnrichmentFailure permanent(String message) {
        return new EnrichmentFailure(message, false, null);
    }

    public static EnrichmentFailure permanent(String message, Throwable cause) {
        return new EnrichmentFailure(message, false, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
