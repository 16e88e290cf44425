package io.github.chirino.atlas.query;

import java.time.Duration;

/**
 * Raised when a query exceeds its time budget. Queries are read-only, so nothing needs to be
 * rolled back; callers should narrow the request.
 */
public class QueryTimeoutException extends RuntimeException {

    private final Duration timeout;

    public QueryTimeoutException(Duration timeout, Throwable cause) {
        super("Query exceeded the " + timeout.toMillis() + "ms time limit", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
