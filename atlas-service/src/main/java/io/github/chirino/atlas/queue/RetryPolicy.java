package io.github.chirino.atlas.queue;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/** Exponential backoff with a ceiling on automatic attempts. */
@ApplicationScoped
public class RetryPolicy {

    @ConfigProperty(name = "atlas.queue.retry.initial-delay", defaultValue = "PT30S")
    Duration initialDelay;

    @ConfigProperty(name = "atlas.queue.retry.max-delay", defaultValue = "PT30M")
    Duration maxDelay;

    @ConfigProperty(name = "atlas.queue.max-attempts", defaultValue = "5")
    int maxAttempts;

    public static RetryPolicy of(Duration initialDelay, Duration maxDelay, int maxAttempts) {
        RetryPolicy policy = new RetryPolicy();
        policy.initialDelay = initialDelay;
        policy.maxDelay = maxDelay;
        policy.maxAttempts = maxAttempts;
        return policy;
    }

    /** Whether an entry that has been attempted {@code attempts} times may be retried. */
    public boolean allowsRetry(int attempts) {
        return attempts < maxAttempts;
    }

    /** Delay before the next attempt: initial delay doubled per previous attempt, capped. */
    public Duration backoff(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        if (exponent >= 30) {
            return maxDelay;
        }
        Duration delay = initialDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration initialDelay() {
        return initialDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }
}
