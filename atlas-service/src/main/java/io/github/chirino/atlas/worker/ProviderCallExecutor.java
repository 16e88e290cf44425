package io.github.chirino.atlas.worker;

import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Runs external provider calls with a deadline. A call that overruns is cancelled and reported
 * as a transient {@link EmbeddingProviderException}.
 */
@ApplicationScoped
public class ProviderCallExecutor {

    @ConfigProperty(name = "atlas.enrichment.provider-timeout", defaultValue = "PT30S")
    Duration timeout;

    private final ExecutorService executor = Executors.newCachedThreadPool(daemonThreads());

    public static ProviderCallExecutor withTimeout(Duration timeout) {
        ProviderCallExecutor calls = new ProviderCallExecutor();
        calls.timeout = timeout;
        return calls;
    }

    public <T> T call(String description, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EmbeddingProviderException(
                    description + " timed out after " + timeout.toMillis() + "ms", true, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EmbeddingProviderException(description + " was interrupted", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new EmbeddingProviderException(
                    description + " failed: " + cause.getMessage(),
                    EmbeddingProviderException.isTransient(cause),
                    cause);
        }
    }

    public Duration timeout() {
        return timeout;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "atlas-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
