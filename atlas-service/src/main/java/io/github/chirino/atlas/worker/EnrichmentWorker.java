package io.github.chirino.atlas.worker;

import io.github.chirino.atlas.config.EnrichmentQueueSelector;
import io.github.chirino.atlas.config.RecordStoreSelector;
import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import io.github.chirino.atlas.model.EnrichmentKind;
import io.github.chirino.atlas.model.QueueEntry;
import io.github.chirino.atlas.model.QueueStatus;
import io.github.chirino.atlas.queue.EnrichmentQueue;
import io.github.chirino.atlas.store.RecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Pull loop shared by the enrichment workers: claim a batch, process each entry on a bounded
 * pool, then complete or fail it. No lock is held while an entry is processed; the claim is the
 * only coordination between workers, in this process or any other.
 */
public abstract class EnrichmentWorker {

    private static final Logger LOG = Logger.getLogger(EnrichmentWorker.class);

    /** Result of processing one entry. */
    protected enum Outcome {
        /** Enrichment written; the entry is done. */
        DONE,
        /** The record changed underneath; finish this entry and queue a fresh one. */
        RESUBMIT
    }

    @Inject EnrichmentQueueSelector queueSelector;

    @Inject RecordStoreSelector recordStoreSelector;

    @Inject MeterRegistry meterRegistry;

    @Inject ProviderCallExecutor providerCalls;

    private volatile ExecutorService pool;

    protected abstract EnrichmentKind kind();

    protected abstract int parallelism();

    protected abstract int batchSize();

    protected abstract int maxBatchesPerRun();

    /** Whether this worker may claim work right now. */
    protected abstract boolean isReady();

    protected abstract Outcome process(QueueEntry entry) throws EnrichmentFailure;

    protected EnrichmentQueue queue() {
        return queueSelector.getQueue();
    }

    protected RecordStore store() {
        return recordStoreSelector.getStore();
    }

    /**
     * Claims and processes batches until the queue has no available work for this kind or the
     * per-run batch limit is reached.
     *
     * @return the number of entries handled
     */
    public int drain() {
        if (!isReady()) {
            LOG.debugf("%s worker not ready, skipping claim", kind());
            return 0;
        }
        int handled = 0;
        for (int i = 0; i < maxBatchesPerRun(); i++) {
            List<QueueEntry> batch = queue().claim(kind(), batchSize());
            if (batch.isEmpty()) {
                break;
            }
            processBatch(batch);
            handled += batch.size();
            if (batch.size() < batchSize()) {
                break;
            }
        }
        if (handled > 0) {
            LOG.infof("Processed %d %s entries", handled, kind().toValue());
        }
        return handled;
    }

    private void processBatch(List<QueueEntry> batch) {
        if (parallelism() <= 1 || batch.size() == 1) {
            batch.forEach(this::handle);
            return;
        }
        List<Callable<Void>> tasks = new ArrayList<>(batch.size());
        for (QueueEntry entry : batch) {
            tasks.add(
                    () -> {
                        handle(entry);
                        return null;
                    });
        }
        try {
            pool().invokeAll(tasks);
        } catch (InterruptedException e) {
            // Unfinished entries stay PROCESSING until the reconciler releases them.
            Thread.currentThread().interrupt();
            LOG.warnf("%s worker interrupted while processing a batch", kind());
        }
    }

    void handle(QueueEntry entry) {
        try {
            Outcome outcome = process(entry);
            boolean completed = queue().complete(entry.id());
            if (!completed) {
                LOG.debugf("Entry %d was reclaimed before completion", entry.id());
            }
            if (outcome == Outcome.RESUBMIT) {
                queue().enqueue(entry.documentId(), kind(), entry.priority());
                count("resubmitted");
            } else {
                count("completed");
            }
        } catch (EnrichmentFailure failure) {
            fail(entry, failure.isRetryable(), failure.getMessage(), failure);
        } catch (RuntimeException e) {
            fail(entry, EmbeddingProviderException.isTransient(e), describe(e), e);
        }
    }

    private void fail(QueueEntry entry, boolean retryable, String message, Throwable cause) {
        QueueStatus status = queue().fail(entry.id(), retryable, message);
        if (status == QueueStatus.PENDING) {
            LOG.warnf(
                    "%s of document %s failed (attempt %d), will retry: %s",
                    kind().toValue(), entry.documentId(), entry.attempts(), message);
            count("retried");
        } else if (status == QueueStatus.FAILED) {
            LOG.warnf(
                    cause,
                    "%s of document %s failed permanently after %d attempt(s): %s",
                    kind().toValue(),
                    entry.documentId(),
                    entry.attempts(),
                    message);
            count("failed");
        } else {
            LOG.debugf("Entry %d was reclaimed before its failure was recorded", entry.id());
        }
    }

    private void count(String outcome) {
        meterRegistry
                .counter("atlas.enrichment.entries", "kind", kind().toValue(), "outcome", outcome)
                .increment();
    }

    private ExecutorService pool() {
        ExecutorService current = pool;
        if (current == null) {
            synchronized (this) {
                current = pool;
                if (current == null) {
                    AtomicInteger counter = new AtomicInteger();
                    String prefix = "atlas-" + kind().toValue() + "-";
                    current =
                            Executors.newFixedThreadPool(
                                    parallelism(),
                                    r -> {
                                        Thread t =
                                                new Thread(r, prefix + counter.incrementAndGet());
                                        t.setDaemon(true);
                                        return t;
                                    });
                    pool = current;
                }
            }
        }
        return current;
    }

    protected void shutdownPool() {
        ExecutorService current = pool;
        if (current != null) {
            current.shutdownNow();
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
