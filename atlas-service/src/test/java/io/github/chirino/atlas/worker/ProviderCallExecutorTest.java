package io.github.chirino.atlas.worker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.atlas.embedding.EmbeddingProviderException;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProviderCallExecutorTest {

    private final ProviderCallExecutor calls =
            ProviderCallExecutor.withTimeout(Duration.ofMillis(200));

    @AfterEach
    void tearDown() {
        calls.shutdown();
    }

    @Test
    void returns_the_call_result() {
        assertEquals("ok", calls.call("test", () -> "ok"));
    }

    @Test
    void overrun_is_a_transient_failure() {
        EmbeddingProviderException e =
                assertThrows(
                        EmbeddingProviderException.class,
                        () ->
                                calls.call(
                                        "slow provider",
                                        () -> {
                                            Thread.sleep(5_000);
                                            return "late";
                                        }));
        assertTrue(e.isTransient());
        assertTrue(e.getMessage().startsWith("slow provider timed out"));
    }

    @Test
    void runtime_failures_propagate_unchanged() {
        IllegalStateException failure = new IllegalStateException("boom");
        IllegalStateException thrown =
                assertThrows(
                        IllegalStateException.class,
                        () ->
                                calls.call(
                                        "test",
                                        () -> {
                                            throw failure;
                                        }));
        assertSame(failure, thrown);
    }

    @Test
    void checked_failures_are_classified() {
        EmbeddingProviderException io =
                assertThrows(
                        EmbeddingProviderException.class,
                        () ->
                                calls.call(
                                        "test",
                                        () -> {
                                            throw new IOException("connection reset");
                                        }));
        assertTrue(io.isTransient());

        EmbeddingProviderException permanent =
                assertThrows(
                        EmbeddingProviderException.class,
                        () ->
                                calls.call(
                                        "test",
                                        () -> {
                                            throw EmbeddingProviderException.permanent("bad key");
                                        }));
        assertFalse(permanent.isTransient());
    }
}
