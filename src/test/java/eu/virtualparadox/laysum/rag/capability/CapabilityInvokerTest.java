package eu.virtualparadox.laysum.rag.capability;

import eu.virtualparadox.laysum.application.executor.CapabilityExecutor;
import eu.virtualparadox.laysum.error.GenerationException;
import eu.virtualparadox.laysum.error.PipelineCancelledException;
import eu.virtualparadox.laysum.support.TestExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CapabilityInvokerTest {

    private CapabilityExecutor executor;
    private CapabilityInvoker invoker;

    @BeforeEach
    void setUp() {
        executor = TestExecutors.capability(2);
        invoker = new CapabilityInvoker(executor, Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Returns the result of a call that finishes in time")
    void success() {
        assertEquals("done", invoker.call("doc-1", "test", () -> "done"));
    }

    @Test
    @DisplayName("A call exceeding the timeout is cancelled and fails with GenerationException")
    void timeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        GenerationException ex = assertThrows(GenerationException.class, () -> invoker.call("doc-1", "slow call", () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }));

        assertEquals("doc-1", ex.getDocumentId());
        assertThat(ex.getMessage()).contains("slow call").contains("timed out");
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "the running call should be interrupted");
    }

    @Test
    @DisplayName("A failing call is wrapped with the document id and the original cause")
    void failure() {
        IllegalStateException boom = new IllegalStateException("quota exceeded");

        GenerationException ex = assertThrows(GenerationException.class,
                () -> invoker.call("doc-2", "entailment", () -> {
                    throw boom;
                }));

        assertEquals("doc-2", ex.getDocumentId());
        assertSame(boom, ex.getCause());
        assertThat(ex.getMessage()).contains("entailment").contains("quota exceeded");
    }

    @Test
    @DisplayName("An interrupted caller gets PipelineCancelledException and keeps its interrupt flag")
    void interrupted() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(PipelineCancelledException.class, () -> invoker.call("doc-3", "test", () -> {
                Thread.sleep(5_000);
                return "never";
            }));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Timeout must be positive")
    void invalidTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new CapabilityInvoker(executor, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new CapabilityInvoker(executor, Duration.ofSeconds(-1)));
    }
}
