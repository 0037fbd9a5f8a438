package eu.virtualparadox.laysum.rag.capability;

import eu.virtualparadox.laysum.application.config.ApplicationConfig;
import eu.virtualparadox.laysum.application.executor.CapabilityExecutor;
import eu.virtualparadox.laysum.error.GenerationException;
import eu.virtualparadox.laysum.error.LaySummaryException;
import eu.virtualparadox.laysum.error.PipelineCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking capability calls with the configured timeout.
 * <ul>
 *   <li>A failure or timeout of the call becomes a {@link GenerationException} naming the document.</li>
 *   <li>An interrupt of the waiting thread cancels the call and becomes a {@link PipelineCancelledException}.</li>
 * </ul>
 * No retries happen here; retry policy belongs to the capability implementation.
 */
@Component
@Slf4j
public class CapabilityInvoker {

    private final CapabilityExecutor capabilityExecutor;
    private final Duration timeout;

    @Autowired
    public CapabilityInvoker(final CapabilityExecutor capabilityExecutor, final ApplicationConfig config) {
        this(capabilityExecutor, config.getCapabilityTimeout());
    }

    public CapabilityInvoker(final CapabilityExecutor capabilityExecutor, final Duration timeout) {
        this.capabilityExecutor = Objects.requireNonNull(capabilityExecutor, "capabilityExecutor must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("capability timeout must be positive, got " + timeout);
        }
    }

    /**
     * Executes {@code call} and waits at most the configured timeout for its result.
     *
     * @param documentId document the call belongs to (for error context)
     * @param operation  short name of the call, used in messages
     * @param call       the capability call
     * @return the call result
     * @throws GenerationException         if the call fails, is rejected or times out
     * @throws PipelineCancelledException if the waiting thread is interrupted
     */
    public <T> T call(final String documentId, final String operation, final Callable<T> call) {
        final Future<T> future;
        try {
            future = capabilityExecutor.submit(call);
        } catch (TaskRejectedException e) {
            throw new GenerationException(documentId, operation + " could not be scheduled", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new GenerationException(documentId, operation + " timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(documentId, e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof LaySummaryException lse && lse.getDocumentId() != null) {
                throw lse;
            }
            throw new GenerationException(documentId, operation + " failed: " + cause.getMessage(), cause);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }
}
