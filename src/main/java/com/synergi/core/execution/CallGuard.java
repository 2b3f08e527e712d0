package com.synergi.core.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Runs a collaborator call on the collaborator executor and waits at most a fixed deadline.
 * <p>
 * Each call receives its own child {@link CancellationToken}; the child is cancelled when the
 * deadline passes or the task is cancelled, and the waiting caller is released immediately.
 */
@Component
public class CallGuard {

    private static final Logger log = LoggerFactory.getLogger(CallGuard.class);

    private final ExecutorService executor;

    public CallGuard(@Qualifier("collaboratorExecutor") ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * @param collaborator name used in logs and timeout messages
     * @param timeout      deadline for the call
     * @param token        the caller's token; cancelling it aborts the call
     * @param action       the call, given a token scoped to this call only
     * @throws CollaboratorTimeoutException if the deadline passes
     * @throws TaskCancelledException       if {@code token} is cancelled before the call finishes
     */
    public <T> T call(String collaborator, Duration timeout, CancellationToken token,
                      Function<CancellationToken, T> action) {
        token.throwIfCancelled();
        CancellationToken callToken = token.child();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return action.apply(callToken);
            } finally {
                MDC.clear();
            }
        }, executor);
        CancellationToken.Registration hook = callToken.onCancel(() -> future.cancel(true));

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("{} timed out after {}ms", collaborator, timeout.toMillis());
            callToken.cancel("timeout");
            throw new CollaboratorTimeoutException(collaborator, timeout);
        } catch (CancellationException e) {
            throw new TaskCancelledException(token.reason());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(collaborator + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callToken.cancel("interrupted");
            throw new TaskCancelledException("interrupted");
        } finally {
            hook.remove();
            callToken.detach();
        }
    }
}
