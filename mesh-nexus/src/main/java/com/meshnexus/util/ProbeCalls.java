package com.meshnexus.util;

import com.meshnexus.exception.ProbeFailureException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

@Slf4j
public final class ProbeCalls {

    private ProbeCalls() {
    }

    /**
     * Runs a collaborator call on {@code executor} and waits at most {@code timeout}.
     *
     * @throws ProbeFailureException if the call throws, times out or the caller is interrupted
     */
    public static <T> T withTimeout(Executor executor, Duration timeout, String description, Supplier<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProbeFailureException(description + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProbeFailureException) {
                throw (ProbeFailureException) cause;
            }
            throw new ProbeFailureException(description + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeFailureException(description + " interrupted", e);
        }
    }

    /**
     * Same as {@link #withTimeout} but logs the failure and returns {@code fallback}.
     */
    public static <T> T orDefault(Executor executor, Duration timeout, String description, Supplier<T> call, T fallback) {
        try {
            T result = withTimeout(executor, timeout, description, call);
            return result != null ? result : fallback;
        } catch (ProbeFailureException e) {
            log.warn("{}: {}", description, e.getMessage());
            return fallback;
        }
    }
}
