package com.trellissystems.test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Polling assertions for mail-driven and asynchronous code.
 *
 * <p>Usage:
 * <pre>{@code
 * AsyncAssertion.eventually(() -> branch.isStopped(), Duration.ofSeconds(2));
 * int done = AsyncAssertion.awaitValue(() -> log.completedCount(), 5, Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 20;

    private AsyncAssertion() {
    }

    public static void eventually(BooleanSupplier condition, Duration timeout) {
        eventually(condition, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the condition holds.
     *
     * @param condition      the condition to check; exceptions count as "not yet"
     * @param timeout        the maximum time to wait
     * @param pollIntervalMs pause between checks
     * @throws AssertionError if the condition does not hold in time
     */
    public static void eventually(BooleanSupplier condition, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(condition, "condition cannot be null");
        long deadline = deadline(timeout);
        Throwable lastError = null;
        while (System.nanoTime() < deadline) {
            try {
                if (condition.getAsBoolean()) {
                    return;
                }
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
            pause(pollIntervalMs, "condition");
        }
        String message = "Condition did not become true within " + timeout;
        throw lastError == null
                ? new AssertionError(message)
                : new AssertionError(message + ". Last error: " + lastError.getMessage(), lastError);
    }

    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout) {
        return awaitValue(supplier, expected, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Waits until the supplier yields the expected value.
     *
     * @param supplier       the value source
     * @param expected       the awaited value
     * @param timeout        the maximum time to wait
     * @param pollIntervalMs pause between checks
     * @param <T>            the value type
     * @return the value, equal to {@code expected}
     * @throws AssertionError listing the distinct values seen if the value never matches
     */
    public static <T> T awaitValue(Supplier<T> supplier, T expected, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        long deadline = deadline(timeout);
        List<T> seen = new ArrayList<>();
        while (System.nanoTime() < deadline) {
            T value = supplier.get();
            if (seen.isEmpty() || !Objects.equals(value, seen.get(seen.size() - 1))) {
                seen.add(value);
            }
            if (Objects.equals(expected, value)) {
                return value;
            }
            pause(pollIntervalMs, "value");
        }
        throw new AssertionError("Value did not become " + expected + " within " + timeout
                + ". Values seen: " + seen);
    }

    public static void eventuallyAssert(Runnable assertion, Duration timeout) {
        eventuallyAssert(assertion, timeout, DEFAULT_POLL_INTERVAL_MS);
    }

    /**
     * Re-runs an assertion block until it passes.
     *
     * @param assertion      the block, failing by throwing
     * @param timeout        the maximum time to wait
     * @param pollIntervalMs pause between attempts
     * @throws AssertionError wrapping the last failure if the block never passes
     */
    public static void eventuallyAssert(Runnable assertion, Duration timeout, long pollIntervalMs) {
        Objects.requireNonNull(assertion, "assertion cannot be null");
        long deadline = deadline(timeout);
        Throwable lastError = null;
        while (System.nanoTime() < deadline) {
            try {
                assertion.run();
                return;
            } catch (RuntimeException | AssertionError e) {
                lastError = e;
            }
            pause(pollIntervalMs, "assertion");
        }
        throw new AssertionError("Assertion did not succeed within " + timeout
                + (lastError == null ? "" : ". Last error: " + lastError.getMessage()), lastError);
    }

    /**
     * Waits for a future and returns its value.
     *
     * @param future  the future
     * @param timeout the maximum time to wait
     * @param <T>     the value type
     * @return the completed value
     * @throws AssertionError if the future fails or does not complete in time
     */
    public static <T> T awaitCompletion(CompletableFuture<T> future, Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AssertionError("Future did not complete within " + timeout, e);
        } catch (ExecutionException e) {
            throw new AssertionError("Future completed exceptionally: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for future", e);
        }
    }

    private static long deadline(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return System.nanoTime() + timeout.toNanos();
    }

    private static void pause(long millis, String awaited) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for " + awaited, e);
        }
    }
}
