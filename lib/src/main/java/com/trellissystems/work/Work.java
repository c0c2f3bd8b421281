package com.trellissystems.work;

import com.trellissystems.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * One unit of scheduled asynchronous work.
 *
 * <p>A work item wraps a task that takes no arguments and returns a {@link CompletionStage}.
 * {@link #perform()} runs it once and records the outcome on the item: the result and duration
 * on success, the error on failure. The future returned by {@code perform} never completes
 * exceptionally; callers inspect {@link #getStatus()} and {@link #getError()} instead.
 */
public final class Work extends Element {

    private static final Logger logger = LoggerFactory.getLogger(Work.class);

    private final Supplier<CompletionStage<?>> task;
    private volatile WorkStatus status = WorkStatus.PENDING;
    private volatile Object result;
    private volatile Throwable error;
    private volatile Duration duration;
    private volatile Instant completedAt;
    private CompletableFuture<Work> completion;

    public Work(Supplier<? extends CompletionStage<?>> task) {
        Objects.requireNonNull(task, "task cannot be null");
        this.task = task::get;
    }

    public CompletableFuture<Work> perform() {
        return perform(Runnable::run);
    }

    /**
     * Starts the task on an executor. Calling this again returns the first call's future.
     * An executor that rejects the task fails the item with the rejection.
     *
     * @param executor where the task is launched
     * @return a future completing with this item once the task finished, successfully or not
     */
    public synchronized CompletableFuture<Work> perform(Executor executor) {
        if (completion != null) {
            return completion;
        }
        transition(WorkStatus.IN_PROGRESS);
        long startNanos = System.nanoTime();
        CompletableFuture<CompletionStage<?>> launched;
        try {
            launched = CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            launched = CompletableFuture.failedFuture(e);
        }
        completion = launched
                .thenCompose(stage -> stage.thenApply(value -> (Object) value))
                .handle((value, failure) -> {
                    finish(value, failure, startNanos);
                    return this;
                });
        return completion;
    }

    private void finish(Object value, Throwable failure, long startNanos) {
        duration = Duration.ofNanos(System.nanoTime() - startNanos);
        completedAt = Instant.now();
        if (failure == null) {
            result = value;
            transition(WorkStatus.COMPLETED);
            logger.debug("Work {} completed in {} ms", getId(), duration.toMillis());
        } else {
            error = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause()
                    : failure;
            transition(WorkStatus.FAILED);
            logger.warn("Work {} failed: {}", getId(), error.toString());
        }
    }

    private synchronized void transition(WorkStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Work " + getId() + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    public WorkStatus getStatus() {
        return status;
    }

    public boolean isDone() {
        return status.isTerminal();
    }

    /**
     * @return the task's value, or null until completed
     */
    public Object getResult() {
        return result;
    }

    /**
     * @return the task's failure, or null unless failed
     */
    public Throwable getError() {
        return error;
    }

    /**
     * @return time from launch to completion, or null while not done
     */
    public Duration getDuration() {
        return duration;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "Work{id=" + getId() + ", status=" + status + "}";
    }
}
