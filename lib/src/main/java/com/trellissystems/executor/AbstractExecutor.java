package com.trellissystems.executor;

import com.trellissystems.config.ExecutorConfig;
import com.trellissystems.mailbox.Actor;
import com.trellissystems.mailbox.Mail;
import com.trellissystems.mailbox.MailPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Actor driven by its inbox, one {@link #forward()} step at a time.
 *
 * <p>A step handles the mail delivered since the previous one. Work that completes after the step
 * returned (an asynchronous node result, an awaited condition answer) continues on the completing
 * thread; if that continuation fails, the failure is kept and thrown by the next {@code forward()}.
 *
 * <p>The loop in {@link #execute(Duration)} checks the stop flag once per iteration. Nothing is
 * cancelled: a step in progress runs to its end.
 */
public abstract class AbstractExecutor extends Actor {

    private static final Logger logger = LoggerFactory.getLogger(AbstractExecutor.class);

    private final ExecutorConfig config;
    private final Queue<TraversalException> failures = new ConcurrentLinkedQueue<>();
    private volatile boolean stopped = false;

    protected AbstractExecutor(ExecutorConfig config) {
        this.config = config;
    }

    /**
     * Handles the mail delivered since the previous step.
     *
     * @throws TraversalException if a mail could not be handled, or a continuation of an earlier
     *                            step failed
     */
    public final void forward() {
        TraversalException failure = failures.poll();
        if (failure != null) {
            throw failure;
        }
        step();
    }

    /**
     * One step of this executor's protocol.
     */
    protected abstract void step();

    /**
     * Called once before the execution loop starts.
     */
    protected void beforeExecute() {
    }

    public void execute() {
        execute(config.getRefreshInterval());
    }

    /**
     * Runs {@link #forward()} at a fixed interval until stopped. A traversal error ends the loop
     * and propagates to the caller.
     *
     * @param refreshInterval pause between steps
     */
    public void execute(Duration refreshInterval) {
        beforeExecute();
        logger.info("{} {} started", getClass().getSimpleName(), getId());
        try {
            while (!stopped) {
                forward();
                try {
                    Thread.sleep(refreshInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("{} {} interrupted, leaving execution loop", getClass().getSimpleName(), getId());
                    return;
                }
            }
            logger.info("{} {} stopped", getClass().getSimpleName(), getId());
        } catch (TraversalException e) {
            logger.error("{} {} failed", getClass().getSimpleName(), getId(), e);
            throw e;
        }
    }

    /**
     * Runs the execution loop on a dedicated pool from the configured {@link com.trellissystems.config.ThreadPoolFactory}.
     * The pool is shut down when the loop ends.
     *
     * @return a future completing when the loop ends, exceptionally on a traversal error
     */
    public CompletableFuture<Void> executeAsync() {
        ExecutorService pool = config.getThreadPoolFactory()
                .createExecutorService(getClass().getSimpleName() + "-" + getId().substring(0, 8));
        return CompletableFuture.runAsync(this::execute, pool)
                .whenComplete((ignored, error) -> pool.shutdown());
    }

    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    public ExecutorConfig getConfig() {
        return config;
    }

    /**
     * Runs an action once a future completes. A future that is already complete is handled
     * right away and its failure thrown; otherwise the action runs on the completing thread
     * and a failure is kept for the next {@link #forward()}.
     *
     * @param future the awaited value
     * @param mail   the mail being handled, for error context
     * @param action what to do with the value
     * @param <T>    the value type
     */
    protected <T> void whenReady(CompletableFuture<T> future, Mail mail, Consumer<T> action) {
        if (future.isDone()) {
            T value;
            try {
                value = future.join();
            } catch (CompletionException | CancellationException e) {
                throw traversalError(mail, unwrap(e));
            }
            try {
                action.accept(value);
            } catch (RuntimeException e) {
                throw traversalError(mail, e);
            }
            return;
        }
        future.whenComplete((value, error) -> {
            if (error != null) {
                recordFailure(traversalError(mail, unwrap(error)));
                return;
            }
            try {
                action.accept(value);
            } catch (RuntimeException e) {
                recordFailure(traversalError(mail, e));
            }
        });
    }

    /**
     * Keeps a failure to be thrown by the next {@link #forward()}.
     *
     * @param failure the failure
     */
    protected void recordFailure(TraversalException failure) {
        logger.error("{} {} failed handling mail {}", getClass().getSimpleName(), getId(), failure.getMailId(), failure);
        failures.add(failure);
    }

    public boolean hasPendingFailure() {
        return !failures.isEmpty();
    }

    /**
     * Wraps an error with the context of the mail being handled.
     *
     * @param mail  the mail
     * @param cause the error
     * @return the wrapped error, or the cause itself if it already carries context
     */
    protected TraversalException traversalError(Mail mail, Throwable cause) {
        if (cause instanceof TraversalException) {
            return (TraversalException) cause;
        }
        String nodeId = nodeIdOf(mail.getPackage());
        String message = "Error handling " + mail.getCategory() + " mail " + mail.getId()
                + (nodeId == null ? "" : " for node " + nodeId) + ": " + cause.getMessage();
        return new TraversalException(message, cause, getId(), mail.getId(), nodeId);
    }

    protected static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String nodeIdOf(MailPackage content) {
        if (content instanceof MailPackage.NodeDelivery) {
            return ((MailPackage.NodeDelivery) content).node().getId();
        }
        if (content instanceof MailPackage.NodeIdDelivery) {
            return ((MailPackage.NodeIdDelivery) content).nodeId();
        }
        return null;
    }
}
