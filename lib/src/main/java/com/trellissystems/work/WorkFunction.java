package com.trellissystems.work;

import com.trellissystems.config.WorkQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A named asynchronous function whose calls are scheduled through its own {@link WorkLog}.
 *
 * <p>Each {@link #submit(Map)} creates a {@link Work} item that calls the function with the given
 * arguments. A function may be retried: a failed call is attempted again, up to the configured
 * number of retries, before the item fails.
 */
public class WorkFunction {

    private static final Logger logger = LoggerFactory.getLogger(WorkFunction.class);

    private final String name;
    private final Function<Map<String, Object>, ? extends CompletionStage<?>> function;
    private final int maxRetries;
    private final WorkLog workLog;

    public WorkFunction(String name, Function<Map<String, Object>, ? extends CompletionStage<?>> function) {
        this(name, function, 0, new WorkQueueConfig());
    }

    public WorkFunction(String name,
                        Function<Map<String, Object>, ? extends CompletionStage<?>> function,
                        int maxRetries,
                        WorkQueueConfig config) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative: " + maxRetries);
        }
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.maxRetries = maxRetries;
        this.workLog = new WorkLog(config);
    }

    /**
     * Schedules one call of this function.
     *
     * @param arguments the call's arguments, copied
     * @return the pending work item
     */
    public Work submit(Map<String, Object> arguments) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        Work work = new Work(() -> attempt(copy, 0));
        workLog.append(work);
        logger.debug("Submitted {} to work function {}", work.getId(), name);
        return work;
    }

    private CompletableFuture<Object> attempt(Map<String, Object> arguments, int attempt) {
        CompletableFuture<Object> call;
        try {
            call = function.apply(arguments).toCompletableFuture().thenApply(value -> (Object) value);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (attempt >= maxRetries) {
            return call;
        }
        return call.handle((value, error) -> {
            if (error == null) {
                return CompletableFuture.completedFuture(value);
            }
            logger.warn("Work function {} failed on attempt {}, retrying: {}", name, attempt + 1, error.toString());
            return attempt(arguments, attempt + 1);
        }).thenCompose(Function.identity());
    }

    /**
     * Processes the next batch of calls.
     *
     * @return true if the function still has unfinished calls; false once stopped
     */
    public boolean forward() {
        if (workLog.isStopped()) {
            return false;
        }
        workLog.forward();
        return isProgressable();
    }

    public void stop() {
        workLog.stop();
    }

    /**
     * @return true if calls are unfinished and the log is not stopped
     */
    public boolean isProgressable() {
        return workLog.unfinishedCount() > 0 && !workLog.isStopped();
    }

    public String getName() {
        return name;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public WorkLog getWorkLog() {
        return workLog;
    }
}
