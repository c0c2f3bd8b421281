package com.trellissystems.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of mail-driven executors.
 */
public class ExecutorConfig {
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CONDITION_TIMEOUT = Duration.ofSeconds(30);

    private Duration refreshInterval;
    private Duration conditionTimeout;
    private ThreadPoolFactory threadPoolFactory;

    /**
     * Creates a new ExecutorConfig with default values.
     */
    public ExecutorConfig() {
        this.refreshInterval = DEFAULT_REFRESH_INTERVAL;
        this.conditionTimeout = DEFAULT_CONDITION_TIMEOUT;
        this.threadPoolFactory = new ThreadPoolFactory();
    }

    /**
     * Sets the pause between two forward steps of the execution loop.
     *
     * @param refreshInterval a positive duration
     * @return This ExecutorConfig instance
     */
    public ExecutorConfig setRefreshInterval(Duration refreshInterval) {
        this.refreshInterval = requirePositive(refreshInterval, "refreshInterval");
        return this;
    }

    /**
     * Sets how long a traversal waits for the answer to an executable edge condition.
     *
     * @param conditionTimeout a positive duration
     * @return This ExecutorConfig instance
     */
    public ExecutorConfig setConditionTimeout(Duration conditionTimeout) {
        this.conditionTimeout = requirePositive(conditionTimeout, "conditionTimeout");
        return this;
    }

    public ExecutorConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
        return this;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public Duration getConditionTimeout() {
        return conditionTimeout;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }

    static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }
}
