package com.trellissystems.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a {@link com.trellissystems.work.WorkQueue}.
 */
public class WorkQueueConfig {
    public static final int DEFAULT_CAPACITY = 5;
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(1);

    private int capacity;
    private Duration refreshInterval;
    private ThreadPoolFactory threadPoolFactory;

    public WorkQueueConfig() {
        this.capacity = DEFAULT_CAPACITY;
        this.refreshInterval = DEFAULT_REFRESH_INTERVAL;
        this.threadPoolFactory = new ThreadPoolFactory();
    }

    /**
     * Sets how many items one batch may run concurrently.
     *
     * @param capacity at least 1
     * @return This WorkQueueConfig instance
     */
    public WorkQueueConfig setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1: " + capacity);
        }
        this.capacity = capacity;
        return this;
    }

    public WorkQueueConfig setRefreshInterval(Duration refreshInterval) {
        this.refreshInterval = ExecutorConfig.requirePositive(refreshInterval, "refreshInterval");
        return this;
    }

    public WorkQueueConfig setThreadPoolFactory(ThreadPoolFactory threadPoolFactory) {
        this.threadPoolFactory = Objects.requireNonNull(threadPoolFactory, "threadPoolFactory cannot be null");
        return this;
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    public ThreadPoolFactory getThreadPoolFactory() {
        return threadPoolFactory;
    }
}
