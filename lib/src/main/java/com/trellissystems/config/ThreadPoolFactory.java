package com.trellissystems.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates the thread pools that run execution loops and work batches.
 */
public class ThreadPoolFactory {
    private static final int DEFAULT_FIXED_POOL_SIZE = Runtime.getRuntime().availableProcessors();

    private ThreadPoolType executorType = ThreadPoolType.CACHED;
    private int fixedPoolSize = DEFAULT_FIXED_POOL_SIZE;
    private int workStealingParallelism = Runtime.getRuntime().availableProcessors();
    private boolean useNamedThreads = true;
    private boolean daemonThreads = true;

    /**
     * Kinds of pool this factory can create.
     */
    public enum ThreadPoolType {
        /**
         * Fixed number of platform threads. Suited to CPU-bound work.
         */
        FIXED,

        /**
         * Threads created on demand and reused while idle. Suited to many blocking loops.
         */
        CACHED,

        /**
         * Work-stealing fork/join pool for mixed workloads.
         */
        WORK_STEALING
    }

    /**
     * Workload profiles used by {@link #optimizeFor(WorkloadType)}.
     */
    public enum WorkloadType {
        IO_BOUND,
        CPU_BOUND,
        MIXED
    }

    public ThreadPoolFactory() {
    }

    /**
     * Picks the pool type for a workload profile.
     *
     * @param workloadType the profile
     * @return This ThreadPoolFactory instance
     */
    public ThreadPoolFactory optimizeFor(WorkloadType workloadType) {
        switch (workloadType) {
            case IO_BOUND:
                return setExecutorType(ThreadPoolType.CACHED);
            case CPU_BOUND:
                return setExecutorType(ThreadPoolType.FIXED)
                        .setFixedPoolSize(Runtime.getRuntime().availableProcessors());
            case MIXED:
                return setExecutorType(ThreadPoolType.WORK_STEALING);
            default:
                throw new IllegalArgumentException("Unknown workload type: " + workloadType);
        }
    }

    /**
     * Creates an executor service of the configured type.
     *
     * @param poolName prefix of the thread names
     * @return a new executor service, owned by the caller
     */
    public ExecutorService createExecutorService(String poolName) {
        switch (executorType) {
            case FIXED:
                return useNamedThreads
                        ? Executors.newFixedThreadPool(fixedPoolSize, createNamedThreadFactory(poolName + "-worker"))
                        : Executors.newFixedThreadPool(fixedPoolSize);
            case CACHED:
                return useNamedThreads
                        ? Executors.newCachedThreadPool(createNamedThreadFactory(poolName + "-worker"))
                        : Executors.newCachedThreadPool();
            case WORK_STEALING:
                return Executors.newWorkStealingPool(workStealingParallelism);
            default:
                throw new IllegalStateException("Unknown executor type: " + executorType);
        }
    }

    private ThreadFactory createNamedThreadFactory(String prefix) {
        AtomicInteger threadNumber = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + threadNumber.getAndIncrement());
            thread.setDaemon(daemonThreads);
            return thread;
        };
    }

    public ThreadPoolType getExecutorType() {
        return executorType;
    }

    public ThreadPoolFactory setExecutorType(ThreadPoolType executorType) {
        this.executorType = executorType;
        return this;
    }

    public int getFixedPoolSize() {
        return fixedPoolSize;
    }

    public ThreadPoolFactory setFixedPoolSize(int fixedPoolSize) {
        if (fixedPoolSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + fixedPoolSize);
        }
        this.fixedPoolSize = fixedPoolSize;
        return this;
    }

    public int getWorkStealingParallelism() {
        return workStealingParallelism;
    }

    public ThreadPoolFactory setWorkStealingParallelism(int workStealingParallelism) {
        this.workStealingParallelism = workStealingParallelism;
        return this;
    }

    public boolean isUseNamedThreads() {
        return useNamedThreads;
    }

    public ThreadPoolFactory setUseNamedThreads(boolean useNamedThreads) {
        this.useNamedThreads = useNamedThreads;
        return this;
    }

    public boolean isDaemonThreads() {
        return daemonThreads;
    }

    public ThreadPoolFactory setDaemonThreads(boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }
}
