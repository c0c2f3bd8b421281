package com.trellissystems.work;

import com.trellissystems.config.WorkQueueConfig;
import org.jctools.queues.MpscUnboundedArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Capacity-bounded batch executor for {@link Work} items.
 *
 * <p>Items are enqueued from any thread. Each {@link #process()} cycle takes up to the available
 * capacity from the head of the queue, launches them together and waits for the whole batch
 * before the capacity is restored. A slow item therefore holds back the items queued behind it
 * until its batch is done.
 *
 * <p>A failing item is recorded on the item and does not affect the rest of its batch.
 */
public class WorkQueue implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(WorkQueue.class);
    private static final int CHUNK_SIZE = 64;

    private final WorkQueueConfig config;
    private final MpscUnboundedArrayQueue<Work> queue = new MpscUnboundedArrayQueue<>(CHUNK_SIZE);
    private final AtomicInteger availableCapacity;
    private final ExecutorService pool;
    private volatile boolean stopped = false;
    private volatile boolean executing = false;
    private volatile boolean closed = false;

    public WorkQueue() {
        this(new WorkQueueConfig());
    }

    public WorkQueue(WorkQueueConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.availableCapacity = new AtomicInteger(config.getCapacity());
        this.pool = config.getThreadPoolFactory().createExecutorService("work-queue");
    }

    /**
     * Adds a pending item to the tail of the queue.
     *
     * @param work the item
     * @throws IllegalStateException if the item was already performed or the queue is closed
     */
    public void enqueue(Work work) {
        Objects.requireNonNull(work, "work cannot be null");
        if (closed) {
            throw new IllegalStateException("Work queue is closed: " + work);
        }
        if (work.getStatus() != WorkStatus.PENDING) {
            throw new IllegalStateException("Only pending work can be queued: " + work);
        }
        queue.offer(work);
    }

    /**
     * Runs one batch and waits for all of it.
     *
     * @return the items of the batch, in queue order; empty if nothing was queued
     */
    public synchronized List<Work> process() {
        List<Work> batch = new ArrayList<>();
        while (availableCapacity.get() > 0) {
            Work work = queue.poll();
            if (work == null) {
                break;
            }
            availableCapacity.decrementAndGet();
            batch.add(work);
        }
        if (batch.isEmpty()) {
            return batch;
        }
        logger.debug("Processing batch of {} work items, {} still queued", batch.size(), queue.size());
        try {
            CompletableFuture<?>[] launched = new CompletableFuture<?>[batch.size()];
            for (int i = 0; i < batch.size(); i++) {
                launched[i] = batch.get(i).perform(pool);
            }
            CompletableFuture.allOf(launched).join();
        } finally {
            availableCapacity.set(config.getCapacity());
        }
        return batch;
    }

    /**
     * Processes batches at the configured refresh interval until {@link #stop()} is called.
     */
    public void execute() {
        executing = true;
        logger.info("Work queue started with capacity {}", config.getCapacity());
        try {
            while (!stopped) {
                process();
                try {
                    Thread.sleep(config.getRefreshInterval().toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Work queue interrupted, leaving execution loop");
                    return;
                }
            }
            logger.info("Work queue stopped with {} items queued", queue.size());
        } finally {
            executing = false;
        }
    }

    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isExecuting() {
        return executing;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int getCapacity() {
        return config.getCapacity();
    }

    public int getAvailableCapacity() {
        return availableCapacity.get();
    }

    /**
     * Stops the loop, refuses further items and shuts the pool down. Items still queued fail
     * when a later {@link #process()} cannot launch them.
     */
    @Override
    public void close() {
        closed = true;
        stop();
        pool.shutdown();
    }
}
