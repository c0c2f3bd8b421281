package com.trellissystems.work;

import com.trellissystems.collections.Pile;
import com.trellissystems.collections.Progression;
import com.trellissystems.config.WorkQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Ledger of the work submitted to one {@link WorkQueue}.
 *
 * <p>Every appended item is kept in a pile and recorded as pending. {@link #forward()} moves the
 * pending items into the queue and, unless the queue runs its own loop, processes one batch.
 */
public class WorkLog {

    private static final Logger logger = LoggerFactory.getLogger(WorkLog.class);

    private final Pile<Work> pile = new Pile<>(Set.of(Work.class));
    private final Progression pending = new Progression("pending");
    private final WorkQueue queue;

    public WorkLog() {
        this(new WorkQueueConfig());
    }

    public WorkLog(WorkQueueConfig config) {
        this(new WorkQueue(config));
    }

    public WorkLog(WorkQueue queue) {
        this.queue = queue;
    }

    /**
     * Records a work item as pending.
     *
     * @param work the item
     */
    public synchronized void append(Work work) {
        pile.include(work);
        pending.include(work);
    }

    /**
     * Queues the pending items and processes a batch if the queue is not looping on its own.
     *
     * @return the processed batch; empty when the queue runs its own loop
     * @throws IllegalStateException if the log was stopped
     */
    public List<Work> forward() {
        if (queue.isClosed()) {
            throw new IllegalStateException("Work log is stopped, " + pendingCount() + " items left pending");
        }
        synchronized (this) {
            while (!pending.isEmpty()) {
                queue.enqueue(pile.get(pending.popLeft()));
            }
        }
        if (queue.isExecuting()) {
            return List.of();
        }
        return queue.process();
    }

    /**
     * Stops the queue and shuts its pool down.
     */
    public void stop() {
        queue.close();
        logger.info("Work log stopped with {} items, {} pending", pile.size(), pendingCount());
    }

    public boolean isStopped() {
        return queue.isClosed();
    }

    public WorkQueue getQueue() {
        return queue;
    }

    public Work get(String workId) {
        return pile.get(workId);
    }

    public List<Work> getWorks() {
        return pile.values();
    }

    public int size() {
        return pile.size();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Counts the items that have not reached a terminal status.
     *
     * @return pending, queued and running items
     */
    public int unfinishedCount() {
        int count = 0;
        for (Work work : pile) {
            if (!work.isDone()) {
                count++;
            }
        }
        return count;
    }
}
