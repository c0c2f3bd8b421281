package com.trellissystems.work;

import com.trellissystems.config.WorkQueueConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class WorkLogTest {

    private WorkLog log;

    @AfterEach
    void tearDown() {
        if (log != null) {
            log.stop();
        }
    }

    @Test
    void testAppendKeepsWorkPending() {
        log = new WorkLog();
        Work work = new Work(() -> CompletableFuture.completedFuture("a"));

        log.append(work);

        assertEquals(1, log.size());
        assertEquals(1, log.pendingCount());
        assertSame(work, log.get(work.getId()));
        assertEquals(WorkStatus.PENDING, work.getStatus());
    }

    @Test
    void testForwardProcessesOneBatch() {
        log = new WorkLog(new WorkQueueConfig().setCapacity(2));
        for (int i = 0; i < 3; i++) {
            int value = i;
            log.append(new Work(() -> CompletableFuture.completedFuture(value)));
        }

        List<Work> first = log.forward();

        assertEquals(2, first.size());
        assertEquals(0, log.pendingCount());
        assertEquals(1, log.unfinishedCount());
        assertEquals(1, log.getQueue().size());

        List<Work> second = log.forward();
        assertEquals(1, second.size());
        assertEquals(0, log.unfinishedCount());
        assertEquals(3, log.getWorks().size());
    }

    @Test
    void testAppendingTheSameWorkTwiceIsIgnored() {
        log = new WorkLog();
        Work work = new Work(() -> CompletableFuture.completedFuture("once"));

        log.append(work);
        log.append(work);

        assertEquals(1, log.size());
        assertEquals(1, log.pendingCount());
    }

    @Test
    void testStopStopsTheQueue() {
        log = new WorkLog();

        log.stop();

        assertTrue(log.isStopped());
    }

    @Test
    void testForwardAfterStopKeepsWorkPending() {
        log = new WorkLog();
        Work first = new Work(() -> CompletableFuture.completedFuture("a"));
        Work second = new Work(() -> CompletableFuture.completedFuture("b"));
        log.stop();
        log.append(first);
        log.append(second);

        assertThrows(IllegalStateException.class, () -> log.forward());

        assertEquals(WorkStatus.PENDING, first.getStatus());
        assertEquals(WorkStatus.PENDING, second.getStatus());
        assertEquals(2, log.pendingCount());
        assertEquals(WorkQueueConfig.DEFAULT_CAPACITY, log.getQueue().getAvailableCapacity());
    }
}
