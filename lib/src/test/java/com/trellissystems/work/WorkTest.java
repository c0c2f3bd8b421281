package com.trellissystems.work;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkTest {

    @Test
    void testSuccessfulWorkRecordsResult() {
        Work work = new Work(() -> CompletableFuture.completedFuture(42));
        assertEquals(WorkStatus.PENDING, work.getStatus());

        Work done = work.perform().join();

        assertSame(work, done);
        assertEquals(WorkStatus.COMPLETED, work.getStatus());
        assertEquals(42, work.getResult());
        assertNull(work.getError());
        assertNotNull(work.getDuration());
        assertNotNull(work.getCompletedAt());
    }

    @Test
    void testFailureIsCapturedOnTheItem() {
        Work work = new Work(() -> CompletableFuture.failedFuture(new IllegalStateException("quota exceeded")));

        CompletableFuture<Work> future = work.perform();

        assertFalse(future.isCompletedExceptionally());
        future.join();
        assertEquals(WorkStatus.FAILED, work.getStatus());
        assertInstanceOf(IllegalStateException.class, work.getError());
        assertEquals("quota exceeded", work.getError().getMessage());
        assertNull(work.getResult());
    }

    @Test
    void testTaskThrowingBeforeReturningIsCaptured() {
        Work work = new Work(() -> {
            throw new IllegalArgumentException("bad input");
        });

        work.perform().join();

        assertEquals(WorkStatus.FAILED, work.getStatus());
        assertInstanceOf(IllegalArgumentException.class, work.getError());
    }

    @Test
    void testPerformRunsTheTaskOnce() {
        AtomicInteger calls = new AtomicInteger();
        Work work = new Work(() -> CompletableFuture.completedFuture(calls.incrementAndGet()));

        CompletableFuture<Work> first = work.perform();
        CompletableFuture<Work> second = work.perform();

        assertSame(first, second);
        assertEquals(1, calls.get());
    }

    @Test
    void testInProgressUntilTheTaskCompletes() {
        CompletableFuture<String> pending = new CompletableFuture<>();
        Work work = new Work(() -> pending);

        CompletableFuture<Work> future = work.perform();
        assertEquals(WorkStatus.IN_PROGRESS, work.getStatus());
        assertFalse(work.isDone());

        pending.complete("late");
        future.join();
        assertEquals(WorkStatus.COMPLETED, work.getStatus());
        assertEquals("late", work.getResult());
    }

    @Test
    void testRejectedLaunchFailsTheItem() {
        Work work = new Work(() -> CompletableFuture.completedFuture("never"));

        CompletableFuture<Work> future = work.perform(task -> {
            throw new RejectedExecutionException("pool shut down");
        });

        assertTrue(future.isDone());
        assertFalse(future.isCompletedExceptionally());
        assertEquals(WorkStatus.FAILED, work.getStatus());
        assertInstanceOf(RejectedExecutionException.class, work.getError());
    }
}
