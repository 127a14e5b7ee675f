package io.github.budgetcore.background_tasks;

import io.github.budgetcore.CancellationToken;
import io.github.budgetcore.base_exceptions.OperationTimedOutException;
import io.github.budgetcore.base_exceptions.TaskFailedException;
import io.github.budgetcore.base_exceptions.TaskNotFoundException;
import io.github.budgetcore.base_exceptions.TaskNotReadyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BackgroundTaskTrackerTest {

    BackgroundTaskTracker tracker;
    ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (tracker != null) tracker.close();
        if (executor != null) executor.shutdownNow();
    }

    @Test
    void submitAsync_returnsImmediately_andStatusMovesToCompleted() throws Exception {
        tracker = new BackgroundTaskTracker();
        CountDownLatch started = new CountDownLatch(1);

        long t0 = System.nanoTime();
        String id = tracker.submitAsync("report", "2024-03", ctx -> {
            started.countDown();
            Thread.sleep(2_000);
            return "ready";
        });
        long submitMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        assertTrue(submitMillis < 100, "submitAsync blocked for " + submitMillis + "ms");
        assertTrue(id.startsWith("task_"));

        assertTrue(started.await(1, TimeUnit.SECONDS));
        BackgroundTask running = tracker.getStatus(id);
        assertEquals(TaskStatus.PROCESSING, running.status);
        assertNotNull(running.startedAt);
        assertThrows(TaskNotReadyException.class, () -> tracker.getResult(id));

        BackgroundTask done = tracker.awaitCompletion(id, CancellationToken.withTimeout(Duration.ofSeconds(5)));
        assertEquals(TaskStatus.COMPLETED, done.status);
        assertEquals(100, done.progress);
        assertNotNull(done.completedAt);
        assertEquals("ready", tracker.getResult(id));
    }

    @Test
    void taskWaitingForAThread_isPending_untilPickedUp() throws Exception {
        executor = Executors.newSingleThreadExecutor();
        tracker = new BackgroundTaskTracker.Builder().executor(executor).build();
        CountDownLatch release = new CountDownLatch(1);

        String blocker = tracker.submitAsync("blocker", null, ctx -> release.await(5, TimeUnit.SECONDS));
        String waiting = tracker.submitAsync("waiting", null, ctx -> "second");

        assertEquals(TaskStatus.PENDING, tracker.getStatus(waiting).status);
        assertNull(tracker.getStatus(waiting).startedAt);
        TaskNotReadyException notReady = assertThrows(TaskNotReadyException.class, () -> tracker.getResult(waiting));
        assertEquals("pending", notReady.getStatus());

        release.countDown();
        tracker.awaitCompletion(blocker, CancellationToken.withTimeout(Duration.ofSeconds(5)));
        assertEquals(TaskStatus.COMPLETED,
                tracker.awaitCompletion(waiting, CancellationToken.withTimeout(Duration.ofSeconds(5))).status);
    }

    @Test
    void throwingTask_endsFailed_withErrorText() throws Exception {
        AtomicReference<Throwable> reported = new AtomicReference<>();
        tracker = new BackgroundTaskTracker.Builder()
                .addListener(new TaskEventListener() {
                    @Override public void onError(String taskId, Throwable error) { reported.set(error); }
                })
                .build();

        String id = tracker.submitAsync("broken", null, ctx -> {
            throw new IllegalStateException("disk on fire");
        });
        BackgroundTask t = tracker.awaitCompletion(id, CancellationToken.withTimeout(Duration.ofSeconds(5)));

        assertEquals(TaskStatus.FAILED, t.status);
        assertEquals("disk on fire", t.error);
        TaskFailedException e = assertThrows(TaskFailedException.class, () -> tracker.getResult(id));
        assertEquals("failed", e.getStatus());
        assertTrue(e.getMessage().contains("disk on fire"));
        assertInstanceOf(IllegalStateException.class, reported.get());
    }

    @Test
    void cancel_marksCancelled_stopsToken_andDiscardsLateResult() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch cancelledEvent = new CountDownLatch(1);
        CountDownLatch unitReturned = new CountDownLatch(1);
        tracker = new BackgroundTaskTracker.Builder()
                .addListener(new TaskEventListener() {
                    @Override public void onCancelled(String taskId) { cancelledEvent.countDown(); }
                })
                .build();

        String id = tracker.submitAsync("long", null, ctx -> {
            started.countDown();
            try {
                while (!ctx.token().isStopRequested()) Thread.sleep(5);
                return "too late";
            } finally {
                unitReturned.countDown();
            }
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));

        assertTrue(tracker.cancel(id));
        assertTrue(cancelledEvent.await(1, TimeUnit.SECONDS));
        assertTrue(unitReturned.await(1, TimeUnit.SECONDS));

        BackgroundTask t = tracker.getStatus(id);
        assertEquals(TaskStatus.CANCELLED, t.status);
        assertEquals("task cancelled by user", t.error);
        assertNull(t.result);
        assertFalse(tracker.cancel(id), "second cancel of a terminal task");
        assertThrows(TaskFailedException.class, () -> tracker.getResult(id));
    }

    @Test
    void cancelWhilePending_neverRunsTheUnit() throws Exception {
        executor = Executors.newSingleThreadExecutor();
        tracker = new BackgroundTaskTracker.Builder().executor(executor).build();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch ranSecond = new CountDownLatch(1);

        String blocker = tracker.submitAsync("blocker", null, ctx -> release.await(5, TimeUnit.SECONDS));
        String pending = tracker.submitAsync("pending", null, ctx -> {
            ranSecond.countDown();
            return null;
        });
        assertTrue(tracker.cancel(pending));
        release.countDown();
        tracker.awaitCompletion(blocker, CancellationToken.withTimeout(Duration.ofSeconds(5)));

        assertFalse(ranSecond.await(200, TimeUnit.MILLISECONDS));
        BackgroundTask t = tracker.getStatus(pending);
        assertEquals(TaskStatus.CANCELLED, t.status);
        assertNull(t.startedAt);
    }

    @Test
    void progress_isClamped_andFrozenOnceTerminal() throws Exception {
        tracker = new BackgroundTaskTracker();
        AtomicReference<TaskContext> leaked = new AtomicReference<>();
        CountDownLatch reported = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);

        String id = tracker.submitAsync("progress", null, ctx -> {
            leaked.set(ctx);
            ctx.reportProgress(250);
            reported.countDown();
            finish.await(5, TimeUnit.SECONDS);
            return null;
        });
        assertTrue(reported.await(1, TimeUnit.SECONDS));
        assertEquals(100, tracker.getStatus(id).progress);

        leaked.get().reportProgress(-20);
        assertEquals(0, tracker.getStatus(id).progress);

        finish.countDown();
        tracker.awaitCompletion(id, CancellationToken.withTimeout(Duration.ofSeconds(5)));
        leaked.get().reportProgress(10);
        assertEquals(100, tracker.getStatus(id).progress);
    }

    @Test
    void unknownIds_raiseNotFound() {
        tracker = new BackgroundTaskTracker();
        assertThrows(TaskNotFoundException.class, () -> tracker.getStatus("task_missing"));
        assertThrows(TaskNotFoundException.class, () -> tracker.getResult("task_missing"));
        assertThrows(TaskNotFoundException.class, () -> tracker.cancel("task_missing"));
        assertThrows(TaskNotFoundException.class,
                () -> tracker.awaitCompletion("task_missing", CancellationToken.none()));
    }

    @Test
    void awaitCompletion_timesOut_withoutTouchingTheTask() throws Exception {
        tracker = new BackgroundTaskTracker();
        CountDownLatch release = new CountDownLatch(1);
        String id = tracker.submitAsync("slow", null, ctx -> release.await(5, TimeUnit.SECONDS));

        assertThrows(OperationTimedOutException.class,
                () -> tracker.awaitCompletion(id, CancellationToken.withTimeout(Duration.ofMillis(80))));
        assertFalse(tracker.getStatus(id).status.isTerminal());
        release.countDown();
    }

    @Test
    void listTasks_filtersByStatus_inCreationOrder() throws Exception {
        tracker = new BackgroundTaskTracker();
        String a = tracker.submitAsync("a", null, ctx -> "a");
        Thread.sleep(5);
        String b = tracker.submitAsync("b", null, ctx -> {
            throw new IllegalArgumentException("nope");
        });
        tracker.awaitCompletion(a, CancellationToken.withTimeout(Duration.ofSeconds(5)));
        tracker.awaitCompletion(b, CancellationToken.withTimeout(Duration.ofSeconds(5)));

        List<BackgroundTask> all = tracker.listTasks(null);
        assertEquals(2, all.size());
        assertEquals(a, all.get(0).id);
        assertEquals(b, all.get(1).id);

        List<BackgroundTask> failed = tracker.listTasks(TaskStatus.FAILED);
        assertEquals(1, failed.size());
        assertEquals(b, failed.get(0).id);
        assertTrue(tracker.listTasks(TaskStatus.PENDING).isEmpty());
    }

    @Test
    void cleanup_removesOnlyOldTerminalTasks() throws Exception {
        tracker = new BackgroundTaskTracker();
        CountDownLatch release = new CountDownLatch(1);
        String done = tracker.submitAsync("done", null, ctx -> "ok");
        String running = tracker.submitAsync("running", null, ctx -> release.await(5, TimeUnit.SECONDS));
        tracker.awaitCompletion(done, CancellationToken.withTimeout(Duration.ofSeconds(5)));

        assertEquals(0, tracker.cleanup(Duration.ofHours(1)));
        Thread.sleep(30);
        assertEquals(1, tracker.cleanup(Duration.ofMillis(10)));

        assertThrows(TaskNotFoundException.class, () -> tracker.getStatus(done));
        assertEquals(TaskStatus.PROCESSING, tracker.getStatus(running).status);
        release.countDown();
    }

    @Test
    void autoCleanup_sweepsPeriodically() throws Exception {
        tracker = new BackgroundTaskTracker.Builder()
                .autoCleanup(Duration.ofMillis(50), Duration.ZERO)
                .build();
        String id = tracker.submitAsync("short", null, ctx -> 1);
        tracker.awaitCompletion(id, CancellationToken.withTimeout(Duration.ofSeconds(5)));

        long deadline = System.currentTimeMillis() + 2_000;
        while (!tracker.listTasks(null).isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(tracker.listTasks(null).isEmpty(), "sweep did not remove the finished task");
    }

    @Test
    void throwingListener_doesNotAffectTaskOrOtherListeners() throws Exception {
        CountDownLatch secondSaw = new CountDownLatch(1);
        tracker = new BackgroundTaskTracker.Builder()
                .addListener(new TaskEventListener() {
                    @Override public void onComplete(String taskId) { throw new RuntimeException("listener bug"); }
                })
                .addListener(new TaskEventListener() {
                    @Override public void onComplete(String taskId) { secondSaw.countDown(); }
                })
                .build();

        String id = tracker.submitAsync("fine", null, ctx -> "fine");
        assertTrue(secondSaw.await(1, TimeUnit.SECONDS));
        assertEquals(TaskStatus.COMPLETED, tracker.getStatus(id).status);
    }

    @Test
    void close_stopsRunningTokens_andRejectsNewWork() throws Exception {
        tracker = new BackgroundTaskTracker();
        CountDownLatch started = new CountDownLatch(1);
        String id = tracker.submitAsync("loop", null, ctx -> {
            started.countDown();
            while (!ctx.token().isStopRequested()) Thread.sleep(5);
            ctx.token().throwIfStopRequested();
            return null;
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));

        tracker.close();

        assertEquals(TaskStatus.FAILED, tracker.getStatus(id).status);
        assertThrows(IllegalStateException.class, () -> tracker.submitAsync("late", null, ctx -> null));
        tracker.close();
    }
}
