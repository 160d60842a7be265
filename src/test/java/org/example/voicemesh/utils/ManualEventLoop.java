package org.example.voicemesh.utils;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * Deterministic {@link EventLoop} for tests. Time only moves through {@link #advanceBy(long)};
 * executed tasks queue up until {@link #runPending()} or the next advance.
 */
public class ManualEventLoop implements EventLoop {
    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
            Comparator.comparingLong((Timer t) -> t.dueAt).thenComparingLong(t -> t.sequence));
    private long now = 0;
    private long sequence = 0;
    private boolean shutdown = false;

    @Override
    public void execute(Runnable task) {
        if (shutdown) return;
        ready.add(task);
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        Timer timer = new Timer(now + delayMs, 0, task, sequence++);
        timers.add(timer);
        return timer;
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, long periodMs) {
        Timer timer = new Timer(now + periodMs, periodMs, task, sequence++);
        timers.add(timer);
        return timer;
    }

    @Override
    public void executeAndWait(Runnable task) {
        task.run();
        runPending();
    }

    @Override
    public long now() {
        return now;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        ready.clear();
        timers.clear();
    }

    public void runPending() {
        Runnable task;
        while ((task = ready.poll()) != null) {
            task.run();
        }
    }

    /**
     * Moves the clock forward, firing every timer that falls due on the way in order.
     */
    public void advanceBy(long ms) {
        long target = now + ms;
        runPending();
        while (true) {
            Timer next = timers.peek();
            if (next == null || next.dueAt > target) break;
            timers.poll();
            if (next.cancelled) continue;

            now = next.dueAt;
            if (next.periodMs > 0) {
                next.dueAt += next.periodMs;
                timers.add(next);
            }
            next.task.run();
            runPending();
        }
        now = target;
    }

    public long activeTimerCount() {
        return timers.stream().filter(t -> !t.cancelled).count();
    }

    private static class Timer implements ScheduledTask {
        private long dueAt;
        private final long periodMs;
        private final Runnable task;
        private final long sequence;
        private boolean cancelled = false;

        Timer(long dueAt, long periodMs, Runnable task, long sequence) {
            this.dueAt = dueAt;
            this.periodMs = periodMs;
            this.task = task;
            this.sequence = sequence;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
