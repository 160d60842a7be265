package org.example.voicemesh.utils;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
public class SingleThreadEventLoop implements EventLoop {
    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public SingleThreadEventLoop(String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        if (executor.isShutdown()) {
            log.debug("Event loop stopped, dropping task");
            return;
        }
        executor.execute(guard(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        return wrap(executor.schedule(guard(task), delayMs, TimeUnit.MILLISECONDS));
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, long periodMs) {
        return wrap(executor.scheduleAtFixedRate(guard(task), periodMs, periodMs, TimeUnit.MILLISECONDS));
    }

    @Override
    public void executeAndWait(Runnable task) {
        if (Thread.currentThread() == loopThread) {
            task.run();
            return;
        }
        if (executor.isShutdown()) {
            task.run();
            return;
        }
        Future<?> future = executor.submit(task);
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task failed on event loop", e.getCause());
        } catch (Exception e) {
            throw new IllegalStateException("Event loop did not complete task in time", e);
        }
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // A throwing periodic task would otherwise be silently cancelled by the executor
    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Unhandled error on voice event loop", e);
            }
        };
    }

    private ScheduledTask wrap(ScheduledFuture<?> future) {
        return new ScheduledTask() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }
}
