package org.example.voicemesh.utils;

/**
 * Single-threaded cooperative scheduler the voice components run on.
 * <p>
 * Every task submitted here runs on the same logical thread, so components never lock their state.
 * Callbacks arriving from network or native threads must hop onto the loop with {@link #execute(Runnable)}.
 */
public interface EventLoop {

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, long delayMs);

    ScheduledTask scheduleAtFixedRate(Runnable task, long periodMs);

    /**
     * Runs the task on the loop and waits for it to finish. Used by teardown paths that must complete before returning.
     */
    void executeAndWait(Runnable task);

    long now();

    void shutdown();
}
