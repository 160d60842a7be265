package org.example.voicemesh.utils;

/**
 * Handle to a delayed or periodic task on the {@link EventLoop}.
 */
public interface ScheduledTask {

    void cancel();

    boolean isCancelled();
}
