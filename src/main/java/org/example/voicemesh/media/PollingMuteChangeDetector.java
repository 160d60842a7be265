package org.example.voicemesh.media;

import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

import java.util.function.BooleanSupplier;

/**
 * Polls the local track's enabled flag and diffs it against the last broadcast value.
 */
@Slf4j
public class PollingMuteChangeDetector implements MuteChangeDetector {
    private final EventLoop loop;
    private final long pollIntervalMs;

    private ScheduledTask pollTask;
    private BooleanSupplier mutedSupplier;
    private MuteChangeListener listener;
    private Boolean lastBroadcast;

    public PollingMuteChangeDetector(EventLoop loop, long pollIntervalMs) {
        this.loop = loop;
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public void start(BooleanSupplier mutedSupplier, MuteChangeListener listener) {
        stop();
        this.mutedSupplier = mutedSupplier;
        this.listener = listener;
        this.pollTask = loop.scheduleAtFixedRate(this::poll, pollIntervalMs);
    }

    @Override
    public void markBroadcast(boolean muted) {
        lastBroadcast = muted;
    }

    @Override
    public void stop() {
        if (pollTask != null) {
            pollTask.cancel();
            pollTask = null;
        }
    }

    @Override
    public boolean isRunning() {
        return pollTask != null;
    }

    void poll() {
        if (mutedSupplier == null || listener == null) return;
        boolean muted = mutedSupplier.getAsBoolean();
        if (lastBroadcast != null && lastBroadcast == muted) return;

        if (listener.onMuteChanged(muted)) {
            log.debug("Local mute change to {} broadcast", muted);
            lastBroadcast = muted;
        }
    }
}
