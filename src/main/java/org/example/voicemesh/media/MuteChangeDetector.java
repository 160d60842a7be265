package org.example.voicemesh.media;

import java.util.function.BooleanSupplier;

/**
 * Detects local mute transitions and reports each transition once.
 */
public interface MuteChangeDetector {

    /**
     * Publishes a mute transition.
     *
     * @return true if the new state was delivered; an undelivered transition is reported again later
     */
    @FunctionalInterface
    interface MuteChangeListener {
        boolean onMuteChanged(boolean muted);
    }

    void start(BooleanSupplier mutedSupplier, MuteChangeListener listener);

    /**
     * Records a value that was broadcast outside the detector, so it is not reported again.
     */
    void markBroadcast(boolean muted);

    void stop();

    boolean isRunning();
}
