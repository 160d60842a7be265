package org.example.voicemesh.network.p2p;

import common.enums.TransportState;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

/**
 * Decides what a signaling-transport outage does to the voice session.
 * <pre>
 *   TRANSPORT_UP --accidental down--> TRANSPORT_DOWN_GRACE --up before timer--> TRANSPORT_UP
 *        |                                   |
 *        +--intentional down--> TORN_DOWN <--timer fires
 * </pre>
 * Peer connections survive the grace window because media does not flow through the relay.
 */
@Slf4j
public class GracePeriodController {
    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final TransportHooks hooks;

    private TransportState state = TransportState.TRANSPORT_UP;
    private ScheduledTask graceTimer;
    private Object graceToken;

    /**
     * Session-side actions driven by transport transitions.
     */
    public interface TransportHooks {
        void suspendPolling();

        /**
         * Transport is back. {@code previous} is the state the controller left.
         */
        void onTransportRestored(TransportState previous);

        void tearDown(boolean intentional);
    }

    public GracePeriodController(EventLoop loop, VoiceMeshSettings settings, TransportHooks hooks) {
        this.loop = loop;
        this.settings = settings;
        this.hooks = hooks;
    }

    public void onTransportDown(boolean intentional) {
        if (intentional) {
            log.info("Signaling closed intentionally, tearing down voice session");
            cancelGraceTimer();
            tearDown(true);
            return;
        }

        switch (state) {
            case TRANSPORT_UP:
                state = TransportState.TRANSPORT_DOWN_GRACE;
                hooks.suspendPolling();
                startGraceTimer();
                log.warn("⚠️ Signaling lost, keeping peer connections for {}ms", settings.getGracePeriodMs());
                break;
            case TRANSPORT_DOWN_GRACE:
                log.debug("Signaling down again while already in grace period");
                break;
            case TORN_DOWN:
            default:
                log.debug("Signaling down after teardown, nothing to preserve");
                break;
        }
    }

    public void onTransportUp() {
        TransportState previous = state;
        if (previous == TransportState.TRANSPORT_DOWN_GRACE) {
            cancelGraceTimer();
            log.info("✅ Signaling restored within grace period");
        }
        state = TransportState.TRANSPORT_UP;
        hooks.onTransportRestored(previous);
    }

    /**
     * Leave on purpose. Same path as an intentional transport close.
     */
    public void tearDownIntentionally() {
        onTransportDown(true);
    }

    /**
     * A new session starting over a live transport after a teardown.
     */
    public void reactivate(boolean transportConnected) {
        if (state == TransportState.TORN_DOWN && transportConnected) {
            state = TransportState.TRANSPORT_UP;
        }
    }

    public TransportState getState() {
        return state;
    }

    public boolean isGraceTimerActive() {
        return graceTimer != null;
    }

    private void startGraceTimer() {
        if (graceTimer != null) return;
        Object token = new Object();
        graceToken = token;
        graceTimer = loop.schedule(() -> {
            if (graceToken != token || state != TransportState.TRANSPORT_DOWN_GRACE) return;
            graceTimer = null;
            graceToken = null;
            log.warn("Grace period of {}ms expired without signaling, tearing down", settings.getGracePeriodMs());
            tearDown(false);
        }, settings.getGracePeriodMs());
    }

    private void cancelGraceTimer() {
        if (graceTimer != null) {
            graceTimer.cancel();
            graceTimer = null;
        }
        graceToken = null;
    }

    private void tearDown(boolean intentional) {
        state = TransportState.TORN_DOWN;
        hooks.tearDown(intentional);
    }
}
