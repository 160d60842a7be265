package org.example.voicemesh.network.signaling;

import common.model.SignalingMessage;

/**
 * Receives decoded relay messages and transport availability changes. Called from the transport's own threads.
 */
public interface SignalingListener {

    void onMessage(SignalingMessage message);

    void onTransportUp();

    /**
     * @param intentional true when the disconnect was requested locally (leaving), false for an outage
     */
    void onTransportDown(boolean intentional);
}
