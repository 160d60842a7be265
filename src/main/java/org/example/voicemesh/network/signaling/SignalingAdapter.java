package org.example.voicemesh.network.signaling;

import common.model.SignalingMessage;

/**
 * Thin interface over the room-scoped signaling relay. Carries negotiation and presence messages only, never media.
 */
public interface SignalingAdapter {

    void setListener(SignalingListener listener);

    void connect();

    /**
     * Sends a message if the transport is up.
     *
     * @return false if the message could not be handed to the transport
     */
    boolean send(SignalingMessage message);

    boolean isConnected();

    /**
     * Closes the transport on purpose. Reported to the listener as an intentional transport-down.
     */
    void disconnect();
}
