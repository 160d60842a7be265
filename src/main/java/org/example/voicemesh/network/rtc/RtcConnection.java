package org.example.voicemesh.network.rtc;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.model.IceCandidate;
import common.model.SessionDescription;
import org.example.voicemesh.media.LocalAudioStream;

import java.util.concurrent.CompletableFuture;

/**
 * One peer-to-peer audio connection. Negotiation steps complete asynchronously, on threads owned by the implementation.
 */
public interface RtcConnection {

    String getPeerId();

    ConnectionState getConnectionState();

    IceConnectionState getIceConnectionState();

    void attachLocalAudio(LocalAudioStream stream);

    void detachLocalAudio();

    /**
     * Creates an offer and applies it as the local description.
     */
    CompletableFuture<SessionDescription> createOffer();

    /**
     * Creates an answer to the applied remote offer and applies it as the local description.
     */
    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    void addIceCandidate(IceCandidate candidate);

    void close();
}
