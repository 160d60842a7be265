package org.example.voicemesh.network.p2p;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.model.IceCandidate;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.media.LevelAnalyser;
import org.example.voicemesh.network.rtc.RtcConnection;

import java.util.ArrayList;
import java.util.List;

/**
 * Live connection to one remote participant. Owns the connection primitive and the remote audio analyser.
 * <p>
 * Records are compared by identity: a replacement record for the same peer is a different object with a
 * higher generation, which is how delayed callbacks detect that they are stale.
 */
@Slf4j
@Getter
public class PeerConnectionRecord {
    private final String peerId;
    private final RtcConnection connection;
    private final long generation;

    @Setter
    private ConnectionState connectionState = ConnectionState.CONNECTING;
    @Setter
    private IceConnectionState iceConnectionState = IceConnectionState.NEW;
    @Setter
    private int reconnectAttempts = 0;
    @Setter
    private long lastHealthCheckAt;

    private LevelAnalyser remoteAudioSink;
    private boolean remoteDescriptionApplied = false;
    private boolean remoteDescriptionPending = false;
    private final List<IceCandidate> pendingCandidates = new ArrayList<>();
    private boolean disposed = false;

    public PeerConnectionRecord(String peerId, RtcConnection connection, long generation, long createdAt) {
        this.peerId = peerId;
        this.connection = connection;
        this.generation = generation;
        this.lastHealthCheckAt = createdAt;
    }

    /**
     * Replaces the remote audio analyser, disconnecting the previous one.
     */
    public void setRemoteAudioSink(LevelAnalyser analyser) {
        if (remoteAudioSink != null && remoteAudioSink != analyser) {
            remoteAudioSink.disconnect();
        }
        remoteAudioSink = analyser;
    }

    public void queueCandidate(IceCandidate candidate) {
        pendingCandidates.add(candidate);
    }

    /**
     * Claims the one remote description this connection takes. Called before the asynchronous apply starts.
     *
     * @return false if a remote description is already applied or on its way
     */
    public boolean beginRemoteDescription() {
        if (remoteDescriptionApplied || remoteDescriptionPending) return false;
        remoteDescriptionPending = true;
        return true;
    }

    /**
     * Releases the claim after a failed apply, so a later description can be tried.
     */
    public void abortRemoteDescription() {
        remoteDescriptionPending = false;
    }

    /**
     * Marks the remote description as applied and hands back the candidates held until now.
     */
    public List<IceCandidate> markRemoteDescriptionApplied() {
        remoteDescriptionPending = false;
        remoteDescriptionApplied = true;
        List<IceCandidate> held = new ArrayList<>(pendingCandidates);
        pendingCandidates.clear();
        return held;
    }

    public boolean isHealthy() {
        return connectionState.isHealthy() && iceConnectionState.isHealthy();
    }

    /**
     * Releases the analyser and closes the connection. Idempotent.
     */
    void dispose() {
        if (disposed) return;
        disposed = true;

        if (remoteAudioSink != null) {
            try {
                remoteAudioSink.disconnect();
            } catch (Exception e) {
                log.warn("Error disconnecting analyser for {}", peerId, e);
            }
            remoteAudioSink = null;
        }

        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing connection to {}", peerId, e);
        }

        pendingCandidates.clear();
        connectionState = ConnectionState.CLOSED;
        iceConnectionState = IceConnectionState.CLOSED;
    }
}
