package org.example.voicemesh.network.rtc;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.model.IceCandidate;
import common.model.SessionDescription;
import org.example.voicemesh.media.AudioSource;
import org.example.voicemesh.media.LocalAudioStream;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory {@link RtcConnection}. Negotiation futures complete immediately unless auto-completion is off,
 * in which case the test completes them through {@link #pendingOffer()} and friends.
 */
public class FakeRtcConnection implements RtcConnection {
    private final String peerId;
    private final RtcConnectionObserver observer;
    private final boolean autoComplete;
    private final boolean failNegotiation;

    private volatile ConnectionState connectionState = ConnectionState.NEW;
    private volatile IceConnectionState iceConnectionState = IceConnectionState.NEW;
    private LocalAudioStream localAudio;
    private boolean closed = false;

    private final List<SessionDescription> remoteDescriptions = new ArrayList<>();
    private final List<IceCandidate> addedCandidates = new ArrayList<>();
    private CompletableFuture<SessionDescription> pendingOffer;
    private CompletableFuture<SessionDescription> pendingAnswer;
    private CompletableFuture<Void> pendingRemoteDescription;
    private int offersCreated = 0;

    public FakeRtcConnection(String peerId) {
        this(peerId, null, true, false);
    }

    public FakeRtcConnection(String peerId, RtcConnectionObserver observer, boolean autoComplete, boolean failNegotiation) {
        this.peerId = peerId;
        this.observer = observer;
        this.autoComplete = autoComplete;
        this.failNegotiation = failNegotiation;
    }

    @Override
    public String getPeerId() {
        return peerId;
    }

    @Override
    public ConnectionState getConnectionState() {
        return connectionState;
    }

    @Override
    public IceConnectionState getIceConnectionState() {
        return iceConnectionState;
    }

    @Override
    public void attachLocalAudio(LocalAudioStream stream) {
        localAudio = stream;
    }

    @Override
    public void detachLocalAudio() {
        localAudio = null;
    }

    @Override
    public CompletableFuture<SessionDescription> createOffer() {
        offersCreated++;
        pendingOffer = new CompletableFuture<>();
        settle(pendingOffer, SessionDescription.offer("offer-sdp-" + peerId));
        return pendingOffer;
    }

    @Override
    public CompletableFuture<SessionDescription> createAnswer() {
        pendingAnswer = new CompletableFuture<>();
        settle(pendingAnswer, SessionDescription.answer("answer-sdp-" + peerId));
        return pendingAnswer;
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        remoteDescriptions.add(description);
        pendingRemoteDescription = new CompletableFuture<>();
        if (autoComplete) pendingRemoteDescription.complete(null);
        return pendingRemoteDescription;
    }

    @Override
    public void addIceCandidate(IceCandidate candidate) {
        addedCandidates.add(candidate);
    }

    @Override
    public void close() {
        closed = true;
        localAudio = null;
        connectionState = ConnectionState.CLOSED;
        iceConnectionState = IceConnectionState.CLOSED;
    }

    private void settle(CompletableFuture<SessionDescription> future, SessionDescription value) {
        if (!autoComplete) return;
        if (failNegotiation) {
            future.completeExceptionally(new IllegalStateException("negotiation failed for " + peerId));
        } else {
            future.complete(value);
        }
    }

    // ===== Test controls =====

    /**
     * Changes the reported states without telling the observer, like a connection the watchdog has to poll.
     */
    public void setStates(ConnectionState connectionState, IceConnectionState iceConnectionState) {
        this.connectionState = connectionState;
        this.iceConnectionState = iceConnectionState;
    }

    public void emitStates(ConnectionState connectionState, IceConnectionState iceConnectionState) {
        setStates(connectionState, iceConnectionState);
        observer.onConnectionStateChange(connectionState);
        observer.onIceConnectionStateChange(iceConnectionState);
    }

    public void emitIceCandidate(IceCandidate candidate) {
        observer.onIceCandidate(candidate);
    }

    public void emitRemoteAudio(AudioSource source) {
        observer.onRemoteAudio(source);
    }

    public CompletableFuture<SessionDescription> pendingOffer() {
        return pendingOffer;
    }

    public CompletableFuture<SessionDescription> pendingAnswer() {
        return pendingAnswer;
    }

    public CompletableFuture<Void> pendingRemoteDescription() {
        return pendingRemoteDescription;
    }

    public List<SessionDescription> getRemoteDescriptions() {
        return remoteDescriptions;
    }

    public List<IceCandidate> getAddedCandidates() {
        return addedCandidates;
    }

    public LocalAudioStream getLocalAudio() {
        return localAudio;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getOffersCreated() {
        return offersCreated;
    }
}
