package org.example.voicemesh.network.p2p;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.model.IceCandidate;
import common.model.SessionDescription;
import common.model.SignalingMessage;
import common.model.VoiceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.media.AudioProcessingContext;
import org.example.voicemesh.media.AudioSource;
import org.example.voicemesh.media.LocalAudioStream;
import org.example.voicemesh.network.rtc.RtcConnection;
import org.example.voicemesh.network.rtc.RtcConnectionFactory;
import org.example.voicemesh.network.rtc.RtcConnectionObserver;
import org.example.voicemesh.network.signaling.SignalingAdapter;
import org.example.voicemesh.service.VoiceSessionState;
import org.example.voicemesh.utils.EventLoop;

import java.util.List;

/**
 * Creates and tears down peer connections and drives the offer/answer exchange.
 * <p>
 * All methods run on the voice event loop. Negotiation steps complete on connection threads and hop back onto
 * the loop, where they first check that their record is still the registered one.
 */
@Slf4j
public class ConnectionLifecycleManager {
    public static final String INITIATE_FAILED = "Failed to initiate voice call";
    public static final String ACCEPT_FAILED = "Failed to establish voice connection";
    public static final String ANSWER_FAILED = "Failed to apply voice answer";

    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final VoiceIdentity identity;
    private final PeerConnectionRegistry registry;
    private final RtcConnectionFactory connectionFactory;
    private final SignalingAdapter signaling;
    private final VoiceSessionState state;

    private PeerStateListener peerStateListener;
    private LocalAudioStream localStream;

    /**
     * Told about every state transition of a registered connection.
     */
    public interface PeerStateListener {
        void onPeerStateChanged(PeerConnectionRecord record);
    }

    public ConnectionLifecycleManager(EventLoop loop, VoiceMeshSettings settings, VoiceIdentity identity,
                                      PeerConnectionRegistry registry, RtcConnectionFactory connectionFactory,
                                      SignalingAdapter signaling, VoiceSessionState state) {
        this.loop = loop;
        this.settings = settings;
        this.identity = identity;
        this.registry = registry;
        this.connectionFactory = connectionFactory;
        this.signaling = signaling;
        this.state = state;
    }

    public void setPeerStateListener(PeerStateListener listener) {
        this.peerStateListener = listener;
    }

    // ===== Negotiation =====

    /**
     * Opens a connection to the peer and sends an offer. No-op if a record already exists.
     */
    public void initiate(String peerId) {
        if (registry.contains(peerId)) {
            log.debug("Connection to {} already exists, not initiating", peerId);
            return;
        }
        if (registry.size() >= settings.getMaxMeshConnections()) {
            log.warn("Mesh limit of {} connections reached, not connecting to {}", settings.getMaxMeshConnections(), peerId);
            state.setConnectionError("Maximum connections reached (" + (settings.getMaxMeshConnections() + 1) + " users)");
            return;
        }

        PeerConnectionRecord record;
        try {
            record = createRecord(peerId);
        } catch (Exception e) {
            log.error("❌ Could not create connection to {}", peerId, e);
            state.setConnectionError(INITIATE_FAILED);
            return;
        }
        registry.upsert(peerId, record);
        state.beginNegotiation();
        log.info("Initiating voice connection to {}", peerId);

        record.getConnection().createOffer().whenComplete((offer, error) -> loop.execute(() -> {
            state.endNegotiation();
            if (!registry.isCurrent(record)) {
                log.debug("Offer for {} completed after record was replaced", peerId);
                return;
            }
            if (error != null) {
                failNegotiation(record, INITIATE_FAILED, error);
                return;
            }
            signaling.send(SignalingMessage.offer(identity.getRoomId(), identity.getUserId(), peerId, offer));
        }));
    }

    /**
     * Answers an offer. Any existing record for the peer is disposed first, the newest offer wins.
     */
    public void acceptOffer(String peerId, SessionDescription offer) {
        if (registry.contains(peerId)) {
            log.info("New offer from {} replaces existing connection", peerId);
            registry.removeAndDispose(peerId);
        }

        PeerConnectionRecord record;
        try {
            record = createRecord(peerId);
        } catch (Exception e) {
            log.error("❌ Could not create connection for offer from {}", peerId, e);
            state.setConnectionError(ACCEPT_FAILED);
            return;
        }
        registry.upsert(peerId, record);
        state.beginNegotiation();
        log.info("Accepting voice offer from {}", peerId);

        RtcConnection connection = record.getConnection();
        record.beginRemoteDescription();
        connection.setRemoteDescription(offer).whenComplete((ignored, error) -> loop.execute(() -> {
            if (!registry.isCurrent(record)) {
                state.endNegotiation();
                log.debug("Offer from {} applied after record was replaced", peerId);
                return;
            }
            if (error != null) {
                state.endNegotiation();
                failNegotiation(record, ACCEPT_FAILED, error);
                return;
            }
            flushCandidates(record, record.markRemoteDescriptionApplied());

            connection.createAnswer().whenComplete((answer, answerError) -> loop.execute(() -> {
                state.endNegotiation();
                if (!registry.isCurrent(record)) {
                    log.debug("Answer for {} completed after record was replaced", peerId);
                    return;
                }
                if (answerError != null) {
                    failNegotiation(record, ACCEPT_FAILED, answerError);
                    return;
                }
                signaling.send(SignalingMessage.answer(identity.getRoomId(), identity.getUserId(), peerId, answer));
            }));
        }));
    }

    public void applyAnswer(String peerId, SessionDescription answer) {
        PeerConnectionRecord record = registry.get(peerId);
        if (record == null) {
            log.debug("Ignoring answer from {}: no connection", peerId);
            return;
        }
        if (!record.beginRemoteDescription()) {
            log.debug("Ignoring duplicate answer from {}", peerId);
            return;
        }

        record.getConnection().setRemoteDescription(answer).whenComplete((ignored, error) -> loop.execute(() -> {
            if (!registry.isCurrent(record)) {
                log.debug("Answer from {} applied after record was replaced", peerId);
                return;
            }
            if (error != null) {
                record.abortRemoteDescription();
                log.warn("Could not apply answer from {}: {}", peerId, error.getMessage());
                state.setConnectionError(ANSWER_FAILED);
                return;
            }
            flushCandidates(record, record.markRemoteDescriptionApplied());
        }));
    }

    /**
     * Adds a remote candidate, holding it until the remote description is in place.
     */
    public void applyIceCandidate(String peerId, IceCandidate candidate) {
        PeerConnectionRecord record = registry.get(peerId);
        if (record == null) {
            log.debug("Ignoring ICE candidate from {}: no connection", peerId);
            return;
        }
        if (!record.isRemoteDescriptionApplied()) {
            record.queueCandidate(candidate);
            return;
        }
        addCandidate(record, candidate);
    }

    // ===== Local media =====

    /**
     * Uses the stream for new connections and renegotiates existing ones so they carry it.
     */
    public void attachLocalStream(LocalAudioStream stream) {
        this.localStream = stream;
        if (!state.canTransmit()) return;

        for (String peerId : registry.peerIds()) {
            log.info("Renegotiating connection to {} to add local audio", peerId);
            registry.removeAndDispose(peerId);
            initiate(peerId);
        }
    }

    public void detachLocalStream() {
        if (localStream == null) return;
        localStream = null;
        registry.forEach(record -> {
            try {
                record.getConnection().detachLocalAudio();
            } catch (Exception e) {
                log.warn("Error detaching local audio from {}", record.getPeerId(), e);
            }
        });
    }

    public LocalAudioStream getLocalStream() {
        return localStream;
    }

    // ===== Internals =====

    private PeerConnectionRecord createRecord(String peerId) {
        RecordObserver observer = new RecordObserver(peerId);
        RtcConnection connection = connectionFactory.create(peerId, observer);
        try {
            if (state.canTransmit() && localStream != null) {
                connection.attachLocalAudio(localStream);
            }
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
        PeerConnectionRecord record = new PeerConnectionRecord(peerId, connection, registry.nextGeneration(), loop.now());
        observer.record = record;
        return record;
    }

    private void flushCandidates(PeerConnectionRecord record, List<IceCandidate> held) {
        if (!held.isEmpty()) {
            log.debug("Applying {} held ICE candidate(s) for {}", held.size(), record.getPeerId());
        }
        for (IceCandidate candidate : held) {
            addCandidate(record, candidate);
        }
    }

    private void addCandidate(PeerConnectionRecord record, IceCandidate candidate) {
        try {
            record.getConnection().addIceCandidate(candidate);
        } catch (Exception e) {
            log.warn("Could not add ICE candidate for {}: {}", record.getPeerId(), e.getMessage());
        }
    }

    private void failNegotiation(PeerConnectionRecord record, String message, Throwable error) {
        log.error("❌ Negotiation with {} failed", record.getPeerId(), error);
        state.setConnectionError(message);
        registry.removeAndDispose(record.getPeerId());
    }

    private void onConnectionState(PeerConnectionRecord record, ConnectionState connectionState) {
        if (!registry.isCurrent(record)) return;
        log.info("Connection to {}: {}", record.getPeerId(), connectionState.getWireName());
        record.setConnectionState(connectionState);
        notifyStateChange(record);
    }

    private void onIceState(PeerConnectionRecord record, IceConnectionState iceState) {
        if (!registry.isCurrent(record)) return;
        log.info("ICE to {}: {}", record.getPeerId(), iceState.getWireName());
        record.setIceConnectionState(iceState);
        notifyStateChange(record);
    }

    private void notifyStateChange(PeerConnectionRecord record) {
        if (record.isHealthy()) {
            state.clearConnectionError();
        }
        if (peerStateListener != null) {
            peerStateListener.onPeerStateChanged(record);
        }
    }

    private void onLocalCandidate(PeerConnectionRecord record, IceCandidate candidate) {
        if (!registry.isCurrent(record)) return;
        signaling.send(SignalingMessage.iceCandidate(identity.getRoomId(), identity.getUserId(), record.getPeerId(), candidate));
    }

    private void onRemoteAudio(PeerConnectionRecord record, AudioSource source) {
        if (!registry.isCurrent(record)) return;
        try {
            record.setRemoteAudioSink(AudioProcessingContext.getInstance().createAnalyser(record.getPeerId(), source));
        } catch (Exception e) {
            log.warn("Could not analyse audio from {}", record.getPeerId(), e);
        }
    }

    /**
     * Bridges connection callbacks onto the event loop. The record is bound right after the connection is built.
     */
    private class RecordObserver implements RtcConnectionObserver {
        private final String peerId;
        private volatile PeerConnectionRecord record;

        RecordObserver(String peerId) {
            this.peerId = peerId;
        }

        @Override
        public void onIceCandidate(IceCandidate candidate) {
            loop.execute(() -> {
                if (record != null) onLocalCandidate(record, candidate);
            });
        }

        @Override
        public void onConnectionStateChange(ConnectionState connectionState) {
            loop.execute(() -> {
                if (record != null) onConnectionState(record, connectionState);
            });
        }

        @Override
        public void onIceConnectionStateChange(IceConnectionState iceState) {
            loop.execute(() -> {
                if (record != null) onIceState(record, iceState);
            });
        }

        @Override
        public void onRemoteAudio(AudioSource remoteAudio) {
            loop.execute(() -> {
                if (record == null) {
                    log.debug("Remote audio from {} before record was bound", peerId);
                    return;
                }
                ConnectionLifecycleManager.this.onRemoteAudio(record, remoteAudio);
            });
        }
    }
}
