package org.example.voicemesh.service;

import common.constant.SignalingEvents;
import common.enums.TransportState;
import common.model.ParticipantInfo;
import common.model.SignalingMessage;
import common.model.VoiceIdentity;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.media.AudioLevelMonitor;
import org.example.voicemesh.media.AudioProcessingContext;
import org.example.voicemesh.media.LevelAnalyser;
import org.example.voicemesh.media.LocalAudioStream;
import org.example.voicemesh.media.MuteChangeDetector;
import org.example.voicemesh.media.PollingMuteChangeDetector;
import org.example.voicemesh.network.p2p.ConnectionLifecycleManager;
import org.example.voicemesh.network.p2p.ConnectionRetryMonitor;
import org.example.voicemesh.network.p2p.GracePeriodController;
import org.example.voicemesh.network.p2p.HealthMonitor;
import org.example.voicemesh.network.p2p.HeartbeatPublisher;
import org.example.voicemesh.network.p2p.PeerConnectionRegistry;
import org.example.voicemesh.network.rtc.RtcConnectionFactory;
import org.example.voicemesh.network.signaling.SignalingAdapter;
import org.example.voicemesh.network.signaling.SignalingListener;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

import java.util.Objects;

/**
 * Voice mesh for one user in one room: wires the components together, dispatches relay messages and exposes
 * the imperative entry points.
 * <p>
 * Everything runs on the given {@link EventLoop}. Entry points block until their work is done on the loop.
 */
@Slf4j
public class VoiceSessionService implements SignalingListener {
    static final String RATE_LIMIT_MARKER = "Rate limit exceeded";
    static final String VALIDATION_MARKER = "WebRTC validation failed";
    static final int DEFAULT_RETRY_AFTER_SECONDS = 15;

    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final VoiceIdentity identity;
    private final SignalingAdapter signaling;

    private final VoiceSessionState state;
    private final PeerConnectionRegistry registry;
    private final ConnectionLifecycleManager lifecycle;
    @Getter(AccessLevel.PACKAGE)
    private final HealthMonitor healthMonitor;
    @Getter(AccessLevel.PACKAGE)
    private final ConnectionRetryMonitor connectionRetryMonitor;
    @Getter(AccessLevel.PACKAGE)
    private final HeartbeatPublisher heartbeatPublisher;
    private final GracePeriodController gracePeriodController;
    @Getter(AccessLevel.PACKAGE)
    private final AudioLevelMonitor audioLevelMonitor;
    @Getter(AccessLevel.PACKAGE)
    private final MuteChangeDetector muteChangeDetector;

    private LocalAudioStream localStream;
    private LevelAnalyser localAnalyser;
    private ScheduledTask errorClearTask;

    public VoiceSessionService(EventLoop loop, VoiceMeshSettings settings, VoiceIdentity identity,
                               SignalingAdapter signaling, RtcConnectionFactory connectionFactory, boolean canTransmit) {
        this.loop = loop;
        this.settings = settings;
        this.identity = identity;
        this.signaling = signaling;

        this.state = new VoiceSessionState(canTransmit);
        this.registry = new PeerConnectionRegistry();
        this.lifecycle = new ConnectionLifecycleManager(loop, settings, identity, registry, connectionFactory, signaling, state);
        this.healthMonitor = new HealthMonitor(loop, settings, registry, state, this::reconnectPeer);
        this.lifecycle.setPeerStateListener(healthMonitor);
        this.connectionRetryMonitor = new ConnectionRetryMonitor(loop, settings, identity.getUserId(), registry, state,
                healthMonitor, this::canInitiate, this::reconnectPeer);
        this.heartbeatPublisher = new HeartbeatPublisher(loop, settings, identity, registry, signaling);
        this.gracePeriodController = new GracePeriodController(loop, settings, new SessionTransportHooks());
        this.audioLevelMonitor = new AudioLevelMonitor(loop, settings, identity.getUserId(), registry, state);
        this.muteChangeDetector = new PollingMuteChangeDetector(loop, settings.getMutePollIntervalMs());

        signaling.setListener(this);
    }

    /**
     * Opens the relay transport. Presence is announced by {@link #addLocalStream} or {@link #enableAudioReception}.
     */
    public void start() {
        signaling.connect();
    }

    public VoiceSessionState getState() {
        return state;
    }

    // ===== Entry points =====

    public void addLocalStream(LocalAudioStream stream) {
        Objects.requireNonNull(stream, "stream");
        loop.executeAndWait(() -> {
            gracePeriodController.reactivate(signaling.isConnected());
            if (localStream != null && localStream != stream) {
                releaseLocalStream();
            }

            localStream = stream;
            try {
                if (localAnalyser == null) {
                    localAnalyser = AudioProcessingContext.getInstance().createAnalyser(identity.getUserId(), stream);
                }
            } catch (Exception e) {
                log.warn("Could not analyse local audio", e);
            }
            audioLevelMonitor.setLocalSource(stream, localAnalyser);
            state.setHasLocalStream(true);
            lifecycle.attachLocalStream(stream);

            state.addParticipant(identity.getUserId(), identity.getUsername());
            state.setParticipantMuted(identity.getUserId(), !stream.isAudioTrackEnabled());

            announcePresence();
            startMuteDetection();
            startPolling();
            log.info("🎙️ Local audio added for {}", identity.getUserId());
        });
    }

    public void removeLocalStream() {
        loop.executeAndWait(() -> {
            if (localStream == null) return;
            releaseLocalStream();
            state.removeParticipant(identity.getUserId());
            if (!state.isAudioEnabled()) {
                stopPolling();
            }
            log.info("Local audio removed for {}", identity.getUserId());
        });
    }

    public void enableAudioReception() {
        loop.executeAndWait(() -> {
            try {
                AudioProcessingContext.getInstance();
                gracePeriodController.reactivate(signaling.isConnected());
                state.setAudioEnabled(true);
                if (!state.canTransmit()) {
                    signaling.send(SignalingMessage.joinVoice(identity.getRoomId(), identity.getUserId(), identity.getUsername()));
                }
                signaling.send(SignalingMessage.requestParticipants(identity.getRoomId()));
                startPolling();
            } catch (Exception e) {
                log.error("❌ Failed to enable audio reception", e);
                state.setConnectionError("Failed to enable audio reception");
            }
        });
    }

    public void setCanTransmit(boolean canTransmit) {
        loop.executeAndWait(() -> state.setCanTransmit(canTransmit));
    }

    /**
     * Leaves the voice session: everything is stopped and released before this returns.
     */
    public void performIntentionalCleanup() {
        loop.executeAndWait(() -> {
            if (isActive() && signaling.isConnected()) {
                signaling.send(SignalingMessage.leaveVoice(identity.getRoomId(), identity.getUserId()));
            }
            gracePeriodController.tearDownIntentionally();
        });
    }

    /**
     * Leaves, closes the relay and stops the event loop.
     */
    public void shutdown() {
        performIntentionalCleanup();
        signaling.disconnect();
        loop.shutdown();
    }

    // ===== Relay callbacks =====

    @Override
    public void onMessage(SignalingMessage message) {
        loop.execute(() -> dispatch(message));
    }

    @Override
    public void onTransportUp() {
        loop.execute(gracePeriodController::onTransportUp);
    }

    @Override
    public void onTransportDown(boolean intentional) {
        loop.execute(() -> gracePeriodController.onTransportDown(intentional));
    }

    void dispatch(SignalingMessage message) {
        String event = message.getEvent();
        try {
            switch (event) {
                case SignalingEvents.USER_JOINED_VOICE:
                    handleUserJoined(message);
                    break;
                case SignalingEvents.USER_LEFT_VOICE:
                    handleUserLeft(message.getUserId());
                    break;
                case SignalingEvents.VOICE_PARTICIPANTS:
                    handleParticipants(message);
                    break;
                case SignalingEvents.VOICE_OFFER:
                    if (isForMe(message)) lifecycle.acceptOffer(message.getFromUserId(), message.getDescription());
                    break;
                case SignalingEvents.VOICE_ANSWER:
                    if (isForMe(message)) lifecycle.applyAnswer(message.getFromUserId(), message.getDescription());
                    break;
                case SignalingEvents.VOICE_ICE_CANDIDATE:
                    if (isForMe(message)) lifecycle.applyIceCandidate(message.getFromUserId(), message.getCandidate());
                    break;
                case SignalingEvents.VOICE_MUTE_CHANGED:
                    handleRemoteMute(message);
                    break;
                case SignalingEvents.VOICE_CONNECTION_FAILED:
                    if (message.getFromUserId() != null) healthMonitor.checkPeer(message.getFromUserId());
                    break;
                case SignalingEvents.VOICE_RECONNECTION_REQUESTED:
                    handleReconnectionRequest(message);
                    break;
                case SignalingEvents.ERROR:
                    handleRelayError(message);
                    break;
                default:
                    log.debug("Ignoring relay event {}", event);
            }
        } catch (Exception e) {
            log.error("❌ Error handling relay event {}", event, e);
        }
    }

    private void handleUserJoined(SignalingMessage message) {
        String userId = message.getUserId();
        if (userId == null || userId.equals(identity.getUserId())) return;

        state.addParticipant(userId, message.getUsername());
        if (canInitiate()) {
            lifecycle.initiate(userId);
        }
    }

    private void handleUserLeft(String userId) {
        if (userId == null || userId.equals(identity.getUserId())) return;
        log.info("{} left voice", userId);
        healthMonitor.cancelReconnect(userId);
        registry.removeAndDispose(userId);
        registry.resetReconnectAttempts(userId);
        audioLevelMonitor.forget(userId);
        state.removeParticipant(userId);
    }

    private void handleParticipants(SignalingMessage message) {
        if (message.getParticipants() == null) return;
        for (ParticipantInfo participant : message.getParticipants()) {
            if (participant.getUserId().equals(identity.getUserId())) continue;
            state.addParticipant(participant.getUserId(), participant.getUsername());
            if (participant.getMuted() != null) {
                audioLevelMonitor.recordExplicitMute(participant.getUserId(), participant.getMuted());
                state.setParticipantMuted(participant.getUserId(), participant.getMuted());
            }
        }
    }

    private void handleRemoteMute(SignalingMessage message) {
        String userId = message.getUserId();
        if (userId == null || userId.equals(identity.getUserId()) || message.getMuted() == null) return;
        state.addParticipant(userId, "");
        audioLevelMonitor.recordExplicitMute(userId, message.getMuted());
        state.setParticipantMuted(userId, message.getMuted());
    }

    private void handleReconnectionRequest(SignalingMessage message) {
        String peerId = message.getFromUserId();
        if (peerId == null || !identity.getUserId().equals(message.getTargetUserId())) return;
        log.info("{} asked for a fresh connection", peerId);
        healthMonitor.cancelReconnect(peerId);
        registry.removeAndDispose(peerId);
        lifecycle.initiate(peerId);
    }

    private void handleRelayError(SignalingMessage message) {
        String text = message.getErrorMessage() != null ? message.getErrorMessage() : "Voice relay error";
        if (text.contains(RATE_LIMIT_MARKER)) {
            int retryAfter = message.getRetryAfter() != null ? message.getRetryAfter() : DEFAULT_RETRY_AFTER_SECONDS;
            String error = "Rate limit exceeded. Please wait " + retryAfter + " seconds before trying again.";
            state.setConnectionError(error);
            scheduleErrorClear(error, (retryAfter + 1) * 1000L);
        } else if (text.contains(VALIDATION_MARKER)) {
            if (message.getErrorDetails() != null && message.getErrorDetails().contains("User not authenticated")) {
                log.warn("Relay has not authenticated us yet, waiting for reconnect");
                return;
            }
            state.setConnectionError("Voice connection validation failed. Please refresh the page.");
        } else {
            state.setConnectionError(text);
        }
    }

    private void scheduleErrorClear(String error, long delayMs) {
        if (errorClearTask != null) errorClearTask.cancel();
        errorClearTask = loop.schedule(() -> {
            errorClearTask = null;
            if (error.equals(state.getConnectionError())) {
                state.clearConnectionError();
            }
        }, delayMs);
    }

    // ===== Internals =====

    private boolean isForMe(SignalingMessage message) {
        if (message.getFromUserId() == null || message.getFromUserId().equals(identity.getUserId())) {
            return false;
        }
        if (!message.isAddressedTo(identity.getUserId())) {
            log.debug("Ignoring {} addressed to {}", message.getEvent(), message.getTargetUserId());
            return false;
        }
        return true;
    }

    private boolean canInitiate() {
        return state.canTransmit() && localStream != null;
    }

    private boolean isActive() {
        return localStream != null || state.isAudioEnabled();
    }

    private void reconnectPeer(String peerId) {
        if (gracePeriodController.getState() != TransportState.TRANSPORT_UP) {
            log.debug("Not reconnecting to {} while signaling is down", peerId);
            return;
        }
        if (!canInitiate()) {
            log.info("Waiting for {} to offer again (not transmitting)", peerId);
            return;
        }
        lifecycle.initiate(peerId);
    }

    private void announcePresence() {
        signaling.send(SignalingMessage.joinVoice(identity.getRoomId(), identity.getUserId(), identity.getUsername()));
        if (localStream != null && state.canTransmit()) {
            boolean muted = !localStream.isAudioTrackEnabled();
            if (signaling.send(SignalingMessage.muteChanged(identity.getRoomId(), identity.getUserId(), muted))) {
                muteChangeDetector.markBroadcast(muted);
            }
        }
        signaling.send(SignalingMessage.requestParticipants(identity.getRoomId()));
    }

    private void startMuteDetection() {
        LocalAudioStream stream = localStream;
        muteChangeDetector.start(() -> !stream.isAudioTrackEnabled(), this::broadcastLocalMute);
    }

    /**
     * Publishes a local mute transition. While the relay is down nothing is sent; the re-announce on
     * reconnect carries the current mute state.
     */
    private boolean broadcastLocalMute(boolean muted) {
        state.setParticipantMuted(identity.getUserId(), muted);
        if (!signaling.isConnected()) {
            return false;
        }
        return signaling.send(SignalingMessage.muteChanged(identity.getRoomId(), identity.getUserId(), muted));
    }

    private void startPolling() {
        if (gracePeriodController.getState() != TransportState.TRANSPORT_UP) {
            log.debug("Signaling down, polling resumes when it returns");
            return;
        }
        healthMonitor.start();
        connectionRetryMonitor.start();
        heartbeatPublisher.start();
        audioLevelMonitor.start();
    }

    private void stopPolling() {
        healthMonitor.stop();
        connectionRetryMonitor.stop();
        heartbeatPublisher.stop();
        audioLevelMonitor.stop();
    }

    private void releaseLocalStream() {
        muteChangeDetector.stop();
        lifecycle.detachLocalStream();
        audioLevelMonitor.clearLocalSource();
        if (localAnalyser != null) {
            localAnalyser.disconnect();
            localAnalyser = null;
        }
        localStream = null;
        state.setHasLocalStream(false);
    }

    private class SessionTransportHooks implements GracePeriodController.TransportHooks {
        @Override
        public void suspendPolling() {
            healthMonitor.stop();
            connectionRetryMonitor.stop();
            heartbeatPublisher.stop();
        }

        @Override
        public void onTransportRestored(TransportState previous) {
            if (!isActive()) return;
            log.info("Re-announcing voice presence after {}", previous);
            if (localStream != null) {
                state.addParticipant(identity.getUserId(), identity.getUsername());
                state.setParticipantMuted(identity.getUserId(), !localStream.isAudioTrackEnabled());
            }
            startPolling();
            announcePresence();
            if (localStream != null && !muteChangeDetector.isRunning()) {
                startMuteDetection();
            }
        }

        @Override
        public void tearDown(boolean intentional) {
            stopPolling();
            if (errorClearTask != null) {
                errorClearTask.cancel();
                errorClearTask = null;
            }
            registry.disposeAll();
            audioLevelMonitor.clearRemoteState();

            if (intentional) {
                releaseLocalStream();
                AudioProcessingContext.shutdown();
                state.reset();
                log.info("Voice session left");
            } else {
                muteChangeDetector.stop();
                state.clearParticipants();
                log.warn("Voice session torn down after signaling outage");
            }
        }
    }
}
