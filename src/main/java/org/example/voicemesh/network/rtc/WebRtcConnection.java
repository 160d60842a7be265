package org.example.voicemesh.network.rtc;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.enums.SdpType;
import common.model.IceCandidate;
import common.model.SessionDescription;
import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceConnectionState;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCRtpSender;
import dev.onvoid.webrtc.RTCRtpTransceiver;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;
import dev.onvoid.webrtc.media.MediaStreamTrack;
import dev.onvoid.webrtc.media.audio.AudioTrack;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.media.LocalAudioStream;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RtcConnection} over a native {@link RTCPeerConnection}.
 */
@Slf4j
public class WebRtcConnection implements RtcConnection {
    private static final String STREAM_ID = "voice";

    private final String peerId;
    private final RTCPeerConnection peerConnection;
    private final RtcConnectionObserver observer;

    private volatile ConnectionState connectionState = ConnectionState.NEW;
    private volatile IceConnectionState iceConnectionState = IceConnectionState.NEW;
    private RTCRtpSender audioSender;

    WebRtcConnection(String peerId, PeerConnectionFactory factory, RTCConfiguration config, RtcConnectionObserver observer) {
        this.peerId = peerId;
        this.observer = observer;
        this.peerConnection = factory.createPeerConnection(config, new NativeObserver());
        if (this.peerConnection == null) {
            throw new IllegalStateException("Native peer connection could not be created for " + peerId);
        }
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
    public synchronized void attachLocalAudio(LocalAudioStream stream) {
        if (!(stream instanceof WebRtcAudioTrackSource)) {
            throw new IllegalArgumentException("Unsupported local stream type: " + stream.getClass().getName());
        }
        if (audioSender != null) {
            log.debug("Local audio already attached for {}", peerId);
            return;
        }
        AudioTrack track = ((WebRtcAudioTrackSource) stream).getTrack();
        audioSender = peerConnection.addTrack(track, List.of(STREAM_ID));
    }

    @Override
    public synchronized void detachLocalAudio() {
        if (audioSender == null) return;
        try {
            peerConnection.removeTrack(audioSender);
        } catch (Exception e) {
            log.warn("Error removing local audio from {}", peerId, e);
        }
        audioSender = null;
    }

    @Override
    public CompletableFuture<SessionDescription> createOffer() {
        CompletableFuture<SessionDescription> future = new CompletableFuture<>();
        try {
            peerConnection.createOffer(new RTCOfferOptions(), new LocalDescriptionObserver(future));
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public CompletableFuture<SessionDescription> createAnswer() {
        CompletableFuture<SessionDescription> future = new CompletableFuture<>();
        try {
            peerConnection.createAnswer(new RTCAnswerOptions(), new LocalDescriptionObserver(future));
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            RTCSdpType type = description.getType() == SdpType.ANSWER ? RTCSdpType.ANSWER : RTCSdpType.OFFER;
            peerConnection.setRemoteDescription(new RTCSessionDescription(type, description.getSdp()),
                    new SetSessionDescriptionObserver() {
                        @Override
                        public void onSuccess() {
                            future.complete(null);
                        }

                        @Override
                        public void onFailure(String error) {
                            future.completeExceptionally(new IllegalStateException("setRemoteDescription failed: " + error));
                        }
                    });
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    public void addIceCandidate(IceCandidate candidate) {
        peerConnection.addIceCandidate(new RTCIceCandidate(candidate.getSdpMid(), candidate.getSdpMLineIndex(), candidate.getCandidate()));
    }

    @Override
    public synchronized void close() {
        detachLocalAudio();
        peerConnection.close();
        connectionState = ConnectionState.CLOSED;
        iceConnectionState = IceConnectionState.CLOSED;
    }

    private class LocalDescriptionObserver implements CreateSessionDescriptionObserver {
        private final CompletableFuture<SessionDescription> future;

        LocalDescriptionObserver(CompletableFuture<SessionDescription> future) {
            this.future = future;
        }

        @Override
        public void onSuccess(RTCSessionDescription description) {
            peerConnection.setLocalDescription(description, new SetSessionDescriptionObserver() {
                @Override
                public void onSuccess() {
                    future.complete(new SessionDescription(
                            description.sdpType == RTCSdpType.ANSWER ? SdpType.ANSWER : SdpType.OFFER,
                            description.sdp));
                }

                @Override
                public void onFailure(String error) {
                    future.completeExceptionally(new IllegalStateException("setLocalDescription failed: " + error));
                }
            });
        }

        @Override
        public void onFailure(String error) {
            future.completeExceptionally(new IllegalStateException("Session description creation failed: " + error));
        }
    }

    private class NativeObserver implements PeerConnectionObserver {
        @Override
        public void onIceCandidate(RTCIceCandidate candidate) {
            observer.onIceCandidate(new IceCandidate(candidate.sdp, candidate.sdpMid, candidate.sdpMLineIndex));
        }

        @Override
        public void onConnectionChange(RTCPeerConnectionState state) {
            connectionState = toConnectionState(state);
            observer.onConnectionStateChange(connectionState);
        }

        @Override
        public void onIceConnectionChange(RTCIceConnectionState state) {
            iceConnectionState = toIceConnectionState(state);
            observer.onIceConnectionStateChange(iceConnectionState);
        }

        @Override
        public void onTrack(RTCRtpTransceiver transceiver) {
            MediaStreamTrack track = transceiver.getReceiver().getTrack();
            if (track instanceof AudioTrack) {
                log.info("Remote audio track received from {}", peerId);
                observer.onRemoteAudio(new WebRtcAudioTrackSource((AudioTrack) track));
            }
        }
    }

    private static ConnectionState toConnectionState(RTCPeerConnectionState state) {
        switch (state) {
            case CONNECTING: return ConnectionState.CONNECTING;
            case CONNECTED: return ConnectionState.CONNECTED;
            case DISCONNECTED: return ConnectionState.DISCONNECTED;
            case FAILED: return ConnectionState.FAILED;
            case CLOSED: return ConnectionState.CLOSED;
            default: return ConnectionState.NEW;
        }
    }

    private static IceConnectionState toIceConnectionState(RTCIceConnectionState state) {
        switch (state) {
            case CHECKING: return IceConnectionState.CHECKING;
            case CONNECTED: return IceConnectionState.CONNECTED;
            case COMPLETED: return IceConnectionState.COMPLETED;
            case FAILED: return IceConnectionState.FAILED;
            case DISCONNECTED: return IceConnectionState.DISCONNECTED;
            case CLOSED: return IceConnectionState.CLOSED;
            default: return IceConnectionState.NEW;
        }
    }
}
