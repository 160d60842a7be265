package org.example.voicemesh.network.rtc;

import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceServer;
import dev.onvoid.webrtc.media.MediaDevices;
import dev.onvoid.webrtc.media.audio.AudioDevice;
import dev.onvoid.webrtc.media.audio.AudioDeviceModule;
import dev.onvoid.webrtc.media.audio.AudioOptions;
import dev.onvoid.webrtc.media.audio.AudioTrack;
import dev.onvoid.webrtc.media.audio.AudioTrackSource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link RtcConnectionFactory} backed by the native WebRTC library. Loads native code on {@link #initialize()}.
 */
@Slf4j
public class WebRtcConnectionFactory implements RtcConnectionFactory {
    private final List<String> iceServerUrls;

    private AudioDeviceModule audioDeviceModule;
    private PeerConnectionFactory factory;
    private boolean recordingStarted = false;

    public WebRtcConnectionFactory(List<String> iceServerUrls) {
        this.iceServerUrls = List.copyOf(iceServerUrls);
    }

    public synchronized void initialize() {
        if (factory != null) return;

        AudioDevice defaultMic = MediaDevices.getDefaultAudioCaptureDevice();
        AudioDevice defaultSpeaker = MediaDevices.getDefaultAudioRenderDevice();

        audioDeviceModule = new AudioDeviceModule();
        if (defaultMic != null) {
            log.info("Default microphone: {}", defaultMic.getName());
            audioDeviceModule.setRecordingDevice(defaultMic);
            audioDeviceModule.initRecording();
        }
        if (defaultSpeaker != null) {
            log.info("Default speaker: {}", defaultSpeaker.getName());
            audioDeviceModule.setPlayoutDevice(defaultSpeaker);
            audioDeviceModule.initPlayout();
        }

        factory = new PeerConnectionFactory(audioDeviceModule);
        log.info("✅ WebRTC initialized with {} ICE server(s)", iceServerUrls.size());
    }

    /**
     * Creates the microphone track for this client and starts capture.
     */
    public synchronized WebRtcLocalAudioStream createLocalAudioStream() {
        initialize();

        AudioOptions audioOptions = new AudioOptions();
        audioOptions.echoCancellation = true;
        audioOptions.autoGainControl = true;
        audioOptions.noiseSuppression = true;

        AudioTrackSource audioSource = factory.createAudioSource(audioOptions);
        AudioTrack audioTrack = factory.createAudioTrack("audio0", audioSource);

        if (!recordingStarted) {
            audioDeviceModule.startRecording();
            recordingStarted = true;
        }
        return new WebRtcLocalAudioStream(audioTrack);
    }

    @Override
    public synchronized RtcConnection create(String peerId, RtcConnectionObserver observer) {
        initialize();

        RTCIceServer iceServer = new RTCIceServer();
        iceServer.urls.addAll(iceServerUrls);

        RTCConfiguration config = new RTCConfiguration();
        config.iceServers.add(iceServer);

        return new WebRtcConnection(peerId, factory, config, observer);
    }

    public synchronized void dispose() {
        if (audioDeviceModule != null) {
            try {
                if (recordingStarted) audioDeviceModule.stopRecording();
            } catch (Exception e) {
                log.warn("Error stopping recording", e);
            }
        }
        if (factory != null) {
            factory.dispose();
            factory = null;
        }
        if (audioDeviceModule != null) {
            try {
                audioDeviceModule.dispose();
            } catch (Exception e) {
                log.warn("Error disposing AudioDeviceModule", e);
            }
            audioDeviceModule = null;
        }
        recordingStarted = false;
        log.info("WebRTC disposed");
    }
}
