package org.example.voicemesh.media;

import common.constant.VoiceConfig;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.network.p2p.PeerConnectionRecord;
import org.example.voicemesh.network.p2p.PeerConnectionRegistry;
import org.example.voicemesh.service.VoiceSessionState;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Samples every participant's audio on a fixed period and publishes smoothed levels and mute flags.
 * <p>
 * Mute precedence: self follows the local track's enabled flag; a remote participant follows its last explicit
 * mute message, or the silence heuristic if it never sent one.
 */
@Slf4j
public class AudioLevelMonitor {
    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final String selfUserId;
    private final PeerConnectionRegistry registry;
    private final VoiceSessionState state;

    private final Map<String, Double> smoothedLevels = new HashMap<>();
    private final Map<String, Boolean> explicitMutes = new HashMap<>();

    private LocalAudioStream localStream;
    private LevelAnalyser localAnalyser;
    private ScheduledTask sampleTask;

    public AudioLevelMonitor(EventLoop loop, VoiceMeshSettings settings, String selfUserId,
                             PeerConnectionRegistry registry, VoiceSessionState state) {
        this.loop = loop;
        this.settings = settings;
        this.selfUserId = selfUserId;
        this.registry = registry;
        this.state = state;
    }

    /**
     * Instantaneous level from an RMS value, with headroom scaling and clipped to [0,1].
     */
    public static double instantLevel(double rms) {
        return Math.min(1.0, rms * VoiceConfig.LEVEL_HEADROOM);
    }

    public static double smooth(double previous, double instant) {
        return VoiceConfig.SMOOTHING_PREVIOUS_WEIGHT * previous + VoiceConfig.SMOOTHING_INSTANT_WEIGHT * instant;
    }

    public void start() {
        if (sampleTask != null) return;
        sampleTask = loop.scheduleAtFixedRate(this::sample, settings.getAudioSampleIntervalMs());
    }

    public void stop() {
        if (sampleTask != null) {
            sampleTask.cancel();
            sampleTask = null;
        }
    }

    public boolean isRunning() {
        return sampleTask != null;
    }

    public void setLocalSource(LocalAudioStream stream, LevelAnalyser analyser) {
        this.localStream = stream;
        this.localAnalyser = analyser;
    }

    public void clearLocalSource() {
        this.localStream = null;
        this.localAnalyser = null;
        smoothedLevels.remove(selfUserId);
    }

    public void recordExplicitMute(String userId, boolean muted) {
        explicitMutes.put(userId, muted);
    }

    public Boolean getExplicitMute(String userId) {
        return explicitMutes.get(userId);
    }

    public void forget(String userId) {
        explicitMutes.remove(userId);
        smoothedLevels.remove(userId);
    }

    public void clearRemoteState() {
        explicitMutes.clear();
        smoothedLevels.keySet().removeIf(userId -> !userId.equals(selfUserId));
    }

    void sample() {
        Map<String, VoiceSessionState.AudioReading> readings = new LinkedHashMap<>();
        for (String userId : state.getParticipantIds()) {
            if (userId.equals(selfUserId)) {
                readings.put(userId, sampleSelf());
            } else {
                readings.put(userId, sampleRemote(userId));
            }
        }
        state.applyAudioReadings(readings);
    }

    private VoiceSessionState.AudioReading sampleSelf() {
        boolean enabled = localStream != null && localStream.isAudioTrackEnabled();
        double rms = enabled && localAnalyser != null ? localAnalyser.readRms() : 0.0;
        double level = updateSmoothed(selfUserId, instantLevel(rms));
        return new VoiceSessionState.AudioReading(level, !enabled);
    }

    private VoiceSessionState.AudioReading sampleRemote(String userId) {
        PeerConnectionRecord record = registry.get(userId);
        LevelAnalyser analyser = record != null ? record.getRemoteAudioSink() : null;
        double rms = analyser != null ? analyser.readRms() : 0.0;
        double level = updateSmoothed(userId, instantLevel(rms));

        Boolean explicit = explicitMutes.get(userId);
        boolean muted = explicit != null ? explicit : level < settings.getSilenceThreshold();
        return new VoiceSessionState.AudioReading(level, muted);
    }

    private double updateSmoothed(String userId, double instant) {
        double smoothed = smooth(smoothedLevels.getOrDefault(userId, 0.0), instant);
        smoothedLevels.put(userId, smoothed);
        return smoothed;
    }
}
