package org.example.voicemesh.config;

import common.constant.VoiceConfig;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable runtime settings for one voice session.
 */
@Value
@Builder(toBuilder = true)
public class VoiceMeshSettings {
    @Builder.Default
    String relayUrl = VoiceConfig.DEFAULT_RELAY_URL;
    @Builder.Default
    long relayReconnectDelayMs = VoiceConfig.RELAY_RECONNECT_DELAY_MS;

    @Builder.Default
    long healthCheckIntervalMs = VoiceConfig.HEALTH_CHECK_INTERVAL_MS;
    @Builder.Default
    int maxReconnectAttempts = VoiceConfig.MAX_RECONNECT_ATTEMPTS;
    @Builder.Default
    long reconnectDelayMs = VoiceConfig.RECONNECT_DELAY_MS;
    @Builder.Default
    long connectionRetryIntervalMs = VoiceConfig.CONNECTION_RETRY_INTERVAL_MS;
    @Builder.Default
    long connectionRetryJitterMs = VoiceConfig.CONNECTION_RETRY_JITTER_MS;
    @Builder.Default
    long heartbeatIntervalMs = VoiceConfig.HEARTBEAT_INTERVAL_MS;
    @Builder.Default
    long gracePeriodMs = VoiceConfig.GRACE_PERIOD_MS;

    @Builder.Default
    long audioSampleIntervalMs = VoiceConfig.AUDIO_SAMPLE_INTERVAL_MS;
    @Builder.Default
    long mutePollIntervalMs = VoiceConfig.MUTE_POLL_INTERVAL_MS;
    @Builder.Default
    double silenceThreshold = VoiceConfig.SILENCE_THRESHOLD;

    @Builder.Default
    int maxMeshConnections = VoiceConfig.MAX_MESH_CONNECTIONS;
    @Builder.Default
    List<String> iceServers = VoiceConfig.DEFAULT_ICE_SERVERS;

    public static VoiceMeshSettings defaults() {
        return VoiceMeshSettings.builder().build();
    }
}
