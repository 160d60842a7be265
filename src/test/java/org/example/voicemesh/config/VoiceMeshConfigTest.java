package org.example.voicemesh.config;

import common.constant.VoiceConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceMeshConfigTest {

    @Test
    void shouldFallBackToDefaultsWhenNothingConfigured() {
        VoiceMeshSettings settings = new VoiceMeshConfig(new Properties()).toSettings();

        assertThat(settings).isEqualTo(VoiceMeshSettings.defaults());
        assertThat(settings.getHealthCheckIntervalMs()).isEqualTo(15_000);
        assertThat(settings.getMaxReconnectAttempts()).isEqualTo(3);
        assertThat(settings.getGracePeriodMs()).isEqualTo(60_000);
        assertThat(settings.getIceServers()).isEqualTo(VoiceConfig.DEFAULT_ICE_SERVERS);
    }

    @Test
    void shouldReadConfiguredValues() {
        Properties properties = new Properties();
        properties.setProperty("relay.url", " wss://relay.example.org/voice/ ");
        properties.setProperty("reconnect.max.attempts", "5");
        properties.setProperty("grace.period.ms", "30000");
        properties.setProperty("connection.retry.interval.ms", "5000");
        properties.setProperty("connection.retry.jitter.ms", "0");
        properties.setProperty("silence.threshold", "0.05");
        properties.setProperty("ice.servers", "stun:a.example.org:3478, ,stun:b.example.org:3478");

        VoiceMeshSettings settings = new VoiceMeshConfig(properties).toSettings();

        assertThat(settings.getRelayUrl()).isEqualTo("wss://relay.example.org/voice");
        assertThat(settings.getMaxReconnectAttempts()).isEqualTo(5);
        assertThat(settings.getGracePeriodMs()).isEqualTo(30_000);
        assertThat(settings.getConnectionRetryIntervalMs()).isEqualTo(5000);
        assertThat(settings.getConnectionRetryJitterMs()).isZero();
        assertThat(settings.getSilenceThreshold()).isEqualTo(0.05);
        assertThat(settings.getIceServers()).containsExactly("stun:a.example.org:3478", "stun:b.example.org:3478");
    }

    @Test
    void shouldIgnoreInvalidNumbers() {
        Properties properties = new Properties();
        properties.setProperty("health.check.interval.ms", "soon");
        properties.setProperty("mesh.max.connections", "ten");
        properties.setProperty("silence.threshold", "quiet");

        VoiceMeshSettings settings = new VoiceMeshConfig(properties).toSettings();

        assertThat(settings.getHealthCheckIntervalMs()).isEqualTo(VoiceConfig.HEALTH_CHECK_INTERVAL_MS);
        assertThat(settings.getMaxMeshConnections()).isEqualTo(VoiceConfig.MAX_MESH_CONNECTIONS);
        assertThat(settings.getSilenceThreshold()).isEqualTo(VoiceConfig.SILENCE_THRESHOLD);
    }

    @Test
    void shouldLetSystemPropertiesOverrideEnvironment() {
        // Given
        Properties properties = new Properties();
        properties.setProperty("relay.url", "ws://from-file/voice");
        properties.setProperty("heartbeat.interval.ms", "30000");
        Properties systemProperties = new Properties();
        systemProperties.setProperty("voicemesh.relay.url", "ws://from-sysprop/voice");
        systemProperties.setProperty("voicemesh.heartbeat.interval.ms", "10000");
        systemProperties.setProperty("user.home", "/home/alice");

        // When
        VoiceMeshConfig.applyOverrides(properties,
                Map.of("VOICEMESH_RELAY_URL", "ws://from-env/voice", "VOICEMESH_ICE_SERVERS", "stun:env.example.org"),
                systemProperties);
        VoiceMeshSettings settings = new VoiceMeshConfig(properties).toSettings();

        // Then
        assertThat(settings.getRelayUrl()).isEqualTo("ws://from-sysprop/voice");
        assertThat(settings.getHeartbeatIntervalMs()).isEqualTo(10_000);
        assertThat(settings.getIceServers()).isEqualTo(List.of("stun:env.example.org"));
        assertThat(properties.getProperty("home")).isNull();
    }

    @Test
    void shouldLoadBundledProperties() {
        VoiceMeshSettings settings = VoiceMeshConfig.load().toSettings();

        assertThat(settings.getReconnectDelayMs()).isEqualTo(VoiceConfig.RECONNECT_DELAY_MS);
        assertThat(settings.getMutePollIntervalMs()).isEqualTo(VoiceConfig.MUTE_POLL_INTERVAL_MS);
    }
}
