package org.example.voicemesh.config;

import common.constant.VoiceConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Loads {@link VoiceMeshSettings} from voicemesh.properties.
 * Priority: system properties > environment variables > external file > classpath > defaults.
 */
@Slf4j
public class VoiceMeshConfig {
    public static final String RESOURCE_NAME = "voicemesh.properties";
    private static final String SYSTEM_PROPERTY_PREFIX = "voicemesh.";

    private static final Map<String, String> ENV_OVERRIDES = Map.of(
            "VOICEMESH_RELAY_URL", "relay.url",
            "VOICEMESH_ICE_SERVERS", "ice.servers"
    );

    private final Properties properties;

    public VoiceMeshConfig(Properties properties) {
        this.properties = properties;
    }

    public static VoiceMeshConfig load() {
        Properties properties = new Properties();

        try (InputStream resourceStream = VoiceMeshConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (resourceStream != null) {
                properties.load(resourceStream);
                log.info("Loaded configuration from classpath {}", RESOURCE_NAME);
            }
        } catch (IOException e) {
            log.warn("Could not load {} from classpath: {}", RESOURCE_NAME, e.getMessage());
        }

        Path[] configPaths = {
                Paths.get(RESOURCE_NAME),
                Paths.get(System.getProperty("user.home"), ".voicemesh", RESOURCE_NAME)
        };
        for (Path configPath : configPaths) {
            if (Files.exists(configPath)) {
                try (InputStream fileStream = Files.newInputStream(configPath)) {
                    properties.load(fileStream);
                    log.info("Loaded configuration from {}", configPath.toAbsolutePath());
                    break;
                } catch (IOException e) {
                    log.warn("Could not load config from {}: {}", configPath, e.getMessage());
                }
            }
        }

        applyOverrides(properties, System.getenv(), System.getProperties());
        return new VoiceMeshConfig(properties);
    }

    static void applyOverrides(Properties properties, Map<String, String> env, Properties systemProperties) {
        ENV_OVERRIDES.forEach((envName, key) -> {
            String value = env.get(envName);
            if (value != null && !value.isEmpty()) {
                properties.setProperty(key, value);
                log.info("Overriding {} with environment variable {}", key, envName);
            }
        });

        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                properties.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), systemProperties.getProperty(name));
            }
        }
    }

    public VoiceMeshSettings toSettings() {
        return VoiceMeshSettings.builder()
                .relayUrl(getRelayUrl())
                .relayReconnectDelayMs(getLongProperty("relay.reconnect.delay.ms", VoiceConfig.RELAY_RECONNECT_DELAY_MS))
                .healthCheckIntervalMs(getLongProperty("health.check.interval.ms", VoiceConfig.HEALTH_CHECK_INTERVAL_MS))
                .maxReconnectAttempts(getIntProperty("reconnect.max.attempts", VoiceConfig.MAX_RECONNECT_ATTEMPTS))
                .reconnectDelayMs(getLongProperty("reconnect.delay.ms", VoiceConfig.RECONNECT_DELAY_MS))
                .connectionRetryIntervalMs(getLongProperty("connection.retry.interval.ms", VoiceConfig.CONNECTION_RETRY_INTERVAL_MS))
                .connectionRetryJitterMs(getLongProperty("connection.retry.jitter.ms", VoiceConfig.CONNECTION_RETRY_JITTER_MS))
                .heartbeatIntervalMs(getLongProperty("heartbeat.interval.ms", VoiceConfig.HEARTBEAT_INTERVAL_MS))
                .gracePeriodMs(getLongProperty("grace.period.ms", VoiceConfig.GRACE_PERIOD_MS))
                .audioSampleIntervalMs(getLongProperty("audio.sample.interval.ms", VoiceConfig.AUDIO_SAMPLE_INTERVAL_MS))
                .mutePollIntervalMs(getLongProperty("mute.poll.interval.ms", VoiceConfig.MUTE_POLL_INTERVAL_MS))
                .silenceThreshold(getDoubleProperty("silence.threshold", VoiceConfig.SILENCE_THRESHOLD))
                .maxMeshConnections(getIntProperty("mesh.max.connections", VoiceConfig.MAX_MESH_CONNECTIONS))
                .iceServers(getIceServers())
                .build();
    }

    public String getRelayUrl() {
        String url = properties.getProperty("relay.url", VoiceConfig.DEFAULT_RELAY_URL).trim();
        if (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public List<String> getIceServers() {
        String value = properties.getProperty("ice.servers");
        if (value == null || value.isBlank()) {
            return VoiceConfig.DEFAULT_ICE_SERVERS;
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid decimal value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }
}
