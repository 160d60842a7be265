package common.constant;

import java.util.List;

// Default timings and thresholds for the voice mesh; overridable through voicemesh.properties
public class VoiceConfig {
    // Health watchdog
    public static final long HEALTH_CHECK_INTERVAL_MS = 15_000;
    public static final int MAX_RECONNECT_ATTEMPTS = 3;
    public static final long RECONNECT_DELAY_MS = 2_000;

    // Repair of listed participants that never got a connection
    public static final long CONNECTION_RETRY_INTERVAL_MS = 2_000;
    public static final long CONNECTION_RETRY_JITTER_MS = 1_000;

    // Cross-peer failure detection
    public static final long HEARTBEAT_INTERVAL_MS = 30_000;

    // Signaling transport outage tolerance
    public static final long GRACE_PERIOD_MS = 60_000;
    public static final long RELAY_RECONNECT_DELAY_MS = 2_000;

    // Audio sampling
    public static final long AUDIO_SAMPLE_INTERVAL_MS = 200;
    public static final long MUTE_POLL_INTERVAL_MS = 200;
    public static final double SILENCE_THRESHOLD = 0.02;
    public static final double LEVEL_HEADROOM = 1.5;
    public static final double SMOOTHING_PREVIOUS_WEIGHT = 0.7;
    public static final double SMOOTHING_INSTANT_WEIGHT = 0.3;
    public static final double LEVEL_NOTIFY_EPSILON = 0.001;
    public static final int ANALYSER_WINDOW_SAMPLES = 2048;

    // 9 remote peers = 10 users in the mesh
    public static final int MAX_MESH_CONNECTIONS = 9;

    public static final String DEFAULT_RELAY_URL = "ws://localhost:3001/voice";
    public static final List<String> DEFAULT_ICE_SERVERS = List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302"
    );
}
