package org.example.voicemesh;

import common.model.VoiceIdentity;
import common.model.VoiceParticipant;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshConfig;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.network.rtc.WebRtcConnectionFactory;
import org.example.voicemesh.network.rtc.WebRtcLocalAudioStream;
import org.example.voicemesh.network.signaling.WebSocketSignalingAdapter;
import org.example.voicemesh.service.VoiceSessionService;
import org.example.voicemesh.utils.SingleThreadEventLoop;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Command-line voice client: joins a room's voice mesh with the default microphone.
 * <p>
 * Usage: {@code ClientMain <roomId> <userId> <username> [relayUrl]}. Type {@code m} to toggle mute,
 * {@code q} to leave.
 */
@Slf4j
public class ClientMain {

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            System.err.println("Usage: ClientMain <roomId> <userId> <username> [relayUrl]");
            System.exit(2);
        }

        VoiceMeshSettings settings = VoiceMeshConfig.load().toSettings();
        if (args.length > 3) {
            settings = settings.toBuilder().relayUrl(args[3]).build();
        }
        VoiceIdentity identity = new VoiceIdentity(args[0], args[1], args[2]);

        log.info("========================================");
        log.info("   VOICE MESH CLIENT - STARTING UP");
        log.info("   room={} user={} relay={}", identity.getRoomId(), identity.getUserId(), settings.getRelayUrl());
        log.info("========================================");

        WebRtcConnectionFactory connectionFactory = new WebRtcConnectionFactory(settings.getIceServers());
        WebSocketSignalingAdapter signaling = new WebSocketSignalingAdapter(settings.getRelayUrl(), settings.getRelayReconnectDelayMs());
        SingleThreadEventLoop loop = new SingleThreadEventLoop("voice-loop");

        WebRtcLocalAudioStream microphone;
        try {
            connectionFactory.initialize();
            microphone = connectionFactory.createLocalAudioStream();
        } catch (Exception e) {
            log.error("❌ Failed to open audio devices", e);
            connectionFactory.dispose();
            System.exit(1);
            return;
        }

        VoiceSessionService session = new VoiceSessionService(loop, settings, identity, signaling, connectionFactory, true);
        session.getState().addListener(snapshot -> log.info("Participants: {}{}",
                snapshot.getParticipants().stream().map(ClientMain::describe).collect(Collectors.joining(", ")),
                snapshot.getConnectionError() != null ? " | error: " + snapshot.getConnectionError() : ""));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down voice client...");
            session.shutdown();
            signaling.shutdown();
            microphone.release();
            connectionFactory.dispose();
            log.info("Voice client shutdown complete");
        }, "voice-shutdown"));

        session.start();
        session.enableAudioReception();
        session.addLocalStream(microphone);
        log.info("✅ Joined voice in room {}", identity.getRoomId());

        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = console.readLine()) != null) {
            String command = line.trim();
            if ("q".equalsIgnoreCase(command)) {
                break;
            } else if ("m".equalsIgnoreCase(command)) {
                boolean muted = microphone.isAudioTrackEnabled();
                microphone.setMuted(muted);
                log.info(muted ? "🔇 Muted" : "🎙️ Unmuted");
            }
        }
        System.exit(0);
    }

    private static String describe(VoiceParticipant participant) {
        return String.format("%s%s %.2f", participant.getUsername(), participant.isMuted() ? " (muted)" : "", participant.getAudioLevel());
    }
}
