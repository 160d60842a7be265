package org.example.voicemesh.network.p2p;

import common.model.PeerConnectionStates;
import common.model.SignalingMessage;
import common.model.VoiceIdentity;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.network.signaling.SignalingAdapter;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports the state of every connection to the relay so peers can corroborate failures from both sides.
 */
@Slf4j
public class HeartbeatPublisher {
    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final VoiceIdentity identity;
    private final PeerConnectionRegistry registry;
    private final SignalingAdapter signaling;

    private ScheduledTask tickTask;

    public HeartbeatPublisher(EventLoop loop, VoiceMeshSettings settings, VoiceIdentity identity,
                              PeerConnectionRegistry registry, SignalingAdapter signaling) {
        this.loop = loop;
        this.settings = settings;
        this.identity = identity;
        this.registry = registry;
        this.signaling = signaling;
    }

    public void start() {
        if (tickTask != null) return;
        tickTask = loop.scheduleAtFixedRate(this::publish, settings.getHeartbeatIntervalMs());
    }

    public void stop() {
        if (tickTask != null) {
            tickTask.cancel();
            tickTask = null;
        }
    }

    public boolean isRunning() {
        return tickTask != null;
    }

    public Map<String, PeerConnectionStates> buildSnapshot() {
        Map<String, PeerConnectionStates> snapshot = new LinkedHashMap<>();
        registry.forEach(record -> snapshot.put(record.getPeerId(), new PeerConnectionStates(
                record.getConnection().getConnectionState(),
                record.getConnection().getIceConnectionState())));
        return snapshot;
    }

    void publish() {
        if (registry.isEmpty()) return;
        Map<String, PeerConnectionStates> snapshot = buildSnapshot();
        if (!signaling.send(SignalingMessage.heartbeat(identity.getRoomId(), identity.getUserId(), snapshot))) {
            log.debug("Heartbeat not delivered");
        }
    }
}
