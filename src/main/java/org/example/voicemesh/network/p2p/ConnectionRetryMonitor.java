package org.example.voicemesh.network.p2p;

import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.service.VoiceSessionState;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Repairs participants that are listed in the session but have no connection, e.g. after a lost offer or a join
 * that hit the mesh limit.
 * <p>
 * Every {@code connectionRetryIntervalMs} the participant list is compared with the registry. A peer has to be
 * missing on two consecutive checks before it is re-initiated, after a random delay of up to
 * {@code connectionRetryJitterMs}. Peers owned by the {@link HealthMonitor} (pending reconnect, attempts used up,
 * given up) are left alone.
 */
@Slf4j
public class ConnectionRetryMonitor {
    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final String selfUserId;
    private final PeerConnectionRegistry registry;
    private final VoiceSessionState state;
    private final HealthMonitor healthMonitor;
    private final BooleanSupplier canInitiate;
    private final Consumer<String> initiator;
    private final LongSupplier jitter;

    private ScheduledTask tickTask;
    private Set<String> missingLastCheck = new HashSet<>();
    private final Map<String, ScheduledTask> pendingRetries = new HashMap<>();

    public ConnectionRetryMonitor(EventLoop loop, VoiceMeshSettings settings, String selfUserId,
                                  PeerConnectionRegistry registry, VoiceSessionState state, HealthMonitor healthMonitor,
                                  BooleanSupplier canInitiate, Consumer<String> initiator) {
        this(loop, settings, selfUserId, registry, state, healthMonitor, canInitiate, initiator,
                () -> ThreadLocalRandom.current().nextLong(settings.getConnectionRetryJitterMs() + 1));
    }

    ConnectionRetryMonitor(EventLoop loop, VoiceMeshSettings settings, String selfUserId,
                           PeerConnectionRegistry registry, VoiceSessionState state, HealthMonitor healthMonitor,
                           BooleanSupplier canInitiate, Consumer<String> initiator, LongSupplier jitter) {
        this.loop = loop;
        this.settings = settings;
        this.selfUserId = selfUserId;
        this.registry = registry;
        this.state = state;
        this.healthMonitor = healthMonitor;
        this.canInitiate = canInitiate;
        this.initiator = initiator;
        this.jitter = jitter;
    }

    public void start() {
        if (tickTask != null) return;
        tickTask = loop.scheduleAtFixedRate(this::checkForMissingConnections, settings.getConnectionRetryIntervalMs());
        log.debug("Connection retry monitoring started (every {}ms)", settings.getConnectionRetryIntervalMs());
    }

    /**
     * Stops the periodic check and drops retries that have not fired yet.
     */
    public void stop() {
        if (tickTask != null) {
            tickTask.cancel();
            tickTask = null;
        }
        pendingRetries.values().forEach(ScheduledTask::cancel);
        pendingRetries.clear();
        missingLastCheck = new HashSet<>();
    }

    public boolean isRunning() {
        return tickTask != null;
    }

    public boolean hasPendingRetry(String peerId) {
        return pendingRetries.containsKey(peerId);
    }

    void checkForMissingConnections() {
        if (!canInitiate.getAsBoolean()) {
            missingLastCheck = new HashSet<>();
            return;
        }

        Set<String> missing = new HashSet<>();
        for (String userId : state.getParticipantIds()) {
            if (!isRepairable(userId)) continue;
            missing.add(userId);
            if (!missingLastCheck.contains(userId) || pendingRetries.containsKey(userId)) continue;
            if (registry.size() >= settings.getMaxMeshConnections()) {
                log.debug("Mesh is full, {} stays unconnected for now", userId);
                continue;
            }
            scheduleRetry(userId);
        }
        missingLastCheck = missing;
    }

    private boolean isRepairable(String userId) {
        return !userId.equals(selfUserId)
                && !registry.contains(userId)
                && !healthMonitor.hasPendingReconnect(userId)
                && !registry.isAbandoned(userId)
                && registry.getReconnectAttempts(userId) < settings.getMaxReconnectAttempts();
    }

    private void scheduleRetry(String peerId) {
        long delayMs = jitter.getAsLong();
        log.info("🔄 No connection to {} yet, retrying in {}ms", peerId, delayMs);
        ScheduledTask task = loop.schedule(() -> {
            pendingRetries.remove(peerId);
            if (!canInitiate.getAsBoolean() || !state.hasParticipant(peerId) || !isRepairable(peerId)) {
                return;
            }
            initiator.accept(peerId);
        }, delayMs);
        pendingRetries.put(peerId, task);
    }
}
