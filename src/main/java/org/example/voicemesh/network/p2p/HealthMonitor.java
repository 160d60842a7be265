package org.example.voicemesh.network.p2p;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import lombok.extern.slf4j.Slf4j;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.service.VoiceSessionState;
import org.example.voicemesh.utils.EventLoop;
import org.example.voicemesh.utils.ScheduledTask;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Watchdog over every registered connection. Runs every {@code healthCheckIntervalMs} and also on demand.
 * <p>
 * A connection that is failed or disconnected is torn down and re-initiated after {@code reconnectDelayMs},
 * up to {@code maxReconnectAttempts} consecutive times per peer; the next failure disposes it for good.
 */
@Slf4j
public class HealthMonitor implements ConnectionLifecycleManager.PeerStateListener {
    private final EventLoop loop;
    private final VoiceMeshSettings settings;
    private final PeerConnectionRegistry registry;
    private final VoiceSessionState state;
    private final Consumer<String> reconnector;

    private ScheduledTask tickTask;
    // Identity token per peer; a delayed reconnect only runs if its token is still the current one
    private final Map<String, Object> pendingReconnects = new HashMap<>();
    private final Map<String, ScheduledTask> pendingReconnectTasks = new HashMap<>();

    public HealthMonitor(EventLoop loop, VoiceMeshSettings settings, PeerConnectionRegistry registry,
                         VoiceSessionState state, Consumer<String> reconnector) {
        this.loop = loop;
        this.settings = settings;
        this.registry = registry;
        this.state = state;
        this.reconnector = reconnector;
    }

    public void start() {
        if (tickTask != null) return;
        tickTask = loop.scheduleAtFixedRate(this::runHealthCheck, settings.getHealthCheckIntervalMs());
        log.info("Health monitoring started (every {}ms)", settings.getHealthCheckIntervalMs());
    }

    /**
     * Stops the periodic check and cancels pending reconnects.
     */
    public void stop() {
        if (tickTask != null) {
            tickTask.cancel();
            tickTask = null;
            log.info("Health monitoring stopped");
        }
        pendingReconnectTasks.values().forEach(ScheduledTask::cancel);
        pendingReconnectTasks.clear();
        pendingReconnects.clear();
    }

    public boolean isRunning() {
        return tickTask != null;
    }

    public boolean hasPendingReconnect(String peerId) {
        return pendingReconnects.containsKey(peerId);
    }

    public void cancelReconnect(String peerId) {
        pendingReconnects.remove(peerId);
        ScheduledTask task = pendingReconnectTasks.remove(peerId);
        if (task != null) task.cancel();
    }

    void runHealthCheck() {
        if (registry.isEmpty()) return;
        log.debug("Health check over {} connection(s)", registry.size());
        registry.forEach(this::checkRecord);
    }

    /**
     * Immediate check of one peer, e.g. after the relay reported a failure.
     */
    public void checkPeer(String peerId) {
        PeerConnectionRecord record = registry.get(peerId);
        if (record == null) {
            log.debug("Health check requested for {} but no connection exists", peerId);
            return;
        }
        checkRecord(record);
    }

    @Override
    public void onPeerStateChanged(PeerConnectionRecord record) {
        if (record.isHealthy() && record.getReconnectAttempts() > 0) {
            log.info("✅ Connection to {} recovered", record.getPeerId());
            registry.resetReconnectAttempts(record.getPeerId());
        }
    }

    private void checkRecord(PeerConnectionRecord record) {
        if (!registry.isCurrent(record)) return;

        String peerId = record.getPeerId();
        ConnectionState connectionState = record.getConnection().getConnectionState();
        IceConnectionState iceState = record.getConnection().getIceConnectionState();
        record.setConnectionState(connectionState);
        record.setIceConnectionState(iceState);
        record.setLastHealthCheckAt(loop.now());

        if (connectionState.isHealthy() && iceState.isHealthy()) {
            if (record.getReconnectAttempts() > 0) {
                registry.resetReconnectAttempts(peerId);
            }
            return;
        }

        if (!connectionState.isProblem() && !iceState.isProblem()) {
            return;
        }

        int attempts = record.getReconnectAttempts();
        int maxAttempts = settings.getMaxReconnectAttempts();
        if (attempts < maxAttempts) {
            record.setReconnectAttempts(attempts + 1);
            log.warn("⚠️ Connection to {} is {}/{}, reconnecting (attempt {}/{})",
                    peerId, connectionState.getWireName(), iceState.getWireName(), attempts + 1, maxAttempts);
            registry.removeAndDispose(peerId);
            scheduleReconnect(peerId);
        } else {
            log.error("❌ Connection to {} failed after {} attempts, giving up", peerId, maxAttempts);
            state.setConnectionError("Connection with " + peerId + " failed after " + maxAttempts + " attempts");
            cancelReconnect(peerId);
            registry.removeAndDispose(peerId);
            registry.resetReconnectAttempts(peerId);
            registry.markAbandoned(peerId);
        }
    }

    private void scheduleReconnect(String peerId) {
        cancelReconnect(peerId);
        Object token = new Object();
        pendingReconnects.put(peerId, token);
        ScheduledTask task = loop.schedule(() -> {
            if (pendingReconnects.get(peerId) != token) return;
            pendingReconnects.remove(peerId);
            pendingReconnectTasks.remove(peerId);
            if (registry.contains(peerId)) {
                log.info("Connection to {} was re-established meanwhile, skipping reconnect", peerId);
                return;
            }
            reconnector.accept(peerId);
        }, settings.getReconnectDelayMs());
        pendingReconnectTasks.put(peerId, task);
    }
}
