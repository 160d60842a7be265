package org.example.voicemesh.network.p2p;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import org.example.voicemesh.config.VoiceMeshSettings;
import org.example.voicemesh.network.rtc.FakeRtcConnection;
import org.example.voicemesh.service.VoiceSessionState;
import org.example.voicemesh.utils.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionRetryMonitorTest {

    private ManualEventLoop loop;
    private PeerConnectionRegistry registry;
    private VoiceSessionState state;
    private HealthMonitor healthMonitor;
    private List<String> initiated;
    private boolean canInitiate;
    private long jitterMs;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        registry = new PeerConnectionRegistry();
        state = new VoiceSessionState(true);
        state.addParticipant("alice", "Alice");
        initiated = new ArrayList<>();
        canInitiate = true;
        jitterMs = 500;
        healthMonitor = new HealthMonitor(loop, VoiceMeshSettings.defaults(), registry, state, peerId -> { });
    }

    private ConnectionRetryMonitor newMonitor(VoiceMeshSettings settings) {
        return new ConnectionRetryMonitor(loop, settings, "alice", registry, state, healthMonitor,
                () -> canInitiate, peerId -> {
                    initiated.add(peerId);
                    register(peerId);
                }, () -> jitterMs);
    }

    private FakeRtcConnection register(String peerId) {
        FakeRtcConnection connection = new FakeRtcConnection(peerId);
        registry.upsert(peerId, new PeerConnectionRecord(peerId, connection, registry.nextGeneration(), loop.now()));
        return connection;
    }

    // ====== Repair ======

    @Test
    void shouldInitiateParticipantMissingOnTwoConsecutiveChecks() {
        // Given
        state.addParticipant("bob", "Bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();

        // When: first sighting at 2s, second at 4s, jittered retry at 4.5s
        loop.advanceBy(4000);

        // Then
        assertThat(initiated).isEmpty();
        assertThat(monitor.hasPendingRetry("bob")).isTrue();

        loop.advanceBy(499);
        assertThat(initiated).isEmpty();
        loop.advanceBy(1);
        assertThat(initiated).containsExactly("bob");
        assertThat(monitor.hasPendingRetry("bob")).isFalse();
    }

    @Test
    void shouldLeaveAloneParticipantThatConnectedMeanwhile() {
        // Given
        state.addParticipant("bob", "Bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();
        loop.advanceBy(2000);

        // When: bob's own offer arrives before the second check
        register("bob");
        loop.advanceBy(10_000);

        // Then
        assertThat(initiated).isEmpty();
    }

    @Test
    void shouldSkipRetryWhenConnectionAppearsDuringJitter() {
        state.addParticipant("bob", "Bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();
        loop.advanceBy(4000);

        register("bob");
        loop.advanceBy(1000);

        assertThat(initiated).isEmpty();
    }

    @Test
    void shouldIgnoreSelfAndConnectedParticipants() {
        state.addParticipant("bob", "Bob");
        register("bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();

        loop.advanceBy(10_000);

        assertThat(initiated).isEmpty();
    }

    // ====== Gating ======

    @Test
    void shouldNotInitiateWhileClientCannotInitiate() {
        // Given
        canInitiate = false;
        state.addParticipant("bob", "Bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();

        // When
        loop.advanceBy(10_000);

        // Then
        assertThat(initiated).isEmpty();

        // When: local audio becomes available
        canInitiate = true;
        loop.advanceBy(4500);

        // Then
        assertThat(initiated).containsExactly("bob");
    }

    @Test
    void shouldLeavePeerWithPendingWatchdogReconnectToHealthMonitor() {
        // Given: a watchdog reconnect that stays pending across several checks
        VoiceMeshSettings slowReconnect = VoiceMeshSettings.builder().reconnectDelayMs(10_000).build();
        healthMonitor = new HealthMonitor(loop, slowReconnect, registry, state, peerId -> { });
        state.addParticipant("bob", "Bob");
        register("bob").setStates(ConnectionState.FAILED, IceConnectionState.FAILED);
        healthMonitor.checkPeer("bob");
        ConnectionRetryMonitor monitor = newMonitor(slowReconnect);
        monitor.start();

        // When
        loop.advanceBy(9000);

        // Then
        assertThat(healthMonitor.hasPendingReconnect("bob")).isTrue();
        assertThat(monitor.hasPendingRetry("bob")).isFalse();
        assertThat(initiated).isEmpty();
    }

    @Test
    void shouldNotRetryPeerTheWatchdogGaveUpOn() {
        // Given
        state.addParticipant("bob", "Bob");
        register("bob");
        for (int failure = 0; failure <= VoiceMeshSettings.defaults().getMaxReconnectAttempts(); failure++) {
            ((FakeRtcConnection) registry.get("bob").getConnection()).setStates(ConnectionState.FAILED, IceConnectionState.FAILED);
            healthMonitor.checkPeer("bob");
            healthMonitor.cancelReconnect("bob");
            if (failure < VoiceMeshSettings.defaults().getMaxReconnectAttempts()) register("bob");
        }
        assertThat(registry.isAbandoned("bob")).isTrue();
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();

        // When
        loop.advanceBy(30_000);

        // Then
        assertThat(initiated).isEmpty();
    }

    @Test
    void shouldNotRetryPeerWhoseAttemptsAreUsedUp() {
        state.addParticipant("bob", "Bob");
        PeerConnectionRecord record = new PeerConnectionRecord("bob", new FakeRtcConnection("bob"), registry.nextGeneration(), 0L);
        registry.upsert("bob", record);
        record.setReconnectAttempts(3);
        registry.removeAndDispose("bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();

        loop.advanceBy(10_000);

        assertThat(initiated).isEmpty();
    }

    @Test
    void shouldWaitForFreeSlotWhenMeshIsFull() {
        // Given
        VoiceMeshSettings smallMesh = VoiceMeshSettings.builder().maxMeshConnections(1).build();
        state.addParticipant("bob", "Bob");
        state.addParticipant("carol", "Carol");
        register("bob");
        ConnectionRetryMonitor monitor = newMonitor(smallMesh);
        monitor.start();

        // When
        loop.advanceBy(10_000);

        // Then
        assertThat(initiated).isEmpty();
        assertThat(state.getConnectionError()).isNull();

        // When: bob leaves
        registry.removeAndDispose("bob");
        state.removeParticipant("bob");
        loop.advanceBy(4500);

        // Then
        assertThat(initiated).containsExactly("carol");
    }

    // ====== Lifecycle ======

    @Test
    void shouldDropPendingRetriesOnStop() {
        state.addParticipant("bob", "Bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();
        loop.advanceBy(4000);

        monitor.stop();
        loop.advanceBy(10_000);

        assertThat(monitor.isRunning()).isFalse();
        assertThat(monitor.hasPendingRetry("bob")).isFalse();
        assertThat(initiated).isEmpty();
    }

    @Test
    void shouldRequireFreshSightingsAfterRestart() {
        // Given
        state.addParticipant("bob", "Bob");
        ConnectionRetryMonitor monitor = newMonitor(VoiceMeshSettings.defaults());
        monitor.start();
        loop.advanceBy(2000);

        // When
        monitor.stop();
        monitor.start();
        loop.advanceBy(2000);

        // Then: one sighting since restart is not enough
        assertThat(monitor.hasPendingRetry("bob")).isFalse();
        loop.advanceBy(2500);
        assertThat(initiated).containsExactly("bob");
    }
}
