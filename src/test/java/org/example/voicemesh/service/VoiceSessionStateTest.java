package org.example.voicemesh.service;

import common.model.VoiceSessionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class VoiceSessionStateTest {

    private VoiceSessionState state;
    private List<VoiceSessionSnapshot> snapshots;

    @BeforeEach
    void setUp() {
        state = new VoiceSessionState(true);
        snapshots = new ArrayList<>();
        state.addListener(snapshots::add);
    }

    @Test
    void shouldNotifyOnlyOnEffectiveChanges() {
        state.addParticipant("bob", "Bob");
        state.addParticipant("bob", "Bob");
        state.setParticipantMuted("bob", false);
        state.setConnectionError(null);
        state.setCanTransmit(true);

        assertThat(snapshots).hasSize(1);
    }

    @Test
    void shouldFillPlaceholderUsername() {
        state.addParticipant("bob", "");
        state.addParticipant("bob", null);
        state.addParticipant("bob", "Bob");

        assertThat(state.getParticipant("bob").orElseThrow().getUsername()).isEqualTo("Bob");
        assertThat(snapshots).hasSize(2);
    }

    @Test
    void shouldApplyReadingsOnlyForKnownParticipants() {
        state.addParticipant("bob", "Bob");
        snapshots.clear();

        state.applyAudioReadings(Map.of(
                "bob", new VoiceSessionState.AudioReading(0.4, false),
                "ghost", new VoiceSessionState.AudioReading(0.9, false)));

        assertThat(state.getParticipantIds()).containsExactly("bob");
        assertThat(state.getParticipant("bob").orElseThrow().getAudioLevel()).isEqualTo(0.4);
        assertThat(snapshots).hasSize(1);
    }

    @Test
    void shouldStoreTinyLevelChangesWithoutNotifying() {
        // Given
        state.addParticipant("bob", "Bob");
        state.applyAudioReadings(Map.of("bob", new VoiceSessionState.AudioReading(0.5, false)));
        snapshots.clear();

        // When: drifts by less than the notify step, twice
        state.applyAudioReadings(Map.of("bob", new VoiceSessionState.AudioReading(0.5004, false)));
        state.applyAudioReadings(Map.of("bob", new VoiceSessionState.AudioReading(0.5008, false)));

        // Then
        assertThat(snapshots).isEmpty();
        assertThat(state.getParticipant("bob").orElseThrow().getAudioLevel()).isEqualTo(0.5008);

        // When: accumulated drift since the last push crosses the step
        state.applyAudioReadings(Map.of("bob", new VoiceSessionState.AudioReading(0.5012, false)));

        // Then
        assertThat(snapshots).hasSize(1);
        assertThat(snapshots.get(0).getParticipants().get(0).getAudioLevel()).isEqualTo(0.5012);
    }

    @Test
    void shouldNotifyMuteFlipEvenWithoutLevelChange() {
        state.addParticipant("bob", "Bob");
        snapshots.clear();

        state.applyAudioReadings(Map.of("bob", new VoiceSessionState.AudioReading(0.0, true)));

        assertThat(snapshots).hasSize(1);
    }

    @Test
    void shouldReportConnectingWhileAnyNegotiationIsPending() {
        state.beginNegotiation();
        state.beginNegotiation();
        state.endNegotiation();
        assertThat(state.isConnecting()).isTrue();

        state.endNegotiation();
        state.endNegotiation();
        assertThat(state.isConnecting()).isFalse();
    }

    @Test
    void shouldHandOutCopies() {
        state.addParticipant("bob", "Bob");

        state.getParticipants().get(0).setMuted(true);

        assertThat(state.getParticipant("bob").orElseThrow().isMuted()).isFalse();
    }

    @Test
    void shouldKeepCapabilityOnReset() {
        state.setCanTransmit(false);
        state.addParticipant("bob", "Bob");
        state.setAudioEnabled(true);
        state.setHasLocalStream(true);
        state.setConnectionError("oops");

        state.reset();

        VoiceSessionSnapshot snapshot = state.snapshot();
        assertThat(snapshot.getParticipants()).isEmpty();
        assertThat(snapshot.getConnectionError()).isNull();
        assertThat(snapshot.isAudioEnabled()).isFalse();
        assertThat(snapshot.hasLocalStream()).isFalse();
        assertThat(snapshot.isCanTransmit()).isFalse();
        assertThat(state.getLocalSessionState().isAudioReceptionEnabled()).isFalse();
    }

    @Test
    void shouldSurviveFailingListener() {
        state.addListener(snapshot -> {
            throw new IllegalStateException("listener bug");
        });

        assertThatCode(() -> state.addParticipant("bob", "Bob")).doesNotThrowAnyException();
        assertThat(snapshots).hasSize(1);
    }
}
