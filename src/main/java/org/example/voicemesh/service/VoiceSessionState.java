package org.example.voicemesh.service;

import common.constant.VoiceConfig;
import common.model.LocalSessionState;
import common.model.VoiceParticipant;
import common.model.VoiceSessionSnapshot;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Externally observable read model of the voice session: participants with mute flags and levels, plus status.
 * <p>
 * Written only from the voice event loop; reads and listener registration are safe from any thread.
 * Listeners receive a fresh {@link VoiceSessionSnapshot} after every effective change.
 */
@Slf4j
public class VoiceSessionState {
    private final Map<String, VoiceParticipant> participants = new LinkedHashMap<>();
    private final List<Consumer<VoiceSessionSnapshot>> listeners = new CopyOnWriteArrayList<>();
    // Levels as of the last snapshot pushed to listeners
    private final Map<String, Double> publishedLevels = new HashMap<>();

    private int pendingNegotiations = 0;
    private String connectionError;
    private boolean canTransmit;
    private boolean audioEnabled = false;
    private boolean hasLocalStream = false;

    public VoiceSessionState(boolean canTransmit) {
        this.canTransmit = canTransmit;
    }

    /**
     * Level and inferred mute flag for one participant, as computed by one sampling tick.
     */
    @Value
    public static class AudioReading {
        double level;
        boolean muted;
    }

    public void addListener(Consumer<VoiceSessionSnapshot> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<VoiceSessionSnapshot> listener) {
        listeners.remove(listener);
    }

    // ===== Participants =====

    /**
     * Adds the participant, or fills in the username of an existing placeholder.
     */
    public void addParticipant(String userId, String username) {
        boolean changed;
        synchronized (this) {
            VoiceParticipant existing = participants.get(userId);
            if (existing == null) {
                participants.put(userId, VoiceParticipant.builder()
                        .userId(userId)
                        .username(username != null ? username : "")
                        .build());
                changed = true;
            } else if (username != null && !username.isEmpty() && !username.equals(existing.getUsername())) {
                existing.setUsername(username);
                changed = true;
            } else {
                changed = false;
            }
        }
        if (changed) notifyListeners();
    }

    public void removeParticipant(String userId) {
        boolean removed;
        synchronized (this) {
            removed = participants.remove(userId) != null;
        }
        if (removed) notifyListeners();
    }

    public void setParticipantMuted(String userId, boolean muted) {
        boolean changed = false;
        synchronized (this) {
            VoiceParticipant participant = participants.get(userId);
            if (participant != null && participant.isMuted() != muted) {
                participant.setMuted(muted);
                changed = true;
            }
        }
        if (changed) notifyListeners();
    }

    /**
     * Applies one sampling tick. Levels are always stored; listeners are notified when a mute flag flipped or a
     * level moved at least {@link VoiceConfig#LEVEL_NOTIFY_EPSILON} away from the last published value.
     */
    public void applyAudioReadings(Map<String, AudioReading> readings) {
        boolean changed = false;
        synchronized (this) {
            for (Map.Entry<String, AudioReading> entry : readings.entrySet()) {
                VoiceParticipant participant = participants.get(entry.getKey());
                if (participant == null) continue;
                AudioReading reading = entry.getValue();
                double published = publishedLevels.getOrDefault(entry.getKey(), participant.getAudioLevel());
                if (participant.isMuted() != reading.isMuted()
                        || Math.abs(published - reading.getLevel()) >= VoiceConfig.LEVEL_NOTIFY_EPSILON) {
                    changed = true;
                }
                participant.setAudioLevel(reading.getLevel());
                participant.setMuted(reading.isMuted());
            }
        }
        if (changed) notifyListeners();
    }

    public void clearParticipants() {
        boolean changed;
        synchronized (this) {
            changed = !participants.isEmpty();
            participants.clear();
        }
        if (changed) notifyListeners();
    }

    public synchronized List<VoiceParticipant> getParticipants() {
        List<VoiceParticipant> copy = new ArrayList<>(participants.size());
        participants.values().forEach(p -> copy.add(p.toBuilder().build()));
        return copy;
    }

    public synchronized Optional<VoiceParticipant> getParticipant(String userId) {
        VoiceParticipant participant = participants.get(userId);
        return participant == null ? Optional.empty() : Optional.of(participant.toBuilder().build());
    }

    public synchronized List<String> getParticipantIds() {
        return new ArrayList<>(participants.keySet());
    }

    public synchronized boolean hasParticipant(String userId) {
        return participants.containsKey(userId);
    }

    // ===== Status =====

    public void beginNegotiation() {
        boolean changed;
        synchronized (this) {
            changed = pendingNegotiations == 0;
            pendingNegotiations++;
        }
        if (changed) notifyListeners();
    }

    public void endNegotiation() {
        boolean changed;
        synchronized (this) {
            if (pendingNegotiations == 0) return;
            pendingNegotiations--;
            changed = pendingNegotiations == 0;
        }
        if (changed) notifyListeners();
    }

    public synchronized boolean isConnecting() {
        return pendingNegotiations > 0;
    }

    public void setConnectionError(String error) {
        synchronized (this) {
            if (error == null ? connectionError == null : error.equals(connectionError)) return;
            connectionError = error;
        }
        if (error != null) {
            log.warn("Voice connection error: {}", error);
        }
        notifyListeners();
    }

    public void clearConnectionError() {
        setConnectionError(null);
    }

    public synchronized String getConnectionError() {
        return connectionError;
    }

    public void setCanTransmit(boolean canTransmit) {
        synchronized (this) {
            if (this.canTransmit == canTransmit) return;
            this.canTransmit = canTransmit;
        }
        notifyListeners();
    }

    public synchronized boolean canTransmit() {
        return canTransmit;
    }

    public void setAudioEnabled(boolean audioEnabled) {
        synchronized (this) {
            if (this.audioEnabled == audioEnabled) return;
            this.audioEnabled = audioEnabled;
        }
        notifyListeners();
    }

    public synchronized boolean isAudioEnabled() {
        return audioEnabled;
    }

    public void setHasLocalStream(boolean hasLocalStream) {
        synchronized (this) {
            if (this.hasLocalStream == hasLocalStream) return;
            this.hasLocalStream = hasLocalStream;
        }
        notifyListeners();
    }

    public synchronized boolean hasLocalStream() {
        return hasLocalStream;
    }

    public synchronized LocalSessionState getLocalSessionState() {
        return LocalSessionState.builder()
                .hasLocalStream(hasLocalStream)
                .canTransmit(canTransmit)
                .isAudioReceptionEnabled(audioEnabled)
                .build();
    }

    /**
     * Back to the state of a session that was never joined. canTransmit is a capability and survives.
     */
    public void reset() {
        synchronized (this) {
            participants.clear();
            pendingNegotiations = 0;
            connectionError = null;
            audioEnabled = false;
            hasLocalStream = false;
        }
        notifyListeners();
    }

    public synchronized VoiceSessionSnapshot snapshot() {
        return VoiceSessionSnapshot.builder()
                .participants(getParticipants())
                .isConnecting(pendingNegotiations > 0)
                .connectionError(connectionError)
                .canTransmit(canTransmit)
                .isAudioEnabled(audioEnabled)
                .hasLocalStream(hasLocalStream)
                .build();
    }

    private void notifyListeners() {
        VoiceSessionSnapshot snapshot;
        synchronized (this) {
            snapshot = snapshot();
            publishedLevels.clear();
            snapshot.getParticipants().forEach(p -> publishedLevels.put(p.getUserId(), p.getAudioLevel()));
        }
        if (listeners.isEmpty()) return;
        for (Consumer<VoiceSessionSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (Exception e) {
                log.warn("Voice state listener failed", e);
            }
        }
    }
}
