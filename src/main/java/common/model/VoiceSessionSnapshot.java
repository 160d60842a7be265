package common.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable view of the voice session handed to observers.
 */
@Value
@Builder
public class VoiceSessionSnapshot {
    @Singular
    List<VoiceParticipant> participants;
    boolean isConnecting;
    String connectionError;
    boolean canTransmit;
    boolean isAudioEnabled;
    boolean hasLocalStream;

    public boolean hasLocalStream() {
        return hasLocalStream;
    }
}
