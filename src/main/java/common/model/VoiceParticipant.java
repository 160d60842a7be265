package common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Projection of a voice participant for display: derived from the connection registry and mute signals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class VoiceParticipant implements Serializable {
    private static final long serialVersionUID = 1L;

    private String userId;
    private String username;

    @Builder.Default
    private boolean isMuted = false;

    // Smoothed speaking level in [0,1]
    @Builder.Default
    private double audioLevel = 0.0;
}
