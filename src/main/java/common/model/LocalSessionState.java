package common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocalSessionState {
    @Builder.Default
    private boolean hasLocalStream = false;

    // Listen-only participants never attach outbound tracks
    @Builder.Default
    private boolean canTransmit = true;

    @Builder.Default
    private boolean isAudioReceptionEnabled = false;

    public boolean hasLocalStream() {
        return hasLocalStream;
    }
}
