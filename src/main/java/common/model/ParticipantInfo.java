package common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

// Entry of the relay's voice_participants list
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParticipantInfo implements Serializable {
    private static final long serialVersionUID = 1L;

    private String userId;
    private String username;
    private Boolean muted;
}
