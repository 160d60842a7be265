package common.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Who this client is in which room. Stamped on every outgoing signaling message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VoiceIdentity implements Serializable {
    private static final long serialVersionUID = 1L;

    private String roomId;
    private String userId;
    private String username;
}
