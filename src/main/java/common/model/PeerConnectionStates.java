package common.model;

import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * One entry of the heartbeat health snapshot.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PeerConnectionStates implements Serializable {
    private static final long serialVersionUID = 1L;

    private ConnectionState connectionState;
    private IceConnectionState iceConnectionState;
}
