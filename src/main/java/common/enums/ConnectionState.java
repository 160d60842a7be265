package common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Overall state of a peer connection, as reported by the connection primitive.
 */
@Getter
@AllArgsConstructor
public enum ConnectionState {
    NEW("new"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    FAILED("failed"),
    CLOSED("closed");

    private final String wireName;

    public boolean isHealthy() {
        return this == CONNECTED;
    }

    public boolean isProblem() {
        return this == FAILED || this == DISCONNECTED;
    }

    public static ConnectionState fromWireName(String wireName) {
        for (ConnectionState state : values()) {
            if (state.wireName.equals(wireName)) return state;
        }
        throw new IllegalArgumentException("Unknown connection state: " + wireName);
    }
}
