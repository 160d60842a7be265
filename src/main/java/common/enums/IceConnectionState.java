package common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum IceConnectionState {
    NEW("new"),
    CHECKING("checking"),
    CONNECTED("connected"),
    COMPLETED("completed"),
    FAILED("failed"),
    DISCONNECTED("disconnected"),
    CLOSED("closed");

    private final String wireName;

    public boolean isHealthy() {
        return this == CONNECTED || this == COMPLETED;
    }

    public boolean isProblem() {
        return this == FAILED || this == DISCONNECTED;
    }

    public static IceConnectionState fromWireName(String wireName) {
        for (IceConnectionState state : values()) {
            if (state.wireName.equals(wireName)) return state;
        }
        throw new IllegalArgumentException("Unknown ICE connection state: " + wireName);
    }
}
