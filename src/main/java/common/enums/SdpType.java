package common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum SdpType {
    OFFER("offer"),
    ANSWER("answer");

    private final String wireName;

    public static SdpType fromWireName(String wireName) {
        for (SdpType type : values()) {
            if (type.wireName.equalsIgnoreCase(wireName)) return type;
        }
        throw new IllegalArgumentException("Unknown SDP type: " + wireName);
    }
}
