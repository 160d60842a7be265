package common.enums;

/**
 * Connectivity of the signaling relay, as tracked by the grace-period controller.
 */
public enum TransportState {
    TRANSPORT_UP,
    TRANSPORT_DOWN_GRACE,
    TORN_DOWN
}
