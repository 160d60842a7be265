package common.constant;

// Event names understood by the voice relay
public class SignalingEvents {
    public static final String JOIN_VOICE = "join_voice";
    public static final String LEAVE_VOICE = "leave_voice";
    public static final String REQUEST_VOICE_PARTICIPANTS = "request_voice_participants";
    public static final String VOICE_PARTICIPANTS = "voice_participants";
    public static final String USER_JOINED_VOICE = "user_joined_voice";
    public static final String USER_LEFT_VOICE = "user_left_voice";
    public static final String VOICE_OFFER = "voice_offer";
    public static final String VOICE_ANSWER = "voice_answer";
    public static final String VOICE_ICE_CANDIDATE = "voice_ice_candidate";
    public static final String VOICE_MUTE_CHANGED = "voice_mute_changed";
    public static final String VOICE_HEARTBEAT = "voice_heartbeat";
    public static final String VOICE_CONNECTION_FAILED = "voice_connection_failed";
    public static final String VOICE_RECONNECTION_REQUESTED = "voice_reconnection_requested";
    public static final String ERROR = "error";
}
