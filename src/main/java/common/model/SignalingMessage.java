package common.model;

import common.constant.SignalingEvents;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A typed message exchanged with the voice relay. Only the fields relevant to {@link #event} are set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalingMessage implements Serializable {
    private static final long serialVersionUID = 1L;

    private String event;

    private String roomId;
    private String userId;
    private String username;
    private String fromUserId;
    private String targetUserId;

    // voice_offer / voice_answer
    private SessionDescription description;
    // voice_ice_candidate
    private IceCandidate candidate;
    // voice_mute_changed
    private Boolean muted;
    // voice_participants
    private List<ParticipantInfo> participants;
    // voice_heartbeat
    private Map<String, PeerConnectionStates> connectionStates;

    // error
    private String errorMessage;
    private Integer retryAfter;
    private String errorDetails;

    public static SignalingMessage joinVoice(String roomId, String userId, String username) {
        return SignalingMessage.builder()
                .event(SignalingEvents.JOIN_VOICE)
                .roomId(roomId)
                .userId(userId)
                .username(username)
                .build();
    }

    public static SignalingMessage leaveVoice(String roomId, String userId) {
        return SignalingMessage.builder()
                .event(SignalingEvents.LEAVE_VOICE)
                .roomId(roomId)
                .userId(userId)
                .build();
    }

    public static SignalingMessage requestParticipants(String roomId) {
        return SignalingMessage.builder()
                .event(SignalingEvents.REQUEST_VOICE_PARTICIPANTS)
                .roomId(roomId)
                .build();
    }

    public static SignalingMessage offer(String roomId, String fromUserId, String targetUserId, SessionDescription offer) {
        return SignalingMessage.builder()
                .event(SignalingEvents.VOICE_OFFER)
                .roomId(roomId)
                .fromUserId(fromUserId)
                .targetUserId(targetUserId)
                .description(offer)
                .build();
    }

    public static SignalingMessage answer(String roomId, String fromUserId, String targetUserId, SessionDescription answer) {
        return SignalingMessage.builder()
                .event(SignalingEvents.VOICE_ANSWER)
                .roomId(roomId)
                .fromUserId(fromUserId)
                .targetUserId(targetUserId)
                .description(answer)
                .build();
    }

    public static SignalingMessage iceCandidate(String roomId, String fromUserId, String targetUserId, IceCandidate candidate) {
        return SignalingMessage.builder()
                .event(SignalingEvents.VOICE_ICE_CANDIDATE)
                .roomId(roomId)
                .fromUserId(fromUserId)
                .targetUserId(targetUserId)
                .candidate(candidate)
                .build();
    }

    public static SignalingMessage muteChanged(String roomId, String userId, boolean muted) {
        return SignalingMessage.builder()
                .event(SignalingEvents.VOICE_MUTE_CHANGED)
                .roomId(roomId)
                .userId(userId)
                .muted(muted)
                .build();
    }

    public static SignalingMessage heartbeat(String roomId, String userId, Map<String, PeerConnectionStates> states) {
        return SignalingMessage.builder()
                .event(SignalingEvents.VOICE_HEARTBEAT)
                .roomId(roomId)
                .userId(userId)
                .connectionStates(states)
                .build();
    }

    public boolean isAddressedTo(String candidateUserId) {
        return targetUserId == null || targetUserId.equals(candidateUserId);
    }
}
