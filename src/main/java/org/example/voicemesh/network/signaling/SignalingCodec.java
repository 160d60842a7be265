package org.example.voicemesh.network.signaling;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import common.constant.SignalingEvents;
import common.enums.ConnectionState;
import common.enums.IceConnectionState;
import common.enums.SdpType;
import common.model.IceCandidate;
import common.model.ParticipantInfo;
import common.model.PeerConnectionStates;
import common.model.SessionDescription;
import common.model.SignalingMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire format of the voice relay: {@code {"event": "<name>", "data": {...}}}.
 */
@Slf4j
public class SignalingCodec {
    private final Gson gson = new Gson();

    public String encode(SignalingMessage message) {
        JsonObject data = new JsonObject();
        putIfPresent(data, "roomId", message.getRoomId());
        putIfPresent(data, "userId", message.getUserId());
        putIfPresent(data, "username", message.getUsername());
        putIfPresent(data, "fromUserId", message.getFromUserId());
        putIfPresent(data, "targetUserId", message.getTargetUserId());

        if (message.getDescription() != null) {
            SessionDescription description = message.getDescription();
            JsonObject sdp = new JsonObject();
            sdp.addProperty("type", description.getType().getWireName());
            sdp.addProperty("sdp", description.getSdp());
            data.add(description.getType().getWireName(), sdp);
        }

        if (message.getCandidate() != null) {
            IceCandidate candidate = message.getCandidate();
            JsonObject ice = new JsonObject();
            ice.addProperty("candidate", candidate.getCandidate());
            ice.addProperty("sdpMid", candidate.getSdpMid());
            ice.addProperty("sdpMLineIndex", candidate.getSdpMLineIndex());
            data.add("candidate", ice);
        }

        if (message.getMuted() != null) {
            data.addProperty("isMuted", message.getMuted());
        }

        if (message.getParticipants() != null) {
            JsonArray participants = new JsonArray();
            for (ParticipantInfo info : message.getParticipants()) {
                JsonObject entry = new JsonObject();
                entry.addProperty("userId", info.getUserId());
                putIfPresent(entry, "username", info.getUsername());
                if (info.getMuted() != null) entry.addProperty("isMuted", info.getMuted());
                participants.add(entry);
            }
            data.add("participants", participants);
        }

        if (message.getConnectionStates() != null) {
            JsonObject states = new JsonObject();
            message.getConnectionStates().forEach((peerId, peerStates) -> {
                JsonObject entry = new JsonObject();
                entry.addProperty("connectionState", peerStates.getConnectionState().getWireName());
                entry.addProperty("iceConnectionState", peerStates.getIceConnectionState().getWireName());
                states.add(peerId, entry);
            });
            data.add("connectionStates", states);
        }

        putIfPresent(data, "message", message.getErrorMessage());
        if (message.getRetryAfter() != null) data.addProperty("retryAfter", message.getRetryAfter());
        putIfPresent(data, "details", message.getErrorDetails());

        JsonObject envelope = new JsonObject();
        envelope.addProperty("event", message.getEvent());
        envelope.add("data", data);
        return gson.toJson(envelope);
    }

    /**
     * @return the decoded message, or null if the frame is malformed or lacks an event name
     */
    public SignalingMessage decode(String json) {
        try {
            if (json == null || json.trim().isEmpty()) {
                log.warn("Empty signaling frame");
                return null;
            }

            JsonObject envelope = JsonParser.parseString(json).getAsJsonObject();
            String event = optString(envelope, "event", null);
            if (event == null) {
                log.warn("Signaling frame without event name: {}", json);
                return null;
            }
            JsonObject data = envelope.has("data") && envelope.get("data").isJsonObject()
                    ? envelope.getAsJsonObject("data")
                    : new JsonObject();

            SignalingMessage.SignalingMessageBuilder builder = SignalingMessage.builder()
                    .event(event)
                    .roomId(optString(data, "roomId", null))
                    .userId(optString(data, "userId", null))
                    .username(optString(data, "username", null))
                    .fromUserId(optString(data, "fromUserId", null))
                    .targetUserId(optString(data, "targetUserId", null))
                    .muted(optBoolean(data, "isMuted"))
                    .errorMessage(optString(data, "message", null))
                    .retryAfter(optInteger(data, "retryAfter"))
                    .errorDetails(optString(data, "details", null));

            if (SignalingEvents.VOICE_OFFER.equals(event)) {
                builder.description(parseDescription(data, SdpType.OFFER));
            } else if (SignalingEvents.VOICE_ANSWER.equals(event)) {
                builder.description(parseDescription(data, SdpType.ANSWER));
            }

            if (data.has("candidate") && data.get("candidate").isJsonObject()) {
                builder.candidate(parseCandidate(data.getAsJsonObject("candidate")));
            }

            if (data.has("participants") && data.get("participants").isJsonArray()) {
                builder.participants(parseParticipants(data.getAsJsonArray("participants")));
            }

            if (data.has("connectionStates") && data.get("connectionStates").isJsonObject()) {
                builder.connectionStates(parseConnectionStates(data.getAsJsonObject("connectionStates")));
            }

            return builder.build();

        } catch (Exception e) {
            log.warn("Dropping malformed signaling frame: {}", e.getMessage());
            return null;
        }
    }

    private SessionDescription parseDescription(JsonObject data, SdpType expectedType) {
        String key = expectedType.getWireName();
        if (!data.has(key) || !data.get(key).isJsonObject()) {
            throw new IllegalArgumentException("Missing " + key + " description");
        }
        JsonObject sdp = data.getAsJsonObject(key);
        String type = optString(sdp, "type", key);
        String body = optString(sdp, "sdp", null);
        if (body == null) {
            throw new IllegalArgumentException("Missing sdp in " + key);
        }
        return new SessionDescription(SdpType.fromWireName(type), body);
    }

    private IceCandidate parseCandidate(JsonObject ice) {
        String candidate = optString(ice, "candidate", null);
        if (candidate == null) {
            throw new IllegalArgumentException("Missing candidate string");
        }
        Integer index = optInteger(ice, "sdpMLineIndex");
        return new IceCandidate(candidate, optString(ice, "sdpMid", null), index != null ? index : 0);
    }

    private List<ParticipantInfo> parseParticipants(JsonArray array) {
        List<ParticipantInfo> participants = new ArrayList<>();
        array.forEach(element -> {
            if (!element.isJsonObject()) return;
            JsonObject entry = element.getAsJsonObject();
            String userId = optString(entry, "userId", null);
            if (userId == null) return;
            participants.add(new ParticipantInfo(userId, optString(entry, "username", ""), optBoolean(entry, "isMuted")));
        });
        return participants;
    }

    private Map<String, PeerConnectionStates> parseConnectionStates(JsonObject states) {
        Map<String, PeerConnectionStates> result = new LinkedHashMap<>();
        states.entrySet().forEach(entry -> {
            if (!entry.getValue().isJsonObject()) return;
            JsonObject value = entry.getValue().getAsJsonObject();
            result.put(entry.getKey(), new PeerConnectionStates(
                    ConnectionState.fromWireName(optString(value, "connectionState", "new")),
                    IceConnectionState.fromWireName(optString(value, "iceConnectionState", "new"))));
        });
        return result;
    }

    private void putIfPresent(JsonObject obj, String key, String value) {
        if (value != null) obj.addProperty(key, value);
    }

    private String optString(JsonObject obj, String key, String defaultValue) {
        if (!obj.has(key)) return defaultValue;
        JsonElement element = obj.get(key);
        if (element == null || element.isJsonNull()) return defaultValue;
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) return element.getAsString();
        return defaultValue;
    }

    private Boolean optBoolean(JsonObject obj, String key) {
        if (!obj.has(key)) return null;
        JsonElement element = obj.get(key);
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean()) {
            return element.getAsBoolean();
        }
        return null;
    }

    private Integer optInteger(JsonObject obj, String key) {
        if (!obj.has(key)) return null;
        JsonElement element = obj.get(key);
        if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return element.getAsNumber().intValue();
        }
        return null;
    }
}
