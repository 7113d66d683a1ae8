package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mensaje servidor -> cliente. Un constructor estático por cada {@link OutboundType}; el payload
 * va siempre en {@code data}. El timestamp lo pasa quien construye el mensaje, desde su Clock.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncMsg {
    private final OutboundType type;
    private final String roomId;
    private final String correlationId;
    private final long timestamp;
    private final Object data;

    private SyncMsg(OutboundType type, String roomId, String correlationId, long timestamp, Object data) {
        this.type = type;
        this.roomId = roomId;
        this.correlationId = correlationId;
        this.timestamp = timestamp;
        this.data = data;
    }

    public static SyncMsg of(long timestamp, OutboundType type, String roomId, Object data) {
        return new SyncMsg(type, roomId, null, timestamp, data);
    }

    // ==================== MIEMBROS ====================

    public static SyncMsg userJoined(long timestamp, String roomId, UserView user, List<UserView> users) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user", user);
        data.put("users", users);
        return of(timestamp, OutboundType.USER_JOINED, roomId, data);
    }

    public static SyncMsg userLeft(long timestamp, String roomId, String userId, String username, List<UserView> users) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", userId);
        data.put("username", username);
        data.put("users", users);
        return of(timestamp, OutboundType.USER_LEFT, roomId, data);
    }

    public static SyncMsg userDisconnected(long timestamp, String roomId, String userId, String username, List<UserView> users) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", userId);
        data.put("username", username);
        data.put("users", users);
        return of(timestamp, OutboundType.USER_DISCONNECTED, roomId, data);
    }

    public static SyncMsg userConnectionLost(long timestamp, String roomId, String userId, String username) {
        return of(timestamp, OutboundType.USER_CONNECTION_LOST, roomId, Map.of("userId", userId, "username", nullSafe(username)));
    }

    public static SyncMsg hostConnectionLost(long timestamp, String roomId, String hostId) {
        return of(timestamp, OutboundType.HOST_CONNECTION_LOST, roomId, Map.of("hostId", hostId));
    }

    public static SyncMsg hostClaimRejected(long timestamp, String roomId, String currentHostId) {
        return of(timestamp, OutboundType.HOST_CLAIM_REJECTED, roomId, Map.of("currentHostId", currentHostId));
    }

    // ==================== STREAMING / REPRODUCCIÓN ====================

    public static SyncMsg streamingStatus(long timestamp, String roomId, StreamingInfo info) {
        return of(timestamp, OutboundType.STREAMING_STATUS, roomId, info);
    }

    public static SyncMsg streamingAboutToStart(long timestamp, String roomId) {
        return of(timestamp, OutboundType.STREAMING_ABOUT_TO_START, roomId, null);
    }

    public static SyncMsg videoUrlUpdate(long timestamp, String roomId, String videoUrl, String fileName, String fileType) {
        Map<String, Object> data = new HashMap<>();
        data.put("videoUrl", videoUrl);
        data.put("fileName", fileName);
        data.put("fileType", fileType);
        return of(timestamp, OutboundType.VIDEO_URL_UPDATE, roomId, data);
    }

    public static SyncMsg videoStateUpdate(long timestamp, String roomId, SyncSnapshot snapshot) {
        return of(timestamp, OutboundType.VIDEO_STATE_UPDATE, roomId, snapshot);
    }

    public static SyncMsg videoSeekOperation(long timestamp, String roomId, double seekTime, boolean isPlaying,
            Long sourceTimestamp, long serverTimestamp, Long relayLatencyMs) {
        Map<String, Object> data = new HashMap<>();
        data.put("seekTime", seekTime);
        data.put("isPlaying", isPlaying);
        data.put("sourceTimestamp", sourceTimestamp);
        data.put("serverTimestamp", serverTimestamp);
        data.put("relayLatencyMs", relayLatencyMs);
        return of(timestamp, OutboundType.VIDEO_SEEK_OPERATION, roomId, data);
    }

    public static SyncMsg fallbackSyncState(long timestamp, String roomId, SyncSnapshot snapshot) {
        return of(timestamp, OutboundType.FALLBACK_SYNC_STATE, roomId, snapshot);
    }

    // ==================== CHAT / SALAS ====================

    public static SyncMsg newMessage(long timestamp, String roomId, String user, String text, String time) {
        return of(timestamp, OutboundType.NEW_MESSAGE, roomId, Map.of("user", nullSafe(user), "text", nullSafe(text), "time", time));
    }

    public static SyncMsg roomCreated(long timestamp, String roomId, String correlationId) {
        return new SyncMsg(OutboundType.ROOM_CREATED, roomId, correlationId, timestamp,
                Map.of("roomId", roomId));
    }

    // ==================== SIGNALING ====================

    public static SyncMsg peerId(long timestamp, String roomId, String connectionId, String peerId, boolean isHost) {
        return of(timestamp, OutboundType.PEER_ID, roomId, Map.of("socketId", connectionId, "peerId", peerId, "isHost", isHost));
    }

    public static SyncMsg signal(long timestamp, String from, Object signal, String signalType) {
        Map<String, Object> data = new HashMap<>();
        data.put("from", from);
        data.put("signal", signal);
        data.put("signalType", signalType);
        return of(timestamp, OutboundType.SIGNAL, null, data);
    }

    public static SyncMsg iceCandidate(long timestamp, String from, Object candidate) {
        Map<String, Object> data = new HashMap<>();
        data.put("from", from);
        data.put("candidate", candidate);
        return of(timestamp, OutboundType.ICE_CANDIDATE, null, data);
    }

    public static SyncMsg reconnectRequested(long timestamp, String roomId, String sourceConnectionId) {
        return of(timestamp, OutboundType.WEBRTC_RECONNECT_REQUESTED, roomId, Map.of("requestedBy", sourceConnectionId));
    }

    public static SyncMsg targetUnreachable(long timestamp, String roomId, String targetPeerId) {
        return of(timestamp, OutboundType.WEBRTC_TARGET_UNREACHABLE, roomId, Map.of("targetPeerId", targetPeerId));
    }

    public static SyncMsg noStreamNeeded(long timestamp, String roomId, String targetPeerId) {
        return of(timestamp, OutboundType.WEBRTC_NO_STREAM_NEEDED, roomId, Map.of("targetPeerId", targetPeerId));
    }

    public static SyncMsg viewerReconnectionRequest(long timestamp, String roomId, String viewerConnectionId, String viewerPeerId) {
        return of(timestamp, OutboundType.VIEWER_RECONNECTION_REQUEST, roomId,
                Map.of("viewerSocketId", viewerConnectionId, "viewerPeerId", nullSafe(viewerPeerId)));
    }

    public static SyncMsg reconnectionFailed(long timestamp, String roomId, String reason) {
        return of(timestamp, OutboundType.RECONNECTION_FAILED, roomId, Map.of("reason", reason));
    }

    // ==================== PRESENCIA ====================

    public static SyncMsg heartbeatAck(long timestamp, String roomId, long serverTime, Long clientTime, int viewerCount,
            int chatOnlyCount, boolean hostConnected) {
        Map<String, Object> data = new HashMap<>();
        data.put("serverTime", serverTime);
        data.put("clientTime", clientTime);
        data.put("viewerCount", viewerCount);
        data.put("chatOnlyCount", chatOnlyCount);
        data.put("hostConnected", hostConnected);
        return of(timestamp, OutboundType.HEARTBEAT_ACK, roomId, data);
    }

    public static SyncMsg roomHealthStatus(long timestamp, String roomId, int viewerCount, int chatOnlyCount,
            boolean hostConnected, String hostId) {
        Map<String, Object> data = new HashMap<>();
        data.put("viewerCount", viewerCount);
        data.put("chatOnlyCount", chatOnlyCount);
        data.put("hostConnected", hostConnected);
        data.put("hostId", hostId);
        return of(timestamp, OutboundType.ROOM_HEALTH_STATUS, roomId, data);
    }

    public static SyncMsg connectionHealthResponse(long timestamp, String roomId, boolean connected, Long lastHeartbeatAt,
            long serverTime, boolean roomExists) {
        Map<String, Object> data = new HashMap<>();
        data.put("connected", connected);
        data.put("lastHeartbeatAt", lastHeartbeatAt);
        data.put("serverTime", serverTime);
        data.put("roomExists", roomExists);
        return of(timestamp, OutboundType.CONNECTION_HEALTH_RESPONSE, roomId, data);
    }

    public static SyncMsg error(long timestamp, String code, String message) {
        return of(timestamp, OutboundType.ERROR, null, Map.of("code", code, "message", nullSafe(message)));
    }

    /**
     * Extracción segura de datos (solo para los mensajes construidos con un mapa)
     */
    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{type='%s', roomId='%s', timestamp=%d}", type.getWireName(), roomId, timestamp);
    }
}
