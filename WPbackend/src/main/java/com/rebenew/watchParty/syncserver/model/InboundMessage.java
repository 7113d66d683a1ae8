package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Mensaje cliente -> servidor. La propiedad {@code type} elige la variante; cada variante lleva
 * sus propios campos tipados.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InboundMessage.JoinRoom.class, name = "joinRoom"),
        @JsonSubTypes.Type(value = InboundMessage.LeaveRoom.class, name = "leaveRoom"),
        @JsonSubTypes.Type(value = InboundMessage.Heartbeat.class, name = "heartbeat"),
        @JsonSubTypes.Type(value = InboundMessage.PeerIdRegistration.class, name = "peer-id"),
        @JsonSubTypes.Type(value = InboundMessage.VideoStateChange.class, name = "videoStateChange"),
        @JsonSubTypes.Type(value = InboundMessage.VideoSeekOperation.class, name = "videoSeekOperation"),
        @JsonSubTypes.Type(value = InboundMessage.FallbackSyncState.class, name = "fallback-sync-state"),
        @JsonSubTypes.Type(value = InboundMessage.StreamingStatusUpdate.class, name = "streaming-status-update"),
        @JsonSubTypes.Type(value = InboundMessage.StreamingAboutToStart.class, name = "streamingAboutToStart"),
        @JsonSubTypes.Type(value = InboundMessage.SendMessage.class, name = "sendMessage"),
        @JsonSubTypes.Type(value = InboundMessage.Signal.class, name = "signal"),
        @JsonSubTypes.Type(value = InboundMessage.IceCandidate.class, name = "ice-candidate"),
        @JsonSubTypes.Type(value = InboundMessage.WebRtcConnectionFailed.class, name = "webrtc-connection-failed"),
        @JsonSubTypes.Type(value = InboundMessage.RequestReconnection.class, name = "request-reconnection"),
        @JsonSubTypes.Type(value = InboundMessage.ConnectionHealthCheck.class, name = "connection-health-check"),
        @JsonSubTypes.Type(value = InboundMessage.CreateRoom.class, name = "create-room")
})
public interface InboundMessage {

    @JsonIgnore
    InboundType inboundType();

    record JoinRoom(String roomId, String username,
            @JsonProperty("isHost") boolean isHost,
            @JsonProperty("isChatOnly") boolean isChatOnly,
            String previousConnectionId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.JOIN_ROOM; }
    }

    record LeaveRoom(String roomId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.LEAVE_ROOM; }
    }

    record Heartbeat(String roomId, Long timestamp,
            @JsonProperty("isHost") boolean isHost) implements InboundMessage {
        public InboundType inboundType() { return InboundType.HEARTBEAT; }
    }

    record PeerIdRegistration(String roomId, String peerId,
            @JsonProperty("isHost") boolean isHost,
            String previousConnectionId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.PEER_ID; }
    }

    record VideoStateChange(String roomId, VideoState videoState) implements InboundMessage {
        public InboundType inboundType() { return InboundType.VIDEO_STATE_CHANGE; }
    }

    record VideoSeekOperation(String roomId, Double seekTime,
            @JsonProperty("isPlaying") Boolean isPlaying,
            Long sourceTimestamp) implements InboundMessage {
        public InboundType inboundType() { return InboundType.VIDEO_SEEK_OPERATION; }
    }

    record FallbackSyncState(String roomId, Double currentTime,
            @JsonProperty("isPlaying") Boolean isPlaying,
            Long timestamp, String targetConnectionId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.FALLBACK_SYNC_STATE; }
    }

    record StreamingStatusUpdate(String roomId, boolean streaming, String fileName,
            String fileType) implements InboundMessage {
        public InboundType inboundType() { return InboundType.STREAMING_STATUS_UPDATE; }
    }

    record StreamingAboutToStart(String roomId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.STREAMING_ABOUT_TO_START; }
    }

    record SendMessage(String roomId, String message, String username) implements InboundMessage {
        public InboundType inboundType() { return InboundType.SEND_MESSAGE; }
    }

    // signalType es offer/answer; "type" ya lo usa el discriminador del mensaje
    record Signal(String to, String from, JsonNode signal, String signalType) implements InboundMessage {
        public InboundType inboundType() { return InboundType.SIGNAL; }
    }

    record IceCandidate(String to, JsonNode candidate) implements InboundMessage {
        public InboundType inboundType() { return InboundType.ICE_CANDIDATE; }
    }

    record WebRtcConnectionFailed(String roomId, String targetPeerId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.WEBRTC_CONNECTION_FAILED; }
    }

    record RequestReconnection(String roomId, String viewerPeerId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.REQUEST_RECONNECTION; }
    }

    record ConnectionHealthCheck(String roomId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.CONNECTION_HEALTH_CHECK; }
    }

    record CreateRoom(String correlationId) implements InboundMessage {
        public InboundType inboundType() { return InboundType.CREATE_ROOM; }
    }
}
