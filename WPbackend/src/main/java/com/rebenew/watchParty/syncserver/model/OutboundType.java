package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

// Eventos que emite el servidor, con su nombre en el protocolo.

public enum OutboundType {
    USER_JOINED("userJoined"),
    USER_LEFT("userLeft"),
    USER_DISCONNECTED("userDisconnected"),
    USER_CONNECTION_LOST("userConnectionLost"),
    HOST_CONNECTION_LOST("hostConnectionLost"),
    HOST_CLAIM_REJECTED("hostClaimRejected"),
    STREAMING_STATUS("streaming-status"),
    STREAMING_ABOUT_TO_START("streamingAboutToStart"),
    VIDEO_URL_UPDATE("videoUrlUpdate"),
    VIDEO_STATE_UPDATE("videoStateUpdate"),
    VIDEO_SEEK_OPERATION("videoSeekOperation"),
    FALLBACK_SYNC_STATE("fallback-sync-state"),
    NEW_MESSAGE("newMessage"),
    ROOM_CREATED("roomCreated"),
    PEER_ID("peer-id"),
    SIGNAL("signal"),
    ICE_CANDIDATE("ice-candidate"),
    WEBRTC_RECONNECT_REQUESTED("webrtc-reconnect-requested"),
    WEBRTC_TARGET_UNREACHABLE("webrtc-target-unreachable"),
    WEBRTC_NO_STREAM_NEEDED("webrtc-no-stream-needed"),
    VIEWER_RECONNECTION_REQUEST("viewer-reconnection-request"),
    RECONNECTION_FAILED("reconnection-failed"),
    HEARTBEAT_ACK("heartbeat-ack"),
    ROOM_HEALTH_STATUS("room-health-status"),
    CONNECTION_HEALTH_RESPONSE("connection-health-response"),
    ERROR("error");

    private final String wireName;

    OutboundType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
