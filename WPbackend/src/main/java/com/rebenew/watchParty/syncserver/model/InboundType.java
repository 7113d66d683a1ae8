package com.rebenew.watchParty.syncserver.model;

// Eventos que puede enviar un cliente.

public enum InboundType {
    JOIN_ROOM,
    LEAVE_ROOM,
    HEARTBEAT,
    PEER_ID,
    VIDEO_STATE_CHANGE,
    VIDEO_SEEK_OPERATION,
    FALLBACK_SYNC_STATE,
    STREAMING_STATUS_UPDATE,
    STREAMING_ABOUT_TO_START,
    SEND_MESSAGE,
    SIGNAL,
    ICE_CANDIDATE,
    WEBRTC_CONNECTION_FAILED,
    REQUEST_RECONNECTION,
    CONNECTION_HEALTH_CHECK,
    CREATE_ROOM
}
