package com.rebenew.watchParty.syncserver.model;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Resumen de sala devuelto por la API HTTP.
 */
@Getter
@Setter
public class RoomResponse {
    private String roomId;
    private String hostId;
    private StreamingInfo streamingInfo;
    private List<UserView> users;
    private long lastActiveAt;

    public RoomResponse(String roomId, String hostId, StreamingInfo streamingInfo, List<UserView> users,
            long lastActiveAt) {
        this.roomId = roomId;
        this.hostId = hostId;
        this.streamingInfo = streamingInfo;
        this.users = users;
        this.lastActiveAt = lastActiveAt;
    }
}
