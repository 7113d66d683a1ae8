package com.rebenew.watchParty.syncserver.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Pertenencia de una conexión a una sala. Solo se modifica con el monitor de su {@link Room}.
 */
@Getter
@Setter
public class Participant {
    private String connectionId;
    private String displayName;
    private boolean host;
    private boolean chatOnly;
    private boolean active = true;
    private Instant disconnectedAt; // solo mientras está inactivo
    private Instant lastHeartbeatAt;
    private final Instant joinedAt;

    public Participant(String connectionId, String displayName, boolean host, boolean chatOnly, Instant now) {
        this.connectionId = connectionId;
        this.displayName = displayName;
        this.host = host;
        this.chatOnly = chatOnly;
        this.joinedAt = now;
        this.lastHeartbeatAt = now;
    }

    public void markDisconnected(Instant now) {
        this.active = false;
        this.disconnectedAt = now;
    }

    public void markReconnected(String newConnectionId, Instant now) {
        this.connectionId = newConnectionId;
        this.active = true;
        this.disconnectedAt = null;
        this.lastHeartbeatAt = now;
    }

    /** Viewer que sigue la reproducción: ni host ni chat-only. */
    public boolean isFollower() {
        return !host && !chatOnly;
    }

    public UserView toView() {
        return new UserView(connectionId, displayName, host, chatOnly, active);
    }

    @Override
    public String toString() {
        return "Participant{" +
                "connectionId='" + connectionId + '\'' +
                ", displayName='" + displayName + '\'' +
                ", host=" + host +
                ", chatOnly=" + chatOnly +
                ", active=" + active +
                '}';
    }
}
