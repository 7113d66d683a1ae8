package com.rebenew.watchParty.syncserver.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Vida a nivel de transporte de una conexión, independiente de la sala.
 */
@Getter
@Setter
public class ConnectionHealth {
    private final String connectionId;
    private final Instant connectedAt;
    private volatile Instant lastHeartbeatAt;
    private volatile boolean connected = true;
    private volatile Instant disconnectedAt;

    public ConnectionHealth(String connectionId, Instant now) {
        this.connectionId = connectionId;
        this.connectedAt = now;
        this.lastHeartbeatAt = now;
    }

    public void markDisconnected(Instant now) {
        this.connected = false;
        this.disconnectedAt = now;
    }
}
