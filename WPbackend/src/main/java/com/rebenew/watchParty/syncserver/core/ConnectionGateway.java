package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.SyncMsg;

/**
 * Lado saliente del canal de eventos. Los envíos no esperan confirmación.
 */
public interface ConnectionGateway {

    /**
     * @return false si la conexión es desconocida o ya está cerrada
     */
    boolean send(String connectionId, SyncMsg message);

    boolean isOpen(String connectionId);

    int openConnectionCount();
}
