package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.Participant;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

/**
 * Difusión a los participantes de una sala. Solo se escribe a los activos; uno que está en su
 * periodo de gracia no tiene conexión viva.
 */
@Component
public class RoomBroadcaster {
    private static final Logger logger = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final ConnectionGateway gateway;

    public RoomBroadcaster(ConnectionGateway gateway) {
        this.gateway = gateway;
    }

    public boolean toConnection(String connectionId, SyncMsg message) {
        boolean delivered = gateway.send(connectionId, message);
        if (!delivered) {
            logger.debug("Descartado {} para conexión cerrada {}", message.getType().getWireName(), connectionId);
        }
        return delivered;
    }

    // Toda la sala, chat-only incluidos
    public int toRoom(Room room, SyncMsg message, String excludeConnectionId) {
        return fanOut(room, message, excludeConnectionId, p -> true);
    }

    // Tráfico de reproducción y signaling: los chat-only nunca lo reciben
    public int toFollowers(Room room, SyncMsg message, String excludeConnectionId) {
        return fanOut(room, message, excludeConnectionId, p -> !p.isChatOnly());
    }

    public boolean isOpen(String connectionId) {
        return gateway.isOpen(connectionId);
    }

    private int fanOut(Room room, SyncMsg message, String excludeConnectionId, Predicate<Participant> filter) {
        if (room == null)
            return 0;
        int sent = 0;
        for (Participant p : room.getParticipants()) {
            if (!p.isActive() || p.getConnectionId().equals(excludeConnectionId) || !filter.test(p))
                continue;
            if (gateway.send(p.getConnectionId(), message))
                sent++;
        }
        logger.debug("📢 {} a sala {} llegó a {} conexión(es) (excluida: {})",
                message.getType().getWireName(), room.getRoomId(), sent, excludeConnectionId);
        return sent;
    }
}
