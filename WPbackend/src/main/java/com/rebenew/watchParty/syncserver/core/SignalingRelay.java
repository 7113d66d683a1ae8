package com.rebenew.watchParty.syncserver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.rebenew.watchParty.syncserver.model.Participant;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reenvío de la negociación WebRTC entre dos participantes, más el directorio de peer ids que
 * permite redirigir las conexiones directas tras una reconexión. Nunca inspecciona los payloads.
 */
@Service
public class SignalingRelay {
    private static final Logger logger = LoggerFactory.getLogger(SignalingRelay.class);

    public enum RelayOutcome {
        FORWARDED,
        TARGET_CHAT_ONLY,
        TARGET_UNREACHABLE,
        NO_HOST,
        ROOM_NOT_FOUND
    }

    private final RoomRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final Clock clock;

    // ambos sentidos cambian juntos
    private final Object mappingLock = new Object();
    private final Map<String, String> peerByConnection = new HashMap<>();
    private final Map<String, String> connectionByPeer = new HashMap<>();

    public SignalingRelay(RoomRegistry registry, RoomBroadcaster broadcaster, Clock clock) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    // ==================== DIRECTORIO DE PEERS ====================

    /**
     * Registra {@code peerId} para la conexión y lo anuncia a los seguidores de la sala. Si llega
     * la conexión anterior (tras una reconexión), se borra su mapeo obsoleto.
     */
    public boolean registerPeer(String roomId, String connectionId, String peerId, String previousConnectionId) {
        if (peerId == null || peerId.isBlank()) {
            logger.warn("Peer id vacío de {} en sala {}", connectionId, roomId);
            return false;
        }

        synchronized (mappingLock) {
            if (previousConnectionId != null && !previousConnectionId.equals(connectionId)) {
                removeMappingLocked(previousConnectionId);
            }
            removeMappingLocked(connectionId);
            String displaced = connectionByPeer.put(peerId, connectionId);
            if (displaced != null && !displaced.equals(connectionId)) {
                peerByConnection.remove(displaced);
            }
            peerByConnection.put(connectionId, peerId);
        }
        logger.info("🆔 Peer id registrado para {}: {} (conexión anterior: {})", connectionId, peerId,
                previousConnectionId);

        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Peer id registrado para sala inexistente: {}", roomId);
            return true;
        }
        synchronized (room) {
            broadcaster.toFollowers(room,
                    SyncMsg.peerId(clock.millis(), roomId, connectionId, peerId, room.isHost(connectionId)), null);
        }
        return true;
    }

    public void unregister(String connectionId) {
        synchronized (mappingLock) {
            removeMappingLocked(connectionId);
        }
    }

    public String connectionForPeer(String peerId) {
        if (peerId == null)
            return null;
        synchronized (mappingLock) {
            return connectionByPeer.get(peerId);
        }
    }

    public String peerForConnection(String connectionId) {
        if (connectionId == null)
            return null;
        synchronized (mappingLock) {
            return peerByConnection.get(connectionId);
        }
    }

    private void removeMappingLocked(String connectionId) {
        String peerId = peerByConnection.remove(connectionId);
        if (peerId != null) {
            connectionByPeer.remove(peerId, connectionId);
        }
    }

    // ==================== REENVÍO ====================

    public boolean forwardSignal(String fromConnectionId, String to, JsonNode signal, String signalType) {
        String target = resolveTarget(to);
        if (target == null) {
            logger.warn("Signal ({}) de {} hacia destino desconocido {}", signalType, fromConnectionId, to);
            return false;
        }
        logger.debug("📡 Signal de {} a {} ({})", fromConnectionId, target, signalType);
        return broadcaster.toConnection(target, SyncMsg.signal(clock.millis(), fromConnectionId, signal, signalType));
    }

    public boolean forwardIceCandidate(String fromConnectionId, String to, JsonNode candidate) {
        String target = resolveTarget(to);
        if (target == null) {
            logger.warn("ICE candidate de {} hacia destino desconocido {}", fromConnectionId, to);
            return false;
        }
        logger.debug("🧊 ICE candidate de {} a {}", fromConnectionId, target);
        return broadcaster.toConnection(target, SyncMsg.iceCandidate(clock.millis(), fromConnectionId, candidate));
    }

    // El destino es un connection id; también se acepta un peer id
    private String resolveTarget(String to) {
        if (to == null)
            return null;
        if (broadcaster.isOpen(to))
            return to;
        String byPeer = connectionForPeer(to);
        return byPeer != null && broadcaster.isOpen(byPeer) ? byPeer : null;
    }

    // ==================== RECUPERACIÓN ====================

    /**
     * Un participante no pudo abrir o mantener la conexión directa con {@code targetPeerId}. Se
     * pide al destino que reconecte, salvo que sea chat-only y nunca haya necesitado stream.
     */
    public RelayOutcome reportConnectionFailure(String roomId, String sourceConnectionId, String targetPeerId) {
        Room room = registry.getRoom(roomId);
        String targetConnection = connectionForPeer(targetPeerId);
        if (room == null || targetConnection == null) {
            logger.warn("Fallo WebRTC de {} hacia peer desconocido {} en sala {}", sourceConnectionId,
                    targetPeerId, roomId);
            broadcaster.toConnection(sourceConnectionId,
                    SyncMsg.targetUnreachable(clock.millis(), roomId, nullSafe(targetPeerId)));
            return RelayOutcome.TARGET_UNREACHABLE;
        }

        synchronized (room) {
            Optional<Participant> target = room.findParticipant(targetConnection).filter(Participant::isActive);
            if (target.isEmpty()) {
                logger.warn("Destino {} del fallo WebRTC no está conectado a la sala {}", targetPeerId, roomId);
                broadcaster.toConnection(sourceConnectionId,
                        SyncMsg.targetUnreachable(clock.millis(), roomId, targetPeerId));
                return RelayOutcome.TARGET_UNREACHABLE;
            }
            if (target.get().isChatOnly()) {
                logger.debug("Destino {} del fallo WebRTC es chat-only, nada que reconectar", targetPeerId);
                broadcaster.toConnection(sourceConnectionId,
                        SyncMsg.noStreamNeeded(clock.millis(), roomId, targetPeerId));
                return RelayOutcome.TARGET_CHAT_ONLY;
            }
            broadcaster.toConnection(targetConnection,
                    SyncMsg.reconnectRequested(clock.millis(), roomId, sourceConnectionId));
            logger.info("🔄 Reconexión WebRTC solicitada por {} a {} en sala {}", sourceConnectionId,
                    targetConnection, roomId);
            return RelayOutcome.FORWARDED;
        }
    }

    public RelayOutcome requestReconnection(String roomId, String viewerConnectionId, String viewerPeerId) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Solicitud de reconexión de {} para sala inexistente: {}", viewerConnectionId, roomId);
            broadcaster.toConnection(viewerConnectionId,
                    SyncMsg.reconnectionFailed(clock.millis(), roomId, "room_not_found"));
            return RelayOutcome.ROOM_NOT_FOUND;
        }

        synchronized (room) {
            String hostId = room.getHostId();
            if (hostId == null || !room.isHostConnected()) {
                logger.warn("Solicitud de reconexión de {} pero la sala {} no tiene host conectado",
                        viewerConnectionId, roomId);
                broadcaster.toConnection(viewerConnectionId,
                        SyncMsg.reconnectionFailed(clock.millis(), roomId, "host_not_available"));
                return RelayOutcome.NO_HOST;
            }
            String peerId = viewerPeerId != null ? viewerPeerId : peerForConnection(viewerConnectionId);
            broadcaster.toConnection(hostId,
                    SyncMsg.viewerReconnectionRequest(clock.millis(), roomId, viewerConnectionId, peerId));
            logger.info("🔄 Viewer {} pidió al host {} reconectar en sala {}", viewerConnectionId, hostId, roomId);
            return RelayOutcome.FORWARDED;
        }
    }

    private static String nullSafe(String value) {
        return value != null ? value : "";
    }
}
