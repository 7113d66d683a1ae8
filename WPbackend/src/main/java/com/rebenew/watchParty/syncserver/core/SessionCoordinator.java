package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.config.SyncProperties;
import com.rebenew.watchParty.syncserver.model.ConnectionHealth;
import com.rebenew.watchParty.syncserver.model.Participant;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.StreamingInfo;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.model.UserView;
import com.rebenew.watchParty.syncserver.service.RoomHealthSystem;
import com.rebenew.watchParty.syncserver.service.ServiceStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Membresía de las salas: unirse, salir, la desconexión en dos fases y los controles de sala
 * reservados al host. Todo cambio de membresía corre dentro del monitor de la sala; la búsqueda
 * en el registro se hace fuera y se reintenta si la sala se cerró entretanto.
 */
@Service
public class SessionCoordinator implements PresenceTracker.DepartureListener {
    private static final Logger logger = LoggerFactory.getLogger(SessionCoordinator.class);

    private static final DateTimeFormatter CHAT_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    // connection id -> sala a la que se unió
    private final ConcurrentHashMap<String, String> connectionRooms = new ConcurrentHashMap<>();

    private final RoomRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final PresenceTracker presence;
    private final SyncStateEngine syncEngine;
    private final SignalingRelay signaling;
    private final ConnectionGateway gateway;
    private final ServiceStats serviceStats;
    private final Clock clock;
    private final String mediaBasePath;

    public SessionCoordinator(RoomRegistry registry, RoomBroadcaster broadcaster, PresenceTracker presence,
            SyncStateEngine syncEngine, SignalingRelay signaling, ConnectionGateway gateway,
            ServiceStats serviceStats, Clock clock, SyncProperties properties) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.presence = presence;
        this.syncEngine = syncEngine;
        this.signaling = signaling;
        this.gateway = gateway;
        this.serviceStats = serviceStats;
        this.clock = clock;
        this.mediaBasePath = properties.getMedia().getBasePath();
        presence.setDepartureListener(this);
    }

    // ====================
    // CONEXIONES
    // ====================

    public void onConnectionOpened(String connectionId) {
        presence.connectionOpened(connectionId);
    }

    /**
     * Se cayó el transporte. El participante sigue en la sala, inactivo, hasta que se vuelva a
     * vincular desde una conexión nueva o venza el periodo de gracia.
     */
    public void onDisconnect(String connectionId) {
        presence.connectionClosed(connectionId);
        signaling.unregister(connectionId);

        String roomId = connectionRooms.get(connectionId);
        if (roomId == null) {
            logger.debug("Conexión {} cerrada sin sala", connectionId);
            return;
        }
        Room room = registry.getRoom(roomId);
        if (room == null) {
            connectionRooms.remove(connectionId, roomId);
            return;
        }

        synchronized (room) {
            Optional<Participant> found = room.findParticipant(connectionId);
            if (room.isClosed() || found.isEmpty() || !found.get().isActive())
                return;
            Participant participant = found.get();
            Instant now = clock.instant();
            participant.markDisconnected(now);
            broadcaster.toRoom(room, SyncMsg.userDisconnected(now.toEpochMilli(), roomId, connectionId,
                    participant.getDisplayName(), room.userViews()), connectionId);
            presence.scheduleRemoval(connectionId, roomId);
            logger.info("🔌 {} ({}) desconectado de sala {}{}", participant.getDisplayName(), connectionId, roomId,
                    room.isHost(connectionId) ? " [host]" : "");
        }
    }

    // ====================
    // ENTRAR / SALIR
    // ====================

    /**
     * Añade la conexión a la sala, creándola si hace falta. Con un {@code previousConnectionId}
     * que nombra a un participante cuya conexión ya no existe, ese participante se vincula a esta
     * conexión conservando su rol y su lugar.
     *
     * @return el participante tal como se lista a la sala
     */
    public UserView join(String connectionId, String roomId, String username, boolean isHost, boolean isChatOnly,
            String previousConnectionId) {
        if (roomId == null || roomId.isBlank())
            throw new IllegalArgumentException("roomId no puede ser nulo o vacío");
        String currentRoom = connectionRooms.get(connectionId);
        if (currentRoom != null && !currentRoom.equals(roomId)) {
            logger.info("Conexión {} cambia de sala {} a {}", connectionId, currentRoom, roomId);
            leave(connectionId);
        }

        while (true) {
            Room room = registry.getOrCreate(roomId);
            synchronized (room) {
                // eliminada entre la búsqueda y el lock: se crea una sala nueva
                if (room.isClosed())
                    continue;
                return joinLocked(room, connectionId, username, isHost, isChatOnly, previousConnectionId);
            }
        }
    }

    private UserView joinLocked(Room room, String connectionId, String username, boolean isHost, boolean isChatOnly,
            String previousConnectionId) {
        String roomId = room.getRoomId();
        Instant now = clock.instant();
        long ts = now.toEpochMilli();
        room.touch(now);

        Participant participant = rebind(room, connectionId, previousConnectionId, now);
        boolean reconnected = participant != null;
        boolean hostClaimRejected = false;

        if (!reconnected) {
            String name = username != null && !username.isBlank() ? username : "Guest";
            participant = room.findParticipant(connectionId).orElse(null);
            if (participant == null) {
                participant = new Participant(connectionId, name, false, isChatOnly, now);
            } else {
                participant.setDisplayName(name);
                participant.setChatOnly(isChatOnly);
            }

            if (isHost) {
                if (room.getHostId() == null || room.isHost(connectionId)) {
                    room.setHostId(connectionId);
                    participant.setHost(true);
                    logger.info("👑 {} es host de la sala {}", connectionId, roomId);
                } else {
                    hostClaimRejected = true;
                    logger.warn("👑 Reclamo de host de {} rechazado en sala {}: {} ya es host", connectionId, roomId,
                            room.getHostId());
                }
            }
            room.addOrReplace(participant);
        }
        connectionRooms.put(connectionId, roomId);

        broadcaster.toRoom(room, SyncMsg.userJoined(ts, roomId, participant.toView(), room.userViews()), null);
        if (hostClaimRejected) {
            broadcaster.toConnection(connectionId, SyncMsg.hostClaimRejected(ts, roomId, room.getHostId()));
        }

        StreamingInfo streaming = room.getStreamingInfo();
        broadcaster.toConnection(connectionId, SyncMsg.streamingStatus(ts, roomId, streaming));
        if (participant.isFollower() && streaming.isStreaming() && streaming.fileName() != null) {
            broadcaster.toConnection(connectionId, SyncMsg.videoUrlUpdate(ts, roomId, videoUrl(streaming.fileName()),
                    streaming.fileName(), streaming.fileType()));
        }
        syncEngine.snapshotForJoiner(room, participant).ifPresent(snapshot ->
                broadcaster.toConnection(connectionId, SyncMsg.fallbackSyncState(ts, roomId, snapshot)));

        logger.info("👤 {} {} a sala {} como {} ({} participante(s))", participant.getDisplayName(),
                reconnected ? "reconectado" : "unido", roomId, role(participant), room.getParticipantCount());
        return participant.toView();
    }

    private Participant rebind(Room room, String connectionId, String previousConnectionId, Instant now) {
        if (previousConnectionId == null || previousConnectionId.equals(connectionId))
            return null;
        Optional<Participant> previous = room.findParticipant(previousConnectionId);
        if (previous.isEmpty())
            return null;
        Participant participant = previous.get();
        if (participant.isActive() && broadcaster.isOpen(previousConnectionId)) {
            logger.warn("Conexión {} reclama al participante activo {} en sala {}, se une como nuevo", connectionId,
                    previousConnectionId, room.getRoomId());
            return null;
        }

        // si esta conexión ya tenía registro propio en la sala, el vinculado lo sustituye
        boolean currentIsHost = room.isHost(connectionId);
        room.removeParticipant(connectionId);

        presence.cancelRemoval(previousConnectionId);
        boolean wasHost = room.isHost(previousConnectionId);
        participant.markReconnected(connectionId, now);
        if (wasHost || currentIsHost) {
            room.setHostId(connectionId);
            participant.setHost(true);
        }
        connectionRooms.remove(previousConnectionId, room.getRoomId());
        logger.info("🔁 {} reconectado a sala {} ({} -> {}){}", participant.getDisplayName(), room.getRoomId(),
                previousConnectionId, connectionId, participant.isHost() ? " [host]" : "");
        return participant;
    }

    public boolean leave(String connectionId) {
        String roomId = connectionRooms.remove(connectionId);
        signaling.unregister(connectionId);
        if (roomId == null) {
            logger.debug("Salida de {} que no está en ninguna sala", connectionId);
            return false;
        }
        Room room = registry.getRoom(roomId);
        if (room == null)
            return false;

        synchronized (room) {
            presence.cancelRemoval(connectionId);
            return removeParticipantLocked(room, connectionId, "salió de");
        }
    }

    /**
     * Quita al participante y avisa al resto de la sala. Un host que se va se lleva el stream;
     * el último en salir elimina la sala.
     */
    private boolean removeParticipantLocked(Room room, String connectionId, String reason) {
        String roomId = room.getRoomId();
        boolean wasHost = room.isHost(connectionId);
        Optional<Participant> removed = room.removeParticipant(connectionId);
        connectionRooms.remove(connectionId, roomId);
        if (removed.isEmpty())
            return false;
        Participant participant = removed.get();

        if (room.isEmpty()) {
            registry.deleteRoom(room);
            logger.info("👋 {} {} la sala {}, sala vacía eliminada", participant.getDisplayName(), reason, roomId);
            return true;
        }

        Instant now = clock.instant();
        if (wasHost) {
            room.setHostId(null);
            room.setStreamingInfo(StreamingInfo.STOPPED);
            broadcaster.toFollowers(room, SyncMsg.streamingStatus(now.toEpochMilli(), roomId, StreamingInfo.STOPPED),
                    null);
            logger.info("👑 Host {} salió de la sala {}, streaming detenido", connectionId, roomId);
        }
        room.touch(now);
        broadcaster.toRoom(room, SyncMsg.userLeft(now.toEpochMilli(), roomId, connectionId,
                participant.getDisplayName(), room.userViews()), null);
        logger.info("👋 {} ({}) {} la sala {}", participant.getDisplayName(), connectionId, reason, roomId);
        return true;
    }

    // ====================
    // CALLBACKS DE PRESENCIA
    // ====================

    @Override
    public void onGraceExpired(String roomId, String connectionId) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            connectionRooms.remove(connectionId, roomId);
            return;
        }
        synchronized (room) {
            if (room.isClosed())
                return;
            Optional<Participant> participant = room.findParticipant(connectionId);
            // ya vinculado a otra conexión o de vuelta
            if (participant.isEmpty() || participant.get().isActive())
                return;
            logger.info("⌛ Periodo de gracia de {} en sala {} vencido", connectionId, roomId);
            removeParticipantLocked(room, connectionId, "expiró de");
        }
    }

    @Override
    public void onParticipantExpired(Room room, String connectionId) {
        synchronized (room) {
            if (!room.isClosed())
                removeParticipantLocked(room, connectionId, "caducó en");
        }
    }

    @Override
    public void onRoomExpired(Room room) {
        synchronized (room) {
            for (Participant p : room.getParticipants()) {
                connectionRooms.remove(p.getConnectionId(), room.getRoomId());
                presence.cancelRemoval(p.getConnectionId());
            }
            registry.deleteRoom(room);
        }
    }

    // ====================
    // CONTROLES DE SALA
    // ====================

    /**
     * Solo un miembro de la sala la mantiene viva y recibe su ocupación; cualquier otra conexión
     * recibe el ack con los contadores a cero.
     */
    public void heartbeat(String connectionId, String roomId, Long clientTimestamp) {
        Instant now = clock.instant();
        long ts = now.toEpochMilli();
        presence.recordHeartbeat(connectionId, now);

        Room room = registry.getRoom(roomId != null ? roomId : connectionRooms.get(connectionId));
        SyncMsg ack = null;
        if (room != null) {
            synchronized (room) {
                Optional<Participant> member = room.findParticipant(connectionId);
                if (member.isPresent()) {
                    member.get().setLastHeartbeatAt(now);
                    room.touch(now);
                    ack = SyncMsg.heartbeatAck(ts, room.getRoomId(), ts, clientTimestamp,
                            room.getActiveViewerCount(), room.getChatOnlyCount(), room.isHostConnected());
                }
            }
        }
        if (ack == null) {
            logger.debug("💓 Heartbeat de {} fuera de la sala {}", connectionId, roomId);
            ack = SyncMsg.heartbeatAck(ts, roomId, ts, clientTimestamp, 0, 0, false);
        } else {
            logger.debug("💓 Heartbeat de {} en sala {}", connectionId, room.getRoomId());
        }
        broadcaster.toConnection(connectionId, ack);
    }

    public boolean updateStreamingStatus(String connectionId, String roomId, boolean streaming, String fileName,
            String fileType) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Intento de cambiar streaming en sala inexistente: {}", roomId);
            return false;
        }

        synchronized (room) {
            Instant now = clock.instant();
            long ts = now.toEpochMilli();
            if (!room.isHost(connectionId)) {
                logger.warn("Usuario {} sin permisos para cambiar streaming en sala: {}", connectionId, roomId);
                broadcaster.toConnection(connectionId, SyncMsg.streamingStatus(ts, roomId, room.getStreamingInfo()));
                return false;
            }

            StreamingInfo info = new StreamingInfo(streaming, fileName, fileType);
            room.setStreamingInfo(info);
            room.touch(now);
            broadcaster.toRoom(room, SyncMsg.streamingStatus(ts, roomId, info), null);
            if (streaming && fileName != null) {
                broadcaster.toFollowers(room,
                        SyncMsg.videoUrlUpdate(ts, roomId, videoUrl(fileName), fileName, fileType), connectionId);
            }
            logger.info("📺 Streaming {} en sala {} ({})", streaming ? "iniciado" : "detenido", roomId, fileName);
            return true;
        }
    }

    public boolean streamingAboutToStart(String connectionId, String roomId) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Aviso de streaming para sala inexistente: {}", roomId);
            return false;
        }

        synchronized (room) {
            if (!room.isHost(connectionId)) {
                logger.warn("Usuario {} sin permisos para anunciar streaming en sala: {}", connectionId, roomId);
                return false;
            }
            Instant now = clock.instant();
            room.touch(now);
            broadcaster.toFollowers(room, SyncMsg.streamingAboutToStart(now.toEpochMilli(), roomId), connectionId);
            logger.info("⏳ El host está por iniciar el streaming en sala {}", roomId);
            return true;
        }
    }

    public boolean sendChat(String connectionId, String roomId, String text, String username) {
        if (text == null || text.isBlank())
            return false;
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Mensaje de chat para sala inexistente: {}", roomId);
            return false;
        }

        synchronized (room) {
            Optional<Participant> sender = room.findParticipant(connectionId);
            if (sender.isEmpty()) {
                logger.warn("Mensaje de chat de {} que no está en la sala {}", connectionId, roomId);
                return false;
            }
            String user = username != null && !username.isBlank() ? username : sender.get().getDisplayName();
            Instant now = clock.instant();
            String time = CHAT_TIME.format(now.atZone(ZoneId.systemDefault()));
            room.touch(now);
            broadcaster.toRoom(room, SyncMsg.newMessage(now.toEpochMilli(), roomId, user, text, time), null);
            logger.debug("💬 Chat en sala {} de {}", roomId, user);
            return true;
        }
    }

    public String createRoom() {
        return registry.createRoom();
    }

    public void connectionHealthCheck(String connectionId, String roomId) {
        Instant now = clock.instant();
        ConnectionHealth health = presence.getHealth(connectionId);
        Long lastHeartbeat = health != null ? health.getLastHeartbeatAt().toEpochMilli() : null;
        broadcaster.toConnection(connectionId, SyncMsg.connectionHealthResponse(now.toEpochMilli(), roomId,
                presence.isConnected(connectionId), lastHeartbeat, now.toEpochMilli(), registry.roomExists(roomId)));
    }

    // ====================
    // CONSULTAS
    // ====================

    public String roomOf(String connectionId) {
        return connectionRooms.get(connectionId);
    }

    public Map<String, Object> getServiceStats() {
        int participants = 0;
        int chatOnly = 0;
        for (Room room : registry.getAllRooms()) {
            participants += room.getParticipantCount();
            chatOnly += room.getChatOnlyCount();
        }
        Map<String, Object> stats = new HashMap<>();
        stats.put("rooms", registry.size());
        stats.put("connections", gateway.openConnectionCount());
        stats.put("participants", participants);
        stats.put("chatOnlyParticipants", chatOnly);
        stats.put("uptimeSeconds", serviceStats.getUptimeSeconds());
        stats.put("lostConnections", serviceStats.count(RoomHealthSystem.Action.CONNECTION_LOST)
                + serviceStats.count(RoomHealthSystem.Action.HOST_LOST));
        stats.put("expiredRooms", serviceStats.count(RoomHealthSystem.Action.ROOM_EXPIRED));
        stats.put("timestamp", clock.millis());
        return stats;
    }

    private String videoUrl(String fileName) {
        return mediaBasePath + UriUtils.encodePathSegment(fileName, StandardCharsets.UTF_8);
    }

    private static String role(Participant p) {
        if (p.isHost())
            return "host";
        return p.isChatOnly() ? "chat-only" : "viewer";
    }
}
