package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.config.SyncProperties;
import com.rebenew.watchParty.syncserver.model.Participant;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.model.SyncSnapshot;
import com.rebenew.watchParty.syncserver.model.VideoState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Dueño del snapshot de reproducción autoritativo de cada sala. Solo el host lo hace avanzar; los
 * cambios por debajo del umbral se absorben para que los ecos y el jitter no reboten entre clientes.
 */
@Service
public class SyncStateEngine {
    private static final Logger logger = LoggerFactory.getLogger(SyncStateEngine.class);

    public enum UpdateOutcome {
        ACCEPTED,
        INSIGNIFICANT,
        REJECTED_NOT_HOST,
        ROOM_NOT_FOUND,
        INVALID
    }

    private final RoomRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final Clock clock;
    private final SyncProperties.Sync config;

    public SyncStateEngine(RoomRegistry registry, RoomBroadcaster broadcaster, Clock clock,
            SyncProperties properties) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.config = properties.getSync();
    }

    public UpdateOutcome applyHostUpdate(String roomId, String connectionId, VideoState proposed) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Intento de cambiar estado de video en sala inexistente: {}", roomId);
            return UpdateOutcome.ROOM_NOT_FOUND;
        }

        synchronized (room) {
            if (room.isClosed())
                return UpdateOutcome.ROOM_NOT_FOUND;

            if (!room.isHost(connectionId)) {
                rejectNonHost(room, connectionId, "cambiar estado de video");
                return UpdateOutcome.REJECTED_NOT_HOST;
            }

            SyncSnapshot current = room.getSyncState();
            if (proposed == null || !isValidTime(proposed.currentTime())) {
                logger.warn("Estado de video inválido del host {} en sala {}: {}", connectionId, roomId, proposed);
                return UpdateOutcome.INVALID;
            }
            boolean playing = proposed.isPlaying() != null
                    ? proposed.isPlaying()
                    : current != null && current.isPlaying();
            double time = proposed.currentTime();

            if (current != null && !current.differsSignificantly(time, playing, config.getSeekThresholdSeconds())) {
                logger.debug("Estado de video sin cambio significativo en sala {} ({}s, playing={})", roomId, time,
                        playing);
                return UpdateOutcome.INSIGNIFICANT;
            }

            Instant now = clock.instant();
            SyncSnapshot snapshot = new SyncSnapshot(time, playing, now.toEpochMilli(), connectionId, proposed.seek());
            room.setSyncState(snapshot);
            room.touch(now);
            int sent = broadcaster.toFollowers(room,
                    SyncMsg.videoStateUpdate(now.toEpochMilli(), roomId, snapshot), connectionId);
            logger.info("{} Estado de video en sala {} -> {}s ({} seguidor(es))",
                    playing ? "▶️" : "⏸️", roomId, time, sent);
            return UpdateOutcome.ACCEPTED;
        }
    }

    /**
     * Seek del host. Los seguidores reciben la latencia medida entre el reloj del host y el
     * nuestro para compensar la posición destino.
     */
    public UpdateOutcome applySeek(String roomId, String connectionId, Double seekTime, Boolean isPlaying,
            Long sourceTimestamp) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Intento de seek en sala inexistente: {}", roomId);
            return UpdateOutcome.ROOM_NOT_FOUND;
        }

        synchronized (room) {
            if (room.isClosed())
                return UpdateOutcome.ROOM_NOT_FOUND;

            if (!room.isHost(connectionId)) {
                rejectNonHost(room, connectionId, "hacer seek");
                return UpdateOutcome.REJECTED_NOT_HOST;
            }
            if (!isValidTime(seekTime)) {
                logger.warn("Posición de seek inválida del host {} en sala {}: {}", connectionId, roomId, seekTime);
                return UpdateOutcome.INVALID;
            }

            SyncSnapshot current = room.getSyncState();
            boolean playing = isPlaying != null ? isPlaying : current != null && current.isPlaying();
            if (current != null && !current.differsSignificantly(seekTime, playing, config.getSeekThresholdSeconds())) {
                logger.debug("Seek sin cambio significativo en sala {} a {}s", roomId, seekTime);
                return UpdateOutcome.INSIGNIFICANT;
            }

            Instant now = clock.instant();
            long serverTimestamp = now.toEpochMilli();
            Long latency = sourceTimestamp != null ? serverTimestamp - sourceTimestamp : null;

            room.setSyncState(new SyncSnapshot(seekTime, playing, serverTimestamp, connectionId, Boolean.TRUE));
            room.touch(now);
            int sent = broadcaster.toFollowers(room,
                    SyncMsg.videoSeekOperation(serverTimestamp, roomId, seekTime, playing, sourceTimestamp,
                            serverTimestamp, latency),
                    connectionId);
            logger.info("🔍 Seek en sala {} por {} a {}s (latencia: {}ms, {} seguidor(es))",
                    roomId, connectionId, seekTime, latency, sent);
            return UpdateOutcome.ACCEPTED;
        }
    }

    /**
     * Resincronización de mejor esfuerzo desde cualquier miembro. El snapshot pasa a ser el
     * estado cacheado de la sala; va al destino indicado si es un miembro conectado, y si no a
     * todos los seguidores menos el emisor.
     */
    public UpdateOutcome fallbackSync(String roomId, String requesterId, Double currentTime, Boolean isPlaying,
            String targetConnectionId) {
        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("Fallback sync para sala inexistente: {}", roomId);
            return UpdateOutcome.ROOM_NOT_FOUND;
        }

        synchronized (room) {
            if (room.isClosed())
                return UpdateOutcome.ROOM_NOT_FOUND;

            if (room.findParticipant(requesterId).isEmpty()) {
                logger.warn("Fallback sync de {} que no está en la sala {}", requesterId, roomId);
                return UpdateOutcome.INVALID;
            }
            if (!isValidTime(currentTime)) {
                logger.warn("Posición de fallback sync inválida de {} en sala {}: {}", requesterId, roomId,
                        currentTime);
                return UpdateOutcome.INVALID;
            }

            Instant now = clock.instant();
            SyncSnapshot snapshot = new SyncSnapshot(currentTime, Boolean.TRUE.equals(isPlaying),
                    now.toEpochMilli(), requesterId, null);
            room.setSyncState(snapshot);
            room.touch(now);

            SyncMsg message = SyncMsg.fallbackSyncState(now.toEpochMilli(), roomId, snapshot);
            Optional<Participant> target = room.findParticipant(targetConnectionId).filter(Participant::isActive);
            if (target.isPresent()) {
                broadcaster.toConnection(target.get().getConnectionId(), message);
                logger.info("🛟 Fallback sync en sala {} de {} a {}", roomId, requesterId, targetConnectionId);
            } else {
                if (targetConnectionId != null)
                    logger.warn("Destino {} del fallback sync no está en la sala {}, se difunde", targetConnectionId,
                            roomId);
                int sent = broadcaster.toFollowers(room, message, requesterId);
                logger.info("🛟 Fallback sync en sala {} de {} difundido a {} seguidor(es)", roomId, requesterId,
                        sent);
            }
            return UpdateOutcome.ACCEPTED;
        }
    }

    /**
     * Snapshot desde el que debe arrancar un participante recién unido, si es seguidor y el
     * estado cacheado es lo bastante reciente.
     */
    public Optional<SyncSnapshot> snapshotForJoiner(Room room, Participant joiner) {
        if (!joiner.isFollower())
            return Optional.empty();
        SyncSnapshot state = room.getSyncState();
        if (state == null || !state.isFresh(clock.instant(), config.getFallbackFreshness()))
            return Optional.empty();
        return Optional.of(state);
    }

    private void rejectNonHost(Room room, String connectionId, String what) {
        logger.warn("Usuario {} sin permisos para {} en sala: {} (host: {})",
                connectionId, what, room.getRoomId(), room.getHostId());
        SyncSnapshot current = room.getSyncState();
        if (current != null) {
            broadcaster.toConnection(connectionId,
                    SyncMsg.videoStateUpdate(clock.millis(), room.getRoomId(), current));
        }
    }

    private static boolean isValidTime(Double time) {
        return time != null && !time.isNaN() && !time.isInfinite() && time >= 0;
    }
}
