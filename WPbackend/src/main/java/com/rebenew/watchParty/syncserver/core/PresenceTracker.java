package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.config.SyncProperties;
import com.rebenew.watchParty.syncserver.model.ConnectionHealth;
import com.rebenew.watchParty.syncserver.model.Participant;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.service.RoomHealthSystem;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Registro de heartbeats, salida diferida tras caerse el transporte y barrido periódico de las
 * conexiones que murieron sin evento de cierre.
 * <p>
 * Las salidas diferidas se guardan por connection id y las despacha un tick corto de frecuencia
 * fija. Cancelar una salida (reconexión) es quitarla del mapa; una salida que vence cuando el
 * participante ya volvió lo encuentra activo y no hace nada.
 */
@Service
public class PresenceTracker {
    private static final Logger logger = LoggerFactory.getLogger(PresenceTracker.class);

    private final ConcurrentHashMap<String, ConnectionHealth> health = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingRemoval> pendingRemovals = new ConcurrentHashMap<>();

    private final RoomRegistry registry;
    private final RoomBroadcaster broadcaster;
    private final ApplicationEventPublisher publisher;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final SyncProperties.Presence config;

    private volatile DepartureListener departureListener;

    public PresenceTracker(RoomRegistry registry, RoomBroadcaster broadcaster, ApplicationEventPublisher publisher,
            ScheduledExecutorService presenceScheduler, Clock clock, SyncProperties properties) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.publisher = publisher;
        this.scheduler = presenceScheduler;
        this.clock = clock;
        this.config = properties.getPresence();
    }

    @PostConstruct
    public void start() {
        long tickMs = config.getRemovalTick().toMillis();
        long sweepMs = config.getSweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runDueRemovalsSafely, tickMs, tickMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::sweepSafely, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        logger.info("🩺 Seguimiento de presencia iniciado (gracia {}s, barrido cada {}s)",
                config.getGracePeriod().getSeconds(), config.getSweepInterval().getSeconds());
    }

    public void setDepartureListener(DepartureListener listener) {
        this.departureListener = listener;
    }

    // ==================== SALUD DE CONEXIONES ====================

    public void connectionOpened(String connectionId) {
        health.put(connectionId, new ConnectionHealth(connectionId, clock.instant()));
    }

    public void recordHeartbeat(String connectionId, Instant now) {
        ConnectionHealth h = health.computeIfAbsent(connectionId, id -> new ConnectionHealth(id, now));
        h.setLastHeartbeatAt(now);
    }

    public void connectionClosed(String connectionId) {
        ConnectionHealth h = health.get(connectionId);
        if (h != null)
            h.markDisconnected(clock.instant());
    }

    public ConnectionHealth getHealth(String connectionId) {
        return connectionId != null ? health.get(connectionId) : null;
    }

    public boolean isConnected(String connectionId) {
        ConnectionHealth h = getHealth(connectionId);
        return h != null && h.isConnected();
    }

    // ==================== SALIDA DIFERIDA ====================

    public void scheduleRemoval(String connectionId, String roomId) {
        Instant dueAt = clock.instant().plus(config.getGracePeriod());
        pendingRemovals.put(connectionId, new PendingRemoval(roomId, dueAt));
        logger.debug("⏳ Salida de {} de la sala {} programada para {}", connectionId, roomId, dueAt);
    }

    public boolean cancelRemoval(String connectionId) {
        if (connectionId == null)
            return false;
        PendingRemoval cancelled = pendingRemovals.remove(connectionId);
        if (cancelled != null)
            logger.debug("🛑 Salida de {} de la sala {} cancelada", connectionId, cancelled.roomId());
        return cancelled != null;
    }

    public boolean hasPendingRemoval(String connectionId) {
        return pendingRemovals.containsKey(connectionId);
    }

    /**
     * Dispara cada salida cuyo periodo de gracia ya venció.
     *
     * @return número de salidas entregadas al listener
     */
    public int runDueRemovals() {
        Instant now = clock.instant();
        int fired = 0;
        for (Map.Entry<String, PendingRemoval> e : pendingRemovals.entrySet()) {
            PendingRemoval removal = e.getValue();
            if (removal.dueAt().isAfter(now))
                continue;
            // una cancelación o reprogramación concurrente gana a este vencimiento
            if (!pendingRemovals.remove(e.getKey(), removal))
                continue;
            DepartureListener listener = departureListener;
            if (listener != null) {
                listener.onGraceExpired(removal.roomId(), e.getKey());
                fired++;
            }
        }
        return fired;
    }

    // ==================== BARRIDO ====================

    /**
     * Una pasada por todas las salas y registros de salud. Idempotente: si no encuentra nada
     * caducado no cambia nada.
     */
    public void sweep() {
        Instant now = clock.instant();
        for (Room room : registry.getAllRooms()) {
            sweepRoom(room, now);
        }
        purgeConnectionHealth(now);
    }

    private void sweepRoom(Room room, Instant now) {
        DepartureListener listener = departureListener;
        synchronized (room) {
            if (room.isClosed())
                return;

            if (isOlderThan(room.getLastActiveAt(), now, config.getRoomInactivityTimeout())
                    || (room.isEmpty() && isOlderThan(room.getLastActiveAt(), now, config.getParticipantRetention()))) {
                logger.warn("💀 Sala {} expirada (participantes: {}, última actividad {})",
                        room.getRoomId(), room.getParticipantCount(), room.getLastActiveAt());
                if (listener != null)
                    listener.onRoomExpired(room);
                else
                    registry.deleteRoom(room);
                publisher.publishEvent(RoomHealthSystem.Event.roomExpired(this, room.getRoomId()));
                return;
            }

            List<Participant> lost = new ArrayList<>();
            List<String> expired = new ArrayList<>();
            for (Participant p : room.getParticipants()) {
                if (p.isActive()) {
                    if (isOlderThan(p.getLastHeartbeatAt(), now, config.getDeadConnectionThreshold())
                            && !broadcaster.isOpen(p.getConnectionId())) {
                        p.markDisconnected(now);
                        lost.add(p);
                    }
                } else if (isOlderThan(p.getDisconnectedAt(), now, config.getParticipantRetention())) {
                    expired.add(p.getConnectionId());
                }
            }

            for (Participant p : lost) {
                String roomId = room.getRoomId();
                logger.warn("📡 Conexión perdida: {} ({}) en sala {}", p.getDisplayName(), p.getConnectionId(), roomId);
                broadcaster.toRoom(room, SyncMsg.userConnectionLost(now.toEpochMilli(), roomId, p.getConnectionId(),
                        p.getDisplayName()), p.getConnectionId());
                if (room.isHost(p.getConnectionId())) {
                    broadcaster.toFollowers(room,
                            SyncMsg.hostConnectionLost(now.toEpochMilli(), roomId, p.getConnectionId()), null);
                    publisher.publishEvent(RoomHealthSystem.Event.hostLost(this, roomId, p.getConnectionId()));
                } else {
                    publisher.publishEvent(RoomHealthSystem.Event.connectionLost(this, roomId, p.getConnectionId()));
                }
            }
            if (!lost.isEmpty()) {
                broadcaster.toRoom(room, SyncMsg.roomHealthStatus(now.toEpochMilli(), room.getRoomId(),
                        room.getActiveViewerCount(), room.getChatOnlyCount(), room.isHostConnected(), room.getHostId()),
                        null);
            }

            for (String connectionId : expired) {
                logger.info("⌛ Participante {} expirado de la sala {}", connectionId, room.getRoomId());
                cancelRemoval(connectionId);
                if (listener != null)
                    listener.onParticipantExpired(room, connectionId);
                publisher.publishEvent(RoomHealthSystem.Event.participantExpired(this, room.getRoomId(), connectionId));
            }
        }
    }

    private void purgeConnectionHealth(Instant now) {
        health.entrySet().removeIf(entry -> {
            ConnectionHealth h = entry.getValue();
            boolean stale = !h.isConnected() && isOlderThan(h.getDisconnectedAt(), now, config.getConnectionRetention());
            if (stale) {
                logger.debug("🧹 Purgando registro de salud de {}", entry.getKey());
                publisher.publishEvent(RoomHealthSystem.Event.connectionPurged(this, entry.getKey()));
            }
            return stale;
        });
    }

    private static boolean isOlderThan(Instant instant, Instant now, Duration age) {
        return instant != null && instant.isBefore(now.minus(age));
    }

    private void runDueRemovalsSafely() {
        try {
            runDueRemovals();
        } catch (Exception e) {
            logger.error("💥 Error venciendo periodos de gracia: {}", e.getMessage(), e);
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (Exception e) {
            logger.error("💥 Error en el barrido de presencia: {}", e.getMessage(), e);
        }
    }

    private record PendingRemoval(String roomId, Instant dueAt) {
    }

    /**
     * Recibe las salidas que decide el tracker. Lo implementa el coordinador, dueño de los
     * efectos sobre la membresía.
     */
    public interface DepartureListener {
        void onGraceExpired(String roomId, String connectionId);

        void onParticipantExpired(Room room, String connectionId);

        void onRoomExpired(Room room);
    }
}
