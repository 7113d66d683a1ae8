package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.config.SyncProperties;
import com.rebenew.watchParty.syncserver.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dueño de todas las {@link Room} vivas. Las búsquedas no bloquean; eliminar marca la sala como
 * cerrada para que quien aún tenga la referencia lo vea y vuelva a consultar el registro.
 */
@Component
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final Clock clock;
    private final String alphabet;
    private final int idLength;
    private final Random random;

    @Autowired
    public RoomRegistry(SyncProperties properties, Clock clock) {
        this(properties, clock, new SecureRandom());
    }

    RoomRegistry(SyncProperties properties, Clock clock, Random random) {
        this.clock = clock;
        this.alphabet = properties.getRooms().getIdAlphabet();
        this.idLength = properties.getRooms().getIdLength();
        this.random = random;
    }

    // ====================
    // CREACIÓN DE SALAS
    // ====================

    /**
     * Reserva una sala nueva con un identificador recién sorteado. El put-if-absent lo hace único
     * entre las salas vivas aun con creaciones concurrentes.
     */
    public String createRoom() {
        while (true) {
            String roomId = generateRoomId();
            Room room = new Room(roomId, clock.instant());
            if (rooms.putIfAbsent(roomId, room) == null) {
                logger.info("🎬 Sala creada: {}", roomId);
                return roomId;
            }
            logger.debug("Colisión de id de sala {}, se sortea otro", roomId);
        }
    }

    public Room getOrCreate(String roomId) {
        validateRoomId(roomId);
        return rooms.computeIfAbsent(roomId, id -> {
            logger.info("🎬 Sala creada al primer join: {}", id);
            return new Room(id, clock.instant());
        });
    }

    String generateRoomId() {
        StringBuilder sb = new StringBuilder(idLength);
        for (int i = 0; i < idLength; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return sb.toString();
    }

    // ====================
    // CONSULTA / ELIMINACIÓN
    // ====================

    public Room getRoom(String roomId) {
        return roomId != null ? rooms.get(roomId) : null;
    }

    public boolean roomExists(String roomId) {
        return roomId != null && rooms.containsKey(roomId);
    }

    public Collection<Room> getAllRooms() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }

    /**
     * Quita exactamente esta instancia; una sala más nueva con el mismo id no se toca.
     */
    public boolean deleteRoom(Room room) {
        synchronized (room) {
            room.close();
            boolean removed = rooms.remove(room.getRoomId(), room);
            if (removed)
                logger.info("🗑️ Sala eliminada: {}", room.getRoomId());
            return removed;
        }
    }

    private void validateRoomId(String roomId) {
        if (roomId == null || roomId.trim().isEmpty()) {
            throw new IllegalArgumentException("roomId no puede ser nulo o vacío");
        }
    }
}
