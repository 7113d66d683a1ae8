package com.rebenew.watchParty.syncserver.controller;

import com.rebenew.watchParty.syncserver.core.RoomRegistry;
import com.rebenew.watchParty.syncserver.core.SessionCoordinator;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.RoomResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Controlador para gestión de salas de watch party por HTTP.
 *
 * Flujo principal:
 * 1. Host crea sala → 2. Comparte roomId → 3. Usuarios se unen vía WebSocket
 */
@RestController
public class RoomController {
    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    private final SessionCoordinator coordinator;
    private final RoomRegistry registry;
    private final Clock clock;

    public RoomController(SessionCoordinator coordinator, RoomRegistry registry, Clock clock) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.clock = clock;
    }

    /**
     * Reserva una sala nueva.
     *
     * @return {"roomId": "K3J9QZ"}
     */
    @PostMapping("/create-room")
    public ResponseEntity<Map<String, String>> createRoom() {
        try {
            String roomId = coordinator.createRoom();
            logger.info("✅ API creó nueva sala: {}", roomId);
            return ResponseEntity.ok(Map.of("roomId", roomId));
        } catch (Exception e) {
            logger.error("🚨 Error inesperado creando sala: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(Map.of("error", "internal_server_error"));
        }
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable String roomId) {
        logger.debug("🔍 Buscando sala: {}", roomId);

        if (roomId == null || roomId.trim().isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        Room room = registry.getRoom(roomId);
        if (room == null) {
            logger.warn("❌ Búsqueda de sala inexistente: {}", roomId);
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(room.toRoomResponse());
    }

    /**
     * Todas las salas activas (debug/administración).
     */
    @GetMapping("/rooms")
    public ResponseEntity<Map<String, Object>> getAllRooms() {
        logger.debug("📋 Listando todas las salas activas");
        List<RoomResponse> rooms = registry.getAllRooms().stream()
                .sorted(Comparator.comparing(Room::getCreatedAt))
                .map(Room::toRoomResponse)
                .collect(Collectors.toList());

        Map<String, Object> response = new HashMap<>();
        response.put("totalRooms", rooms.size());
        response.put("rooms", rooms);
        response.put("timestamp", clock.millis());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        logger.debug("❤️ Health check solicitado");

        Map<String, Object> healthInfo = new HashMap<>(coordinator.getServiceStats());
        healthInfo.put("status", "healthy");
        healthInfo.put("service", "watch-party-sync");
        return ResponseEntity.ok(healthInfo);
    }
}
