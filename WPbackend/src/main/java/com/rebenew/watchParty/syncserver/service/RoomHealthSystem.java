package com.rebenew.watchParty.syncserver.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Sistema completo de eventos de salud para salas, emitidos por el barrido de presencia.
 */
public class RoomHealthSystem {

    public enum Action {
        CONNECTION_LOST,      // participante en silencio y transporte cerrado
        HOST_LOST,            // ídem, para el host de la sala
        PARTICIPANT_EXPIRED,  // inactivo más allá de la retención
        ROOM_EXPIRED,         // sala inactiva más allá del timeout, o reservada y nunca usada
        CONNECTION_PURGED     // registro de salud de una conexión cerrada hace tiempo
    }

    @Getter
    public static class Event extends ApplicationEvent {
        private final String roomId;
        private final Action action;
        private final String connectionId;

        public Event(Object source, String roomId, Action action) {
            this(source, roomId, action, null);
        }

        public Event(Object source, String roomId, Action action, String connectionId) {
            super(source);
            this.roomId = roomId;
            this.action = action;
            this.connectionId = connectionId;
        }

        @JsonProperty("timestamp")
        public long getEventTimestamp() {
            return super.getTimestamp();
        }

        public static Event connectionLost(Object source, String roomId, String connectionId) {
            return new Event(source, roomId, Action.CONNECTION_LOST, connectionId);
        }

        public static Event hostLost(Object source, String roomId, String connectionId) {
            return new Event(source, roomId, Action.HOST_LOST, connectionId);
        }

        public static Event participantExpired(Object source, String roomId, String connectionId) {
            return new Event(source, roomId, Action.PARTICIPANT_EXPIRED, connectionId);
        }

        public static Event roomExpired(Object source, String roomId) {
            return new Event(source, roomId, Action.ROOM_EXPIRED);
        }

        public static Event connectionPurged(Object source, String connectionId) {
            return new Event(source, null, Action.CONNECTION_PURGED, connectionId);
        }

        @Override
        public String toString() {
            return "RoomHealthEvent{" +
                    "roomId='" + roomId + '\'' +
                    ", action=" + action +
                    (connectionId != null ? ", connectionId='" + connectionId + '\'' : "") +
                    ", timestamp=" + super.getTimestamp() +
                    '}';
        }
    }
}
