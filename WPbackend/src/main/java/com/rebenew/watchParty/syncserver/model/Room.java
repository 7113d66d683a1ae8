package com.rebenew.watchParty.syncserver.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Un dominio de sincronización. El monitor de la propia sala es su ámbito de exclusión: toda
 * lectura-modificación de participantes, host, streaming o snapshot corre dentro de
 * {@code synchronized (room)}. Las lecturas sueltas desde fuera (estadísticas, diagnóstico) usan
 * los campos volatile y pueden ver un estado algo anterior.
 */
public class Room {
    // IDENTIFICACIÓN
    private final String roomId;
    private final Instant createdAt;
    private volatile Instant lastActiveAt;

    // MIEMBROS, en orden de llegada
    private final List<Participant> participants = new ArrayList<>();
    private volatile String hostId;
    private volatile boolean closed = false;

    // REPRODUCCIÓN
    private volatile StreamingInfo streamingInfo = StreamingInfo.STOPPED;
    private volatile SyncSnapshot syncState;

    public Room(String roomId, Instant now) {
        this.roomId = roomId;
        this.createdAt = now;
        this.lastActiveAt = now;
    }

    // ========== MIEMBROS ==========

    public synchronized Optional<Participant> findParticipant(String connectionId) {
        if (connectionId == null)
            return Optional.empty();
        for (Participant p : participants) {
            if (connectionId.equals(p.getConnectionId()))
                return Optional.of(p);
        }
        return Optional.empty();
    }

    /**
     * Añade al participante, o sustituye el registro que ya tenía la misma conexión conservando
     * su posición en el orden de llegada.
     */
    public synchronized void addOrReplace(Participant participant) {
        for (int i = 0; i < participants.size(); i++) {
            if (participants.get(i).getConnectionId().equals(participant.getConnectionId())) {
                participants.set(i, participant);
                return;
            }
        }
        participants.add(participant);
    }

    public synchronized Optional<Participant> removeParticipant(String connectionId) {
        Optional<Participant> found = findParticipant(connectionId);
        found.ifPresent(participants::remove);
        return found;
    }

    public synchronized List<Participant> getParticipants() {
        return Collections.unmodifiableList(new ArrayList<>(participants));
    }

    public synchronized List<UserView> userViews() {
        return participants.stream().map(Participant::toView).collect(Collectors.toList());
    }

    public synchronized boolean isEmpty() {
        return participants.isEmpty();
    }

    public synchronized int getParticipantCount() {
        return participants.size();
    }

    public synchronized int getChatOnlyCount() {
        return (int) participants.stream().filter(Participant::isChatOnly).count();
    }

    // Seguidores conectados; ni el host ni los chat-only cuentan como viewers
    public synchronized int getActiveViewerCount() {
        return (int) participants.stream().filter(p -> p.isActive() && p.isFollower()).count();
    }

    public synchronized boolean isHostConnected() {
        return hostId != null && findParticipant(hostId).map(Participant::isActive).orElse(false);
    }

    public boolean isHost(String connectionId) {
        return hostId != null && hostId.equals(connectionId);
    }

    // ========== ACTIVIDAD / CICLO DE VIDA ==========

    public void touch(Instant now) {
        this.lastActiveAt = now;
    }

    public void close() {
        this.closed = true;
    }

    public RoomResponse toRoomResponse() {
        return new RoomResponse(roomId, hostId, streamingInfo, userViews(), lastActiveAt.toEpochMilli());
    }

    // ========== GETTERS / SETTERS ==========

    public String getRoomId() {
        return roomId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActiveAt() {
        return lastActiveAt;
    }

    public String getHostId() {
        return hostId;
    }

    public void setHostId(String hostId) {
        this.hostId = hostId;
    }

    public boolean isClosed() {
        return closed;
    }

    public StreamingInfo getStreamingInfo() {
        return streamingInfo;
    }

    public void setStreamingInfo(StreamingInfo streamingInfo) {
        this.streamingInfo = streamingInfo;
    }

    public SyncSnapshot getSyncState() {
        return syncState;
    }

    public void setSyncState(SyncSnapshot syncState) {
        this.syncState = syncState;
    }

    @Override
    public String toString() {
        return "Room{" +
                "roomId='" + roomId + '\'' +
                ", hostId='" + hostId + '\'' +
                ", participants=" + participants.size() +
                ", streaming=" + streamingInfo.isStreaming() +
                ", lastActiveAt=" + lastActiveAt +
                '}';
    }
}
