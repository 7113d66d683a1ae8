package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.ConnectionGateway;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sesiones WebSocket vivas por connection id. Las escrituras a una sesión se serializan sobre la
 * propia sesión, como exige Spring con emisores concurrentes.
 */
@Component
public class WebSocketConnectionGateway implements ConnectionGateway {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketConnectionGateway.class);

    private final ConcurrentHashMap<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public WebSocketConnectionGateway(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
    }

    @Override
    public boolean send(String connectionId, SyncMsg message) {
        WebSocketSession session = connectionId != null ? sessions.get(connectionId) : null;
        if (session == null)
            return false;
        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializando {} para {}: {}", message, connectionId, e.getMessage(), e);
            return false;
        }
        return safeSend(session, json);
    }

    @Override
    public boolean isOpen(String connectionId) {
        WebSocketSession session = connectionId != null ? sessions.get(connectionId) : null;
        return session != null && session.isOpen();
    }

    @Override
    public int openConnectionCount() {
        return (int) sessions.values().stream().filter(WebSocketSession::isOpen).count();
    }

    private boolean safeSend(WebSocketSession session, String json) {
        try {
            if (!session.isOpen())
                return false;
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
            return true;
        } catch (IOException e) {
            logger.warn("⚠️ Error enviando mensaje WebSocket a sesión {}: {}", session.getId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            // sesión cerrada a mitad de envío o en estado inválido
            logger.warn("⚠️ Sesión {} rechazó el envío: {}", session.getId(), e.toString());
            return false;
        }
    }
}
