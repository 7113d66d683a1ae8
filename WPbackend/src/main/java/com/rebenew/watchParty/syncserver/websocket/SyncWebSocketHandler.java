package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.SessionCoordinator;
import com.rebenew.watchParty.syncserver.core.SignalingRelay;
import com.rebenew.watchParty.syncserver.core.SyncStateEngine;
import com.rebenew.watchParty.syncserver.model.InboundMessage;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;

/**
 * Punto de entrada WebSocket: decodifica cada mensaje y lo despacha al componente que lo atiende.
 */
@Component
public class SyncWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(SyncWebSocketHandler.class);

    private final SessionCoordinator coordinator;
    private final SyncStateEngine syncEngine;
    private final SignalingRelay signaling;
    private final WebSocketConnectionGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SyncWebSocketHandler(SessionCoordinator coordinator, SyncStateEngine syncEngine, SignalingRelay signaling,
            WebSocketConnectionGateway gateway, ObjectMapper objectMapper, Clock clock) {
        this.coordinator = coordinator;
        this.syncEngine = syncEngine;
        this.signaling = signaling;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.clock = clock;
        logger.info("✅ SyncWebSocketHandler inicializado");
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        logger.info("🔄 Nueva conexión WebSocket: {}", session.getId());
        gateway.register(session);
        coordinator.onConnectionOpened(session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        String connectionId = session.getId();
        InboundMessage inbound;
        try {
            inbound = objectMapper.readValue(message.getPayload(), InboundMessage.class);
        } catch (JsonProcessingException e) {
            logger.warn("❌ Error parseando mensaje de {}: {}", connectionId, e.getOriginalMessage());
            gateway.send(connectionId, SyncMsg.error(clock.millis(), "invalid_message", "Mensaje mal formado o desconocido"));
            return;
        }
        if (inbound == null) {
            gateway.send(connectionId, SyncMsg.error(clock.millis(), "invalid_message", "Mensaje vacío"));
            return;
        }

        try {
            dispatch(connectionId, inbound);
        } catch (IllegalArgumentException e) {
            logger.warn("❌ {} inválido de {}: {}", inbound.inboundType(), connectionId, e.getMessage());
            gateway.send(connectionId, SyncMsg.error(clock.millis(), "invalid_request", e.getMessage()));
        } catch (Exception e) {
            logger.error("❌ Error procesando {} de {}: {}", inbound.inboundType(), connectionId, e.getMessage(), e);
            gateway.send(connectionId,
                    SyncMsg.error(clock.millis(), "processing_error", "No se pudo procesar el mensaje"));
        }
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String roomId = coordinator.roomOf(session.getId());
        gateway.unregister(session.getId());
        coordinator.onDisconnect(session.getId());
        if (roomId != null) {
            logger.info("🔌 Conexión cerrada: {} - Sala: {} ({})", session.getId(), roomId, status);
        } else {
            logger.info("🔌 Conexión cerrada: {} ({})", session.getId(), status);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== PROCESAMIENTO PRINCIPAL ====================

    private void dispatch(String connectionId, InboundMessage inbound) {
        switch (inbound.inboundType()) {
            case JOIN_ROOM: {
                InboundMessage.JoinRoom msg = (InboundMessage.JoinRoom) inbound;
                coordinator.join(connectionId, msg.roomId(), msg.username(), msg.isHost(), msg.isChatOnly(),
                        msg.previousConnectionId());
                break;
            }
            case LEAVE_ROOM:
                coordinator.leave(connectionId);
                break;
            case HEARTBEAT: {
                InboundMessage.Heartbeat msg = (InboundMessage.Heartbeat) inbound;
                coordinator.heartbeat(connectionId, msg.roomId(), msg.timestamp());
                break;
            }
            case PEER_ID: {
                InboundMessage.PeerIdRegistration msg = (InboundMessage.PeerIdRegistration) inbound;
                signaling.registerPeer(msg.roomId(), connectionId, msg.peerId(), msg.previousConnectionId());
                break;
            }
            case VIDEO_STATE_CHANGE: {
                InboundMessage.VideoStateChange msg = (InboundMessage.VideoStateChange) inbound;
                syncEngine.applyHostUpdate(msg.roomId(), connectionId, msg.videoState());
                break;
            }
            case VIDEO_SEEK_OPERATION: {
                InboundMessage.VideoSeekOperation msg = (InboundMessage.VideoSeekOperation) inbound;
                syncEngine.applySeek(msg.roomId(), connectionId, msg.seekTime(), msg.isPlaying(),
                        msg.sourceTimestamp());
                break;
            }
            case FALLBACK_SYNC_STATE: {
                InboundMessage.FallbackSyncState msg = (InboundMessage.FallbackSyncState) inbound;
                syncEngine.fallbackSync(msg.roomId(), connectionId, msg.currentTime(), msg.isPlaying(),
                        msg.targetConnectionId());
                break;
            }
            case STREAMING_STATUS_UPDATE: {
                InboundMessage.StreamingStatusUpdate msg = (InboundMessage.StreamingStatusUpdate) inbound;
                coordinator.updateStreamingStatus(connectionId, msg.roomId(), msg.streaming(), msg.fileName(),
                        msg.fileType());
                break;
            }
            case STREAMING_ABOUT_TO_START:
                coordinator.streamingAboutToStart(connectionId, ((InboundMessage.StreamingAboutToStart) inbound).roomId());
                break;
            case SEND_MESSAGE: {
                InboundMessage.SendMessage msg = (InboundMessage.SendMessage) inbound;
                coordinator.sendChat(connectionId, msg.roomId(), msg.message(), msg.username());
                break;
            }
            case SIGNAL: {
                InboundMessage.Signal msg = (InboundMessage.Signal) inbound;
                signaling.forwardSignal(connectionId, msg.to(), msg.signal(), msg.signalType());
                break;
            }
            case ICE_CANDIDATE: {
                InboundMessage.IceCandidate msg = (InboundMessage.IceCandidate) inbound;
                signaling.forwardIceCandidate(connectionId, msg.to(), msg.candidate());
                break;
            }
            case WEBRTC_CONNECTION_FAILED: {
                InboundMessage.WebRtcConnectionFailed msg = (InboundMessage.WebRtcConnectionFailed) inbound;
                signaling.reportConnectionFailure(msg.roomId(), connectionId, msg.targetPeerId());
                break;
            }
            case REQUEST_RECONNECTION: {
                InboundMessage.RequestReconnection msg = (InboundMessage.RequestReconnection) inbound;
                signaling.requestReconnection(msg.roomId(), connectionId, msg.viewerPeerId());
                break;
            }
            case CONNECTION_HEALTH_CHECK:
                coordinator.connectionHealthCheck(connectionId, ((InboundMessage.ConnectionHealthCheck) inbound).roomId());
                break;
            case CREATE_ROOM: {
                String roomId = coordinator.createRoom();
                gateway.send(connectionId, SyncMsg.roomCreated(clock.millis(), roomId,
                        ((InboundMessage.CreateRoom) inbound).correlationId()));
                break;
            }
            default:
                gateway.send(connectionId,
                        SyncMsg.error(clock.millis(), "unknown_message_type", inbound.inboundType().name()));
        }
    }
}
