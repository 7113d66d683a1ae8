package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.config.AppConfig;
import com.rebenew.watchParty.syncserver.model.StreamingInfo;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketConnectionGatewayTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final SyncMsg message = SyncMsg.streamingStatus(1000L, "ROOM01", StreamingInfo.STOPPED);

    private WebSocketConnectionGateway gateway;
    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        gateway = new WebSocketConnectionGateway(objectMapper);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("c1");
        when(session.isOpen()).thenReturn(true);
        gateway.register(session);
    }

    @Test
    void sendWritesJsonToTheSession() throws Exception {
        assertThat(gateway.send("c1", message)).isTrue();

        verify(session).sendMessage(any(TextMessage.class));
    }

    @Test
    void sessionRejectingTheWriteIsReportedAsUndelivered() throws Exception {
        doThrow(new IllegalStateException("The WebSocket session has been closed"))
                .when(session).sendMessage(any(TextMessage.class));

        assertThat(gateway.send("c1", message)).isFalse();
    }

    @Test
    void ioFailureIsReportedAsUndelivered() throws Exception {
        doThrow(new IOException("Broken pipe")).when(session).sendMessage(any(TextMessage.class));

        assertThat(gateway.send("c1", message)).isFalse();
    }

    @Test
    void closedOrUnknownSessionIsSkipped() throws Exception {
        when(session.isOpen()).thenReturn(false);

        assertThat(gateway.send("c1", message)).isFalse();
        assertThat(gateway.send("nobody", message)).isFalse();
        verify(session, never()).sendMessage(any(TextMessage.class));
    }
}
