package com.meshnexus.realtime;

import com.meshnexus.config.CoordinatorRole;
import com.meshnexus.config.MeshProperties;
import com.meshnexus.exception.SessionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Adapts Spring WebSocket sessions to the {@link RealtimeHub}.
 */
@Component
@CoordinatorRole
@Slf4j
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private final RealtimeHub realtimeHub;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeBytes;

    public RealtimeWebSocketHandler(RealtimeHub realtimeHub, MeshProperties properties) {
        this.realtimeHub = realtimeHub;
        this.sendTimeLimitMs = properties.getRealtime().getSendTimeLimitMs();
        this.sendBufferSizeBytes = properties.getRealtime().getSendBufferSizeBytes();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeBytes);
        realtimeHub.connect(new WebSocketObserverChannel(decorated));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        try {
            realtimeHub.handleMessage(session.getId(), message.getPayload());
        } catch (SessionException e) {
            log.warn("Closing realtime session {}: {}", session.getId(), e.getMessage());
            realtimeHub.disconnect(session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason(e.getMessage()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("WebSocket error for client {}", session.getId(), exception);
        realtimeHub.disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        realtimeHub.disconnect(session.getId());
    }
}
