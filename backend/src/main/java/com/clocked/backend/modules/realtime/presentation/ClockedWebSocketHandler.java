package com.clocked.backend.modules.realtime.presentation;

import com.clocked.backend.modules.realtime.application.RealtimeSessionHandler;
import com.clocked.backend.modules.realtime.infrastructure.WebSocketTransportFactory;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
public class ClockedWebSocketHandler extends TextWebSocketHandler {

    private final RealtimeSessionHandler sessionHandler;
    private final WebSocketTransportFactory transportFactory;

    public ClockedWebSocketHandler(RealtimeSessionHandler sessionHandler, WebSocketTransportFactory transportFactory) {
        this.sessionHandler = sessionHandler;
        this.transportFactory = transportFactory;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        Object token = session.getAttributes().get(AccessTokenHandshakeInterceptor.ACCESS_TOKEN_ATTRIBUTE);
        sessionHandler.open(transportFactory.wrap(session), token instanceof String value ? value : null);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        sessionHandler.handleText(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        sessionHandler.transportError(session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessionHandler.closed(session.getId(), status.getCode());
    }
}
