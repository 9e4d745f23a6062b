package com.clocked.backend.modules.realtime.infrastructure;

import java.io.IOException;

import com.clocked.backend.modules.realtime.domain.ConnectionTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Adapts a Spring WebSocket session. Sends go through a decorator that serializes writers and
 * terminates the session when the send time or buffer limit is exceeded.
 */
public class WebSocketSessionTransport implements ConnectionTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionTransport.class);

    private final WebSocketSession session;

    public WebSocketSessionTransport(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimitBytes) {
        this.session = new ConcurrentWebSocketSessionDecorator(
                session,
                sendTimeLimitMillis,
                bufferSizeLimitBytes,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE
        );
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String text) throws IOException {
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close(int code, String reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException ex) {
            log.debug("Failed to close session {}: {}", session.getId(), ex.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
