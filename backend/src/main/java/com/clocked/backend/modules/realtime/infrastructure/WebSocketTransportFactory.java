package com.clocked.backend.modules.realtime.infrastructure;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.socket.WebSocketSession;

@Component
public class WebSocketTransportFactory {

    private final int sendTimeLimitMillis;
    private final int bufferSizeLimitBytes;

    public WebSocketTransportFactory(
            @Value("${clocked.realtime.send-time-limit:PT10S}") Duration sendTimeLimit,
            @Value("${clocked.realtime.send-buffer-size-limit:512KB}") DataSize bufferSizeLimit
    ) {
        this.sendTimeLimitMillis = Math.toIntExact(sendTimeLimit.toMillis());
        this.bufferSizeLimitBytes = Math.toIntExact(bufferSizeLimit.toBytes());
    }

    public WebSocketSessionTransport wrap(WebSocketSession session) {
        return new WebSocketSessionTransport(session, sendTimeLimitMillis, bufferSizeLimitBytes);
    }
}
