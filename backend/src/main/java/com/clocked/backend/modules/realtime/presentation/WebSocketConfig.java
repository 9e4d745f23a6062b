package com.clocked.backend.modules.realtime.presentation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    @Value("${clocked.realtime.allowed-origin-patterns:*}")
    private String allowedOriginPatterns;

    private final ClockedWebSocketHandler webSocketHandler;
    private final AccessTokenHandshakeInterceptor handshakeInterceptor;

    public WebSocketConfig(ClockedWebSocketHandler webSocketHandler, AccessTokenHandshakeInterceptor handshakeInterceptor) {
        this.webSocketHandler = webSocketHandler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(webSocketHandler, "/ws")
                .addInterceptors(handshakeInterceptor)
                .setAllowedOriginPatterns(allowedOriginPatterns.split(","));
    }
}
