package com.chatrelay.server.config;

import com.chatrelay.server.ws.RealtimeHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeHandler handler;

    @Value("${realtime.ws.path:/ws}")
    private String path;

    @Value("${realtime.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(RealtimeHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path).setAllowedOriginPatterns(allowedOrigins);
    }
}
