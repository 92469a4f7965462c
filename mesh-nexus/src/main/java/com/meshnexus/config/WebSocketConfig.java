package com.meshnexus.config;

import com.meshnexus.realtime.RealtimeWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@CoordinatorRole
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler handler;
    private final MeshProperties properties;

    public WebSocketConfig(RealtimeWebSocketHandler handler, MeshProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getRealtime().getPath())
                .setAllowedOriginPatterns(properties.getRealtime().getAllowedOrigins());
    }
}
