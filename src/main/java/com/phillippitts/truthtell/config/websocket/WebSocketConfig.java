package com.phillippitts.truthtell.config.websocket;

import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.presentation.websocket.LiveStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the live stream endpoint at {@code /ws/live}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String LIVE_ENDPOINT = "/ws/live";

    private final LiveStreamWebSocketHandler handler;
    private final LiveStreamProperties properties;

    public WebSocketConfig(LiveStreamWebSocketHandler handler, LiveStreamProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, LIVE_ENDPOINT)
                .setAllowedOrigins(properties.getAllowedOrigins().toArray(new String[0]));
    }
}
