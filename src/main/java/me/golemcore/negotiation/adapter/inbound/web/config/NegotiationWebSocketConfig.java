package me.golemcore.negotiation.adapter.inbound.web.config;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.adapter.inbound.web.WebSocketNegotiationHandler;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * Exposes the negotiation event socket at {@code negotiation.websocket-path},
 * ahead of the annotated controllers.
 */
@Configuration
@Slf4j
public class NegotiationWebSocketConfig {

    static final int MAPPING_ORDER = -1;

    @Bean
    public HandlerMapping negotiationWebSocketMapping(WebSocketNegotiationHandler handler,
            NegotiationProperties properties) {
        String path = properties.getWebsocketPath();
        if (path == null || path.isBlank() || !path.startsWith("/")) {
            throw new IllegalStateException("negotiation.websocket-path must be an absolute path, got: " + path);
        }
        log.info("[WebSocket] negotiation endpoint mapped: path={}", path);
        return new SimpleUrlHandlerMapping(Map.of(path, handler), MAPPING_ORDER);
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
