package me.golemcore.negotiation.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.event.EventSubscription;
import me.golemcore.negotiation.domain.exception.NegotiationException;
import me.golemcore.negotiation.domain.model.SessionEvent;
import me.golemcore.negotiation.port.inbound.NegotiationPort;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Reactive WebSocket handler bound to one negotiation session, selected by the
 * {@code sessionId} query parameter. Outbound frames carry session events as
 * JSON; inbound frames are JSON commands:
 * {@code {"type":"input","participantId":"...","text":"..."}} or
 * {@code {"type":"typing","participantId":"...","active":true}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketNegotiationHandler implements WebSocketHandler {

    private final NegotiationPort negotiationPort;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String sessionId = extractSessionId(session);
        if (sessionId == null || sessionId.isBlank()) {
            log.warn("[WebSocket] Connection rejected: missing sessionId");
            return session.close(CloseStatus.POLICY_VIOLATION);
        }

        EventSubscription subscription;
        try {
            subscription = negotiationPort.subscribe(sessionId);
        } catch (NegotiationException e) {
            log.warn("[WebSocket] Connection rejected: {}", e.getMessage());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }
        log.info("[WebSocket] Connection established: sessionId={}, subscription={}", sessionId,
                subscription.getId());

        Flux<WebSocketMessage> outbound = subscription.toFlux()
                .map(event -> session.textMessage(toJson(event)));

        Mono<Void> inbound = session.receive()
                .doOnNext(message -> handleIncoming(message, sessionId))
                .then();

        Mono<Void> sending = session.send(outbound).then(session.close());

        return Mono.firstWithSignal(sending, inbound)
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: sessionId={}, signal={}", sessionId, signal);
                    negotiationPort.unsubscribe(sessionId, subscription);
                });
    }

    private void handleIncoming(WebSocketMessage wsMessage, String sessionId) {
        try {
            String payload = wsMessage.getPayloadAsText();
            @SuppressWarnings("unchecked")
            Map<String, Object> json = objectMapper.readValue(payload, Map.class);

            String type = asString(json.get("type"));
            String participantId = asString(json.get("participantId"));
            if ("input".equals(type)) {
                String text = asString(json.get("text"));
                if (text == null || text.isBlank()) {
                    return;
                }
                negotiationPort.feed(sessionId, participantId, text);
            } else if ("typing".equals(type)) {
                negotiationPort.setTyping(sessionId, participantId, Boolean.TRUE.equals(json.get("active")));
            } else {
                log.debug("[WebSocket] Ignoring message type: {}", type);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - one bad frame must not close the socket
            log.warn("[WebSocket] Failed to process incoming message: {}", e.getMessage());
        }
    }

    private String toJson(SessionEvent event) {
        try {
            return objectMapper.writeValueAsString(SessionEventMapper.toDto(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session event", e);
        }
    }

    private String extractSessionId(WebSocketSession session) {
        URI uri = session.getHandshakeInfo().getUri();
        String query = uri.getQuery();
        if (query != null) {
            return UriComponentsBuilder.newInstance()
                    .query(query)
                    .build()
                    .getQueryParams()
                    .getFirst("sessionId");
        }
        return null;
    }

    private String asString(Object value) {
        if (value instanceof String stringValue) {
            return stringValue;
        }
        return null;
    }
}
