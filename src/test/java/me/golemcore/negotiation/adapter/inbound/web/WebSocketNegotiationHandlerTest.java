package me.golemcore.negotiation.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.negotiation.domain.consensus.ConsensusValidator;
import me.golemcore.negotiation.domain.exception.NoSuchSessionException;
import me.golemcore.negotiation.domain.model.SessionSettings;
import me.golemcore.negotiation.domain.service.NegotiationSession;
import me.golemcore.negotiation.port.inbound.NegotiationPort;
import me.golemcore.negotiation.testsupport.ScriptedParticipant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketNegotiationHandlerTest {

    private NegotiationPort negotiationPort;
    private WebSocketNegotiationHandler handler;

    @BeforeEach
    void setUp() {
        negotiationPort = mock(NegotiationPort.class);
        handler = new WebSocketNegotiationHandler(negotiationPort, new ObjectMapper());
    }

    @Test
    void shouldRejectConnectionWithoutSessionId() {
        WebSocketSession session = socket("ws://localhost/ws/negotiations");

        StepVerifier.create(handler.handle(session))
                .verifyComplete();
        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verify(negotiationPort, never()).subscribe(anyString());
    }

    @Test
    void shouldRejectConnectionForUnknownSession() {
        WebSocketSession session = socket("ws://localhost/ws/negotiations?sessionId=missing");
        when(negotiationPort.subscribe("missing")).thenThrow(new NoSuchSessionException("missing"));

        StepVerifier.create(handler.handle(session))
                .verifyComplete();
        verify(session).close(CloseStatus.POLICY_VIOLATION);
    }

    @Test
    void shouldRouteInputAndTypingFrames() {
        WebSocketSession session = socket("ws://localhost/ws/negotiations?sessionId=s1");
        when(negotiationPort.subscribe("s1")).thenReturn(liveSession().subscribe());
        when(session.send(any())).thenReturn(Mono.never());
        WebSocketMessage inputFrame = frame("{\"type\":\"input\",\"participantId\":\"p1\",\"text\":\"賛成\"}");
        WebSocketMessage typingFrame = frame("{\"type\":\"typing\",\"participantId\":\"p1\",\"active\":true}");
        WebSocketMessage invalidFrame = frame("not json");
        when(session.receive()).thenReturn(Flux.just(inputFrame, typingFrame, invalidFrame));

        StepVerifier.create(handler.handle(session))
                .verifyComplete();

        verify(negotiationPort).feed("s1", "p1", "賛成");
        verify(negotiationPort).setTyping("s1", "p1", true);
        verify(negotiationPort).unsubscribe(any(), any());
    }

    @Test
    void shouldCloseSocketAfterEndMarker() {
        NegotiationSession negotiation = liveSession();
        negotiation.stop();
        WebSocketSession session = socket("ws://localhost/ws/negotiations?sessionId=s1");
        when(negotiationPort.subscribe("s1")).thenReturn(negotiation.subscribe());
        when(session.send(any())).thenAnswer(invocation -> {
            Flux<WebSocketMessage> outbound = invocation.getArgument(0);
            return outbound.then();
        });
        when(session.textMessage(anyString())).thenReturn(mock(WebSocketMessage.class));
        when(session.receive()).thenReturn(Flux.never());

        StepVerifier.create(handler.handle(session))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(session).close();
    }

    private NegotiationSession liveSession() {
        return new NegotiationSession("s1", "moderator", List.of(ScriptedParticipant.constant("moderator", "x")),
                new SessionSettings(5, 0, null),
                new ConsensusValidator("【AGREE】", "【FINAL_PLAN】", List.of("賛成")), Clock.systemUTC(), 0);
    }

    private WebSocketSession socket(String uri) {
        WebSocketSession session = mock(WebSocketSession.class);
        HandshakeInfo handshakeInfo = mock(HandshakeInfo.class);
        when(session.getHandshakeInfo()).thenReturn(handshakeInfo);
        when(handshakeInfo.getUri()).thenReturn(URI.create(uri));
        when(session.close()).thenReturn(Mono.empty());
        when(session.close(any())).thenReturn(Mono.empty());
        return session;
    }

    private WebSocketMessage frame(String payload) {
        WebSocketMessage message = mock(WebSocketMessage.class);
        when(message.getPayloadAsText()).thenReturn(payload);
        return message;
    }
}
