package me.golemcore.negotiation.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.adapter.inbound.web.SessionEventMapper;
import me.golemcore.negotiation.adapter.inbound.web.dto.CreateNegotiationRequest;
import me.golemcore.negotiation.adapter.inbound.web.dto.FeedInputRequest;
import me.golemcore.negotiation.adapter.inbound.web.dto.ParticipantRequest;
import me.golemcore.negotiation.adapter.inbound.web.dto.SessionEventDto;
import me.golemcore.negotiation.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.negotiation.adapter.inbound.web.dto.TypingRequest;
import me.golemcore.negotiation.adapter.inbound.web.dto.UtteranceDto;
import me.golemcore.negotiation.domain.event.EventSubscription;
import me.golemcore.negotiation.domain.exception.InvalidRosterException;
import me.golemcore.negotiation.domain.model.ParticipantKind;
import me.golemcore.negotiation.domain.model.ParticipantSpec;
import me.golemcore.negotiation.domain.model.RosterSpec;
import me.golemcore.negotiation.domain.service.NegotiationSession;
import me.golemcore.negotiation.port.inbound.NegotiationPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Negotiation session lifecycle, manual input and event stream endpoints.
 */
@RestController
@RequestMapping("/api/negotiations")
@RequiredArgsConstructor
@Slf4j
public class NegotiationsController {

    private final NegotiationPort negotiationPort;

    @PostMapping
    public Mono<ResponseEntity<SessionSummaryDto>> createSession(@RequestBody CreateNegotiationRequest request) {
        NegotiationSession session = negotiationPort.createSession(toRoster(request));
        log.info("[API] negotiation created: sessionId={}", session.getId());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(SessionEventMapper.toSummary(session)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = negotiationPort.listSessions().stream()
                .map(SessionEventMapper::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionSummaryDto>> getSession(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(SessionEventMapper.toSummary(negotiationPort.getSession(id))));
    }

    @GetMapping("/{id}/history")
    public Mono<ResponseEntity<List<UtteranceDto>>> getHistory(@PathVariable String id) {
        List<UtteranceDto> dtos = negotiationPort.getHistory(id).stream()
                .map(SessionEventMapper::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping(value = "/{id}/log", produces = "text/markdown;charset=UTF-8")
    public Mono<ResponseEntity<String>> getLog(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(negotiationPort.renderLog(id)));
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SessionEventDto>> streamEvents(@PathVariable String id) {
        EventSubscription subscription = negotiationPort.subscribe(id);
        log.info("[API] event stream opened: sessionId={}, subscription={}", id, subscription.getId());
        return subscription.toFlux()
                .map(event -> ServerSentEvent.<SessionEventDto>builder()
                        .event(SessionEventMapper.wireType(event))
                        .data(SessionEventMapper.toDto(event))
                        .build())
                .doFinally(signal -> {
                    log.debug("[API] event stream closed: sessionId={}, signal={}", id, signal);
                    negotiationPort.unsubscribe(id, subscription);
                });
    }

    @PostMapping("/{id}/input")
    public Mono<ResponseEntity<Void>> feedInput(@PathVariable String id, @RequestBody FeedInputRequest request) {
        negotiationPort.feed(id, request.getParticipantId(), request.getText());
        return Mono.just(ResponseEntity.accepted().build());
    }

    @PostMapping("/{id}/typing")
    public Mono<ResponseEntity<Void>> setTyping(@PathVariable String id, @RequestBody TypingRequest request) {
        negotiationPort.setTyping(id, request.getParticipantId(), request.isActive());
        return Mono.just(ResponseEntity.accepted().build());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> stopSession(@PathVariable String id) {
        negotiationPort.stop(id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private RosterSpec toRoster(CreateNegotiationRequest request) {
        if (request == null) {
            throw new InvalidRosterException("request body is required");
        }
        List<ParticipantSpec> participants = new ArrayList<>();
        if (request.getParticipants() != null) {
            for (ParticipantRequest participant : request.getParticipants()) {
                participants.add(ParticipantSpec.builder()
                        .id(participant.getId())
                        .kind(parseKind(participant))
                        .instruction(participant.getInstruction())
                        .build());
            }
        }
        return RosterSpec.builder()
                .sessionId(request.getSessionId())
                .coordinatorId(request.getCoordinatorId())
                .participants(participants)
                .build();
    }

    private ParticipantKind parseKind(ParticipantRequest participant) {
        String kind = participant.getKind();
        if (kind == null || kind.isBlank()) {
            return null;
        }
        try {
            return ParticipantKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRosterException("unknown participant kind " + kind, e);
        }
    }
}
