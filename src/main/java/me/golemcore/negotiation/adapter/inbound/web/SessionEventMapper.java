package me.golemcore.negotiation.adapter.inbound.web;

import me.golemcore.negotiation.adapter.inbound.web.dto.SessionEventDto;
import me.golemcore.negotiation.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.negotiation.adapter.inbound.web.dto.UtteranceDto;
import me.golemcore.negotiation.domain.model.ParticipantKind;
import me.golemcore.negotiation.domain.model.SessionEvent;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.service.NegotiationSession;

/**
 * Converts domain sessions and events to their wire DTOs.
 */
public final class SessionEventMapper {

    private SessionEventMapper() {
    }

    public static SessionEventDto toDto(SessionEvent event) {
        return SessionEventDto.builder()
                .type(wireType(event))
                .sessionId(event.sessionId())
                .speaker(event.speakerId())
                .text(event.text())
                .sequence(event.sequence())
                .attempt(event.attempt())
                .active(event.active())
                .timestamp(event.timestamp() != null ? event.timestamp().toString() : null)
                .build();
    }

    public static String wireType(SessionEvent event) {
        return switch (event.type()) {
            case MESSAGE -> "message";
            case SYSTEM_NOTICE -> "system";
            case TYPING -> "typing";
            case END -> "end";
        };
    }

    public static UtteranceDto toDto(Utterance utterance) {
        return UtteranceDto.builder()
                .sequence(utterance.sequence())
                .attempt(utterance.attempt())
                .speaker(utterance.speakerId())
                .text(utterance.text())
                .build();
    }

    public static SessionSummaryDto toSummary(NegotiationSession session) {
        return SessionSummaryDto.builder()
                .id(session.getId())
                .state(session.getState().name())
                .outcome(session.getOutcome() != null ? session.getOutcome().name() : null)
                .attempt(session.getAttemptCount())
                .coordinatorId(session.getCoordinatorId())
                .currentParticipantId(session.getCurrentParticipantId())
                .generatedParticipants(session.getParticipantIds(ParticipantKind.GENERATED))
                .manualParticipants(session.getParticipantIds(ParticipantKind.MANUAL))
                .utteranceCount(session.getHistory().size())
                .createdAt(session.getCreatedAt().toString())
                .build();
    }
}
