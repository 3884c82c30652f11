package me.golemcore.negotiation.domain.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Event fanned out to the subscribers of one session. Fields that do not apply
 * to the event type are {@code null}.
 */
@Builder
public record SessionEvent(SessionEventType type, String sessionId, String speakerId, String text, Long sequence,
        Integer attempt, Boolean active, Instant timestamp) {

    public static SessionEvent message(String sessionId, Utterance utterance, Instant timestamp) {
        return SessionEvent.builder()
                .type(SessionEventType.MESSAGE)
                .sessionId(sessionId)
                .speakerId(utterance.speakerId())
                .text(utterance.text())
                .sequence(utterance.sequence())
                .attempt(utterance.attempt())
                .timestamp(timestamp)
                .build();
    }

    public static SessionEvent notice(String sessionId, String text, Instant timestamp) {
        return SessionEvent.builder()
                .type(SessionEventType.SYSTEM_NOTICE)
                .sessionId(sessionId)
                .text(text)
                .timestamp(timestamp)
                .build();
    }

    public static SessionEvent typing(String sessionId, String participantId, boolean active, Instant timestamp) {
        return SessionEvent.builder()
                .type(SessionEventType.TYPING)
                .sessionId(sessionId)
                .speakerId(participantId)
                .active(active)
                .timestamp(timestamp)
                .build();
    }

    public static SessionEvent end(String sessionId, Instant timestamp) {
        return SessionEvent.builder()
                .type(SessionEventType.END)
                .sessionId(sessionId)
                .timestamp(timestamp)
                .build();
    }

    public boolean isEnd() {
        return type == SessionEventType.END;
    }
}
