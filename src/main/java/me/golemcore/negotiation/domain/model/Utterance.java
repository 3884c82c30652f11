package me.golemcore.negotiation.domain.model;

import lombok.Builder;

/**
 * One appended turn of a negotiation. The sequence is assigned by the session
 * event bus and grows strictly within a session, across attempts.
 */
@Builder
public record Utterance(String speakerId, String text, long sequence, int attempt) {
}
