package me.golemcore.negotiation.domain.model;

import java.util.List;

/**
 * Outcome of one attempt: the termination reason, the utterances appended by
 * that attempt, and the failure when the collaborator broke the attempt.
 */
public record AttemptResult(int attempt, TerminationReason reason, List<Utterance> segment, Throwable failure) {

    public AttemptResult {
        segment = segment != null ? List.copyOf(segment) : List.of();
    }

    public static AttemptResult of(int attempt, TerminationReason reason, List<Utterance> segment) {
        return new AttemptResult(attempt, reason, segment, null);
    }
}
