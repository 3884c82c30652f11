package me.golemcore.negotiation.domain.participant;

import me.golemcore.negotiation.domain.model.Utterance;

import java.util.List;

/**
 * What a participant sees when asked for its turn: the current attempt's
 * transcript segment only.
 */
public record TurnContext(String sessionId, int attempt, String kickoffTask, List<Utterance> segment) {

    public TurnContext {
        segment = segment != null ? List.copyOf(segment) : List.of();
    }
}
