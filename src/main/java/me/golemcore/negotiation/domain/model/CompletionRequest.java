package me.golemcore.negotiation.domain.model;

import lombok.Builder;

import java.util.List;

/**
 * Input for one completion call: the participant's role instruction, the
 * session's opening task, and the current attempt's transcript.
 */
@Builder
public record CompletionRequest(String sessionId, String participantId, String instruction, String kickoffTask,
        List<Utterance> transcript) {

    public CompletionRequest {
        transcript = transcript != null ? List.copyOf(transcript) : List.of();
    }
}
