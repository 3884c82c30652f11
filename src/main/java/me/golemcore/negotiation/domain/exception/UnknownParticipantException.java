package me.golemcore.negotiation.domain.exception;

public class UnknownParticipantException extends NegotiationException {

    private final String participantId;

    public UnknownParticipantException(String sessionId, String participantId) {
        super("Participant " + participantId + " is not part of session " + sessionId);
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}
