package me.golemcore.negotiation.domain.exception;

/**
 * Thrown when input is fed to a participant whose turns are generated.
 */
public class NotManualParticipantException extends NegotiationException {

    private final String participantId;

    public NotManualParticipantException(String participantId) {
        super("Participant " + participantId + " does not accept manual input");
        this.participantId = participantId;
    }

    public String getParticipantId() {
        return participantId;
    }
}
