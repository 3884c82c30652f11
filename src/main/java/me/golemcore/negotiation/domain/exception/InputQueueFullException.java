package me.golemcore.negotiation.domain.exception;

/**
 * Thrown when a manual participant already has the maximum number of
 * buffered utterances waiting for its turn.
 */
public class InputQueueFullException extends NegotiationException {

    public InputQueueFullException(String participantId, int depth) {
        super("Input queue for " + participantId + " is full (" + depth + " pending)");
    }
}
