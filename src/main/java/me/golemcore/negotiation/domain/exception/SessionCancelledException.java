package me.golemcore.negotiation.domain.exception;

/**
 * Thrown to callers blocked on, or feeding into, a session that was stopped.
 */
public class SessionCancelledException extends NegotiationException {

    public SessionCancelledException(String message) {
        super(message);
    }
}
