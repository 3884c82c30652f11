package me.golemcore.negotiation.domain.exception;

public class NoSuchSessionException extends NegotiationException {

    private final String sessionId;

    public NoSuchSessionException(String sessionId) {
        super("No such session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
