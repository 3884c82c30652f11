package me.golemcore.negotiation.domain.exception;

/**
 * Failure of the completion collaborator for a generated participant. Aborts
 * the current attempt and fails the session without consuming a retry.
 */
public class CollaboratorException extends NegotiationException {

    public enum Kind {
        UNAVAILABLE, TIMEOUT
    }

    private final Kind kind;

    public CollaboratorException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollaboratorException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
