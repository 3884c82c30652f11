package me.golemcore.negotiation.domain.exception;

/**
 * Base exception for negotiation-specific errors. Boundary adapters translate
 * subclasses into transport status codes.
 */
public class NegotiationException extends RuntimeException {

    public NegotiationException(String message) {
        super(message);
    }

    public NegotiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
