package me.golemcore.negotiation.domain.exception;

/**
 * Thrown when a requested roster cannot form a session: no participants,
 * blank or duplicated ids, missing kind, or an unknown coordinator.
 */
public class InvalidRosterException extends NegotiationException {

    public InvalidRosterException(String message) {
        super("Invalid roster: " + message);
    }

    public InvalidRosterException(String message, Throwable cause) {
        super("Invalid roster: " + message, cause);
    }
}
