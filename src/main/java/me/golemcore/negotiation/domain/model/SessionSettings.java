package me.golemcore.negotiation.domain.model;

/**
 * Per-session limits captured at creation time.
 */
public record SessionSettings(int messageBudget, int retryBound, String kickoffTask) {

    public SessionSettings {
        if (messageBudget < 1) {
            throw new IllegalArgumentException("messageBudget must be positive");
        }
        if (retryBound < 0) {
            throw new IllegalArgumentException("retryBound must not be negative");
        }
    }
}
