package me.golemcore.negotiation.domain.model;

/**
 * Lifecycle state of a negotiation session.
 */
public enum SessionState {
    CREATED, RUNNING, COMPLETED, STOPPED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}
