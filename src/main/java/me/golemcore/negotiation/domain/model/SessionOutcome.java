package me.golemcore.negotiation.domain.model;

/**
 * Final result of the retry sequence of one session.
 */
public enum SessionOutcome {
    AGREEMENT_CONFIRMED, CONSENSUS_NOT_REACHED, COLLABORATOR_FAILURE, CANCELLED
}
