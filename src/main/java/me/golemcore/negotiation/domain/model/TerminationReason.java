package me.golemcore.negotiation.domain.model;

/**
 * Why a single negotiation attempt stopped issuing turns.
 */
public enum TerminationReason {
    /** The coordinator produced a candidate agreement; validity is decided later. */
    CANDIDATE,
    MESSAGE_BUDGET_EXCEEDED,
    COLLABORATOR_FAILURE,
    CANCELLED
}
