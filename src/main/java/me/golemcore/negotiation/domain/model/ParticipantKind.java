package me.golemcore.negotiation.domain.model;

/**
 * How a participant produces its next turn.
 */
public enum ParticipantKind {
    GENERATED, MANUAL
}
