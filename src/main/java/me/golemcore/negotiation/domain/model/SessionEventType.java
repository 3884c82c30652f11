package me.golemcore.negotiation.domain.model;

/**
 * Kinds of events delivered to session subscribers.
 */
public enum SessionEventType {
    MESSAGE, SYSTEM_NOTICE, TYPING, END
}
