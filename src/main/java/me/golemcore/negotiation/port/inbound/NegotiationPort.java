package me.golemcore.negotiation.port.inbound;

import me.golemcore.negotiation.domain.event.EventSubscription;
import me.golemcore.negotiation.domain.model.RosterSpec;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.service.NegotiationSession;

import java.util.List;

/**
 * Operations the negotiation core exposes to request-handling adapters.
 */
public interface NegotiationPort {

    /**
     * Creates and starts a session.
     *
     * @throws me.golemcore.negotiation.domain.exception.InvalidRosterException
     *             if the roster is empty, has blank or duplicated ids, or names
     *             an unknown coordinator
     */
    NegotiationSession createSession(RosterSpec roster);

    /**
     * @throws me.golemcore.negotiation.domain.exception.NoSuchSessionException
     *             if no session has the id
     */
    NegotiationSession getSession(String sessionId);

    List<NegotiationSession> listSessions();

    /**
     * Subscribes to a session: first the history so far, then live events,
     * ending with the end marker.
     */
    EventSubscription subscribe(String sessionId);

    void unsubscribe(String sessionId, EventSubscription subscription);

    void feed(String sessionId, String participantId, String text);

    void setTyping(String sessionId, String participantId, boolean active);

    /**
     * Stops and evicts a session. Stopping an absent or already stopped
     * session succeeds without effect.
     */
    void stop(String sessionId);

    List<Utterance> getHistory(String sessionId);

    /**
     * Renders the session history as a Markdown log.
     */
    String renderLog(String sessionId);
}
