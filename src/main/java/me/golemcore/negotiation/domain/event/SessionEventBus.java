package me.golemcore.negotiation.domain.event;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.exception.SessionCancelledException;
import me.golemcore.negotiation.domain.model.SessionEvent;
import me.golemcore.negotiation.domain.model.Utterance;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fan-out broadcaster of one session.
 *
 * <p>
 * Keeps the durable history (utterances and system notices) and the set of
 * live subscriptions. Appending and subscribing share one lock, so a new
 * subscriber gets a snapshot of the history followed by every later event,
 * with no gap and no duplicate. Typing signals go to live subscribers only.
 *
 * <p>
 * Only the session's own task appends utterances; subscriptions and signals may
 * come from any thread.
 */
@Slf4j
public class SessionEventBus {

    private final String sessionId;
    private final Clock clock;
    private final int subscriberQueueLimit;

    private final Object lock = new Object();
    private final List<Utterance> transcript = new ArrayList<>();
    private final List<SessionEvent> history = new ArrayList<>();
    private final Set<EventSubscription> subscribers = new LinkedHashSet<>();

    private long sequence = 0;
    private boolean closed = false;

    public SessionEventBus(String sessionId, Clock clock, int subscriberQueueLimit) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.subscriberQueueLimit = subscriberQueueLimit;
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Appends an utterance, assigning the next sequence number, and pushes it
     * to every live subscriber.
     *
     * @throws SessionCancelledException
     *             if the bus was closed by a stop while the turn was in flight
     */
    public Utterance append(String speakerId, String text, int attempt) {
        synchronized (lock) {
            if (closed) {
                log.info("[EventBus] late utterance discarded after close: sessionId={}, speaker={}, attempt={}",
                        sessionId, speakerId, attempt);
                throw new SessionCancelledException("Session " + sessionId + " closed, utterance from "
                        + speakerId + " discarded");
            }
            Utterance utterance = Utterance.builder()
                    .speakerId(speakerId)
                    .text(text)
                    .sequence(++sequence)
                    .attempt(attempt)
                    .build();
            transcript.add(utterance);
            publishDurableLocked(SessionEvent.message(sessionId, utterance, Instant.now(clock)));
            log.debug("[EventBus] appended: sessionId={}, seq={}, speaker={}, attempt={}",
                    sessionId, utterance.sequence(), speakerId, attempt);
            return utterance;
        }
    }

    /**
     * Records a system notice. Notices are replayed to late subscribers but are
     * not part of the transcript.
     */
    public void notice(String text) {
        synchronized (lock) {
            publishDurableLocked(SessionEvent.notice(sessionId, text, Instant.now(clock)));
        }
    }

    /**
     * Delivers an out-of-band event to the current subscribers without storing it.
     */
    public void signal(SessionEvent event) {
        synchronized (lock) {
            if (closed) {
                return;
            }
            for (EventSubscription subscriber : subscribers) {
                subscriber.offer(event);
            }
        }
    }

    /**
     * Registers a subscription whose first reads replay the history as of now.
     * After {@link #close()} the subscription holds the full replay followed by
     * the end marker and is not registered.
     */
    public EventSubscription subscribe() {
        synchronized (lock) {
            EventSubscription subscription = new EventSubscription(sessionId, history, subscriberQueueLimit);
            if (closed) {
                subscription.end(SessionEvent.end(sessionId, Instant.now(clock)));
                return subscription;
            }
            subscribers.add(subscription);
            log.debug("[EventBus] subscribed: sessionId={}, subscription={}, replay={}, live={}",
                    sessionId, subscription.getId(), history.size(), subscribers.size());
            return subscription;
        }
    }

    /**
     * Deregisters the subscription and completes its stream with the end marker.
     */
    public void unsubscribe(EventSubscription subscription) {
        if (subscription == null) {
            return;
        }
        boolean removed;
        synchronized (lock) {
            removed = subscribers.remove(subscription);
        }
        subscription.end(SessionEvent.end(sessionId, Instant.now(clock)));
        if (removed) {
            log.debug("[EventBus] unsubscribed: sessionId={}, subscription={}", sessionId, subscription.getId());
        }
    }

    /**
     * Sends the end marker to every subscriber and stops registering new ones.
     * Idempotent.
     */
    public void close() {
        List<EventSubscription> toEnd;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            toEnd = new ArrayList<>(subscribers);
            subscribers.clear();
        }
        SessionEvent end = SessionEvent.end(sessionId, Instant.now(clock));
        for (EventSubscription subscriber : toEnd) {
            subscriber.end(end);
        }
        log.debug("[EventBus] closed: sessionId={}, subscribers={}", sessionId, toEnd.size());
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public List<Utterance> getTranscript() {
        synchronized (lock) {
            return List.copyOf(transcript);
        }
    }

    public List<SessionEvent> getHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    public int getSubscriberCount() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    private void publishDurableLocked(SessionEvent event) {
        history.add(event);
        if (closed) {
            return;
        }
        for (EventSubscription subscriber : subscribers) {
            subscriber.offer(event);
        }
    }
}
