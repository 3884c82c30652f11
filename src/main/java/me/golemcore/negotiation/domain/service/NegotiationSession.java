package me.golemcore.negotiation.domain.service;

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
import me.golemcore.negotiation.domain.consensus.ConsensusValidator;
import me.golemcore.negotiation.domain.event.EventSubscription;
import me.golemcore.negotiation.domain.event.SessionEventBus;
import me.golemcore.negotiation.domain.exception.NotManualParticipantException;
import me.golemcore.negotiation.domain.exception.UnknownParticipantException;
import me.golemcore.negotiation.domain.loop.RetryController;
import me.golemcore.negotiation.domain.model.ParticipantKind;
import me.golemcore.negotiation.domain.model.SessionEvent;
import me.golemcore.negotiation.domain.model.SessionOutcome;
import me.golemcore.negotiation.domain.model.SessionSettings;
import me.golemcore.negotiation.domain.model.SessionState;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.participant.ManualParticipant;
import me.golemcore.negotiation.domain.participant.Participant;
import me.golemcore.negotiation.domain.participant.TurnChannel;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One negotiation's full lifecycle: roster, event bus, retry sequence and the
 * background task that runs it.
 *
 * <p>
 * Transcript, state and attempt count are mutated only by the session task.
 * Subscriptions, manual input, typing signals and {@link #stop()} may be
 * called from any thread concurrently with the task.
 */
@Slf4j
public class NegotiationSession {

    private final String id;
    private final String coordinatorId;
    private final List<Participant> roster;
    private final Map<String, Participant> participantsById;
    private final SessionSettings settings;
    private final SessionEventBus eventBus;
    private final RetryController retryController;
    private final Clock clock;
    private final Instant createdAt;

    private final Object lock = new Object();
    private SessionState state = SessionState.CREATED;
    private SessionOutcome outcome;
    private Future<?> runningTask;

    /**
     * @param roster
     *            participants in order-index order; the coordinator must be one
     *            of them
     */
    public NegotiationSession(String id, String coordinatorId, List<Participant> roster, SessionSettings settings,
            ConsensusValidator validator, Clock clock, int subscriberQueueLimit) {
        this.id = Objects.requireNonNull(id, "id");
        this.coordinatorId = Objects.requireNonNull(coordinatorId, "coordinatorId");
        this.roster = List.copyOf(roster);
        this.settings = settings;
        this.clock = clock;
        this.createdAt = Instant.now(clock);

        Map<String, Participant> byId = new LinkedHashMap<>();
        for (Participant participant : this.roster) {
            byId.put(participant.getId(), participant);
        }
        if (!byId.containsKey(coordinatorId)) {
            throw new IllegalArgumentException("Coordinator " + coordinatorId + " is not in the roster");
        }
        this.participantsById = Collections.unmodifiableMap(byId);

        this.eventBus = new SessionEventBus(id, clock, subscriberQueueLimit);
        this.retryController = new RetryController(id, rotateToCoordinator(this.roster, coordinatorId),
                coordinatorId, eventBus, validator, settings);
    }

    static List<Participant> rotateToCoordinator(List<Participant> roster, String coordinatorId) {
        int start = 0;
        for (int i = 0; i < roster.size(); i++) {
            if (roster.get(i).getId().equals(coordinatorId)) {
                start = i;
                break;
            }
        }
        List<Participant> order = new ArrayList<>(roster.size());
        for (int i = 0; i < roster.size(); i++) {
            order.add(roster.get((start + i) % roster.size()));
        }
        return order;
    }

    /**
     * Submits the session task. Subsequent calls are ignored.
     */
    public void start(ExecutorService executor) {
        synchronized (lock) {
            if (state != SessionState.CREATED) {
                return;
            }
            state = SessionState.RUNNING;
            runningTask = executor.submit(this::runTask);
        }
        log.info("[Session] started: sessionId={}, participants={}, coordinator={}", id, roster.size(),
                coordinatorId);
    }

    private void runTask() {
        try {
            eventBus.notice("session started");
            if (settings.kickoffTask() != null && !settings.kickoffTask().isBlank()) {
                eventBus.notice(settings.kickoffTask());
            }
            SessionOutcome result = retryController.run();
            complete(result);
        } catch (Exception e) { // NOSONAR - must not kill executor thread
            handleRunFailure(e);
        } catch (Error e) { // NOSONAR - recorded before it reaches the future
            handleRunFailure(e);
            throw e;
        } finally {
            eventBus.close();
        }
    }

    private void complete(SessionOutcome result) {
        SessionState target = switch (result) {
            case AGREEMENT_CONFIRMED -> SessionState.COMPLETED;
            case CANCELLED -> SessionState.STOPPED;
            case CONSENSUS_NOT_REACHED, COLLABORATOR_FAILURE -> SessionState.FAILED;
        };
        boolean changed = transitionTo(target, result);
        log.info("[Session] finished: sessionId={}, outcome={}, state={}, attempts={}", id, result,
                changed ? target : getState(), retryController.getAttemptCount());
    }

    private void handleRunFailure(Throwable e) {
        if (Thread.currentThread().isInterrupted() && getState() == SessionState.STOPPED) {
            log.info("[Session] task interrupted after stop: sessionId={}", id);
            return;
        }
        log.error("[Session] task failed: sessionId={}: {}", id, e.getMessage(), e);
        eventBus.notice("error: " + describe(e));
        transitionTo(SessionState.FAILED, null);
    }

    private String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank()
                ? e.getClass().getSimpleName() + ": " + message
                : e.getClass().getSimpleName();
    }

    private boolean transitionTo(SessionState target, SessionOutcome result) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            state = target;
            outcome = result;
            return true;
        }
    }

    /**
     * Cancels the session: waiting manual participants are released with a
     * cancellation, the task is interrupted at its next suspension point and
     * every subscriber receives the end marker. Idempotent.
     */
    public void stop() {
        Future<?> taskToCancel;
        boolean changed;
        synchronized (lock) {
            changed = !state.isTerminal();
            if (changed) {
                state = SessionState.STOPPED;
                outcome = SessionOutcome.CANCELLED;
            }
            taskToCancel = runningTask;
        }

        // must precede the end marker the task sends on exit
        if (changed) {
            eventBus.notice("session stopped");
        }
        for (Participant participant : roster) {
            if (participant instanceof ManualParticipant manual) {
                manual.getChannel().release();
            }
        }
        if (taskToCancel != null && !taskToCancel.isDone()) {
            boolean cancelled = taskToCancel.cancel(true);
            log.info("[Session] cancel requested: sessionId={}, cancelled={}", id, cancelled);
        }
        eventBus.close();
    }

    public EventSubscription subscribe() {
        return eventBus.subscribe();
    }

    public void unsubscribe(EventSubscription subscription) {
        eventBus.unsubscribe(subscription);
    }

    /**
     * Delivers text to a manual participant's channel. Input arriving before
     * the participant's turn is buffered.
     */
    public void feed(String participantId, String text) {
        Participant participant = requireParticipant(participantId);
        if (!(participant instanceof ManualParticipant manual)) {
            throw new NotManualParticipantException(participantId);
        }
        manual.getChannel().feed(text);
        log.debug("[Session] input fed: sessionId={}, participant={}", id, participantId);
    }

    public void setTyping(String participantId, boolean active) {
        requireParticipant(participantId);
        eventBus.signal(SessionEvent.typing(id, participantId, active, Instant.now(clock)));
    }

    private Participant requireParticipant(String participantId) {
        Participant participant = participantId != null ? participantsById.get(participantId) : null;
        if (participant == null) {
            throw new UnknownParticipantException(id, participantId);
        }
        return participant;
    }

    public List<Utterance> getHistory() {
        return eventBus.getTranscript();
    }

    public String getId() {
        return id;
    }

    public String getCoordinatorId() {
        return coordinatorId;
    }

    public List<Participant> getRoster() {
        return roster;
    }

    public List<String> getParticipantIds(ParticipantKind kind) {
        return roster.stream()
                .filter(participant -> participant.getKind() == kind)
                .map(Participant::getId)
                .toList();
    }

    public TurnChannel getChannel(String participantId) {
        Participant participant = requireParticipant(participantId);
        if (participant instanceof ManualParticipant manual) {
            return manual.getChannel();
        }
        throw new NotManualParticipantException(participantId);
    }

    public SessionSettings getSettings() {
        return settings;
    }

    public SessionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public SessionOutcome getOutcome() {
        synchronized (lock) {
            return outcome;
        }
    }

    public int getAttemptCount() {
        return retryController.getAttemptCount();
    }

    public String getCurrentParticipantId() {
        return getState() == SessionState.RUNNING ? retryController.getCurrentParticipantId() : null;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    SessionEventBus getEventBus() {
        return eventBus;
    }
}
