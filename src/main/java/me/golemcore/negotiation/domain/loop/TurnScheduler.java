package me.golemcore.negotiation.domain.loop;

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
import me.golemcore.negotiation.domain.event.SessionEventBus;
import me.golemcore.negotiation.domain.exception.CollaboratorException;
import me.golemcore.negotiation.domain.exception.SessionCancelledException;
import me.golemcore.negotiation.domain.model.AttemptResult;
import me.golemcore.negotiation.domain.model.ConsensusVerdict;
import me.golemcore.negotiation.domain.model.TerminationReason;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.participant.Participant;
import me.golemcore.negotiation.domain.participant.TurnContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives one negotiation attempt.
 *
 * <p>
 * Issues turns round-robin over {@code turnOrder} (coordinator first), appends
 * each result to the bus and then checks, in this order, for a candidate
 * agreement and for the message budget. Validity of a candidate is left to
 * {@link RetryController}.
 *
 * <p>
 * States: {@code IDLE → AWAITING_TURN(participant) → ... → TERMINATED(reason)}.
 * One instance runs exactly once.
 */
@Slf4j
public class TurnScheduler {

    public enum State {
        IDLE, AWAITING_TURN, TERMINATED
    }

    private final String sessionId;
    private final int attempt;
    private final List<Participant> turnOrder;
    private final String coordinatorId;
    private final SessionEventBus eventBus;
    private final ConsensusValidator validator;
    private final int messageBudget;
    private final String kickoffTask;

    private final List<Utterance> segment = new ArrayList<>();
    private volatile State state = State.IDLE;
    private volatile String currentParticipantId;
    private volatile TerminationReason terminationReason;

    public TurnScheduler(String sessionId, int attempt, List<Participant> turnOrder, String coordinatorId,
            SessionEventBus eventBus, ConsensusValidator validator, int messageBudget, String kickoffTask) {
        if (turnOrder == null || turnOrder.isEmpty()) {
            throw new IllegalArgumentException("turnOrder must not be empty");
        }
        if (!turnOrder.get(0).getId().equals(coordinatorId)) {
            throw new IllegalArgumentException("turnOrder must start with the coordinator");
        }
        this.sessionId = sessionId;
        this.attempt = attempt;
        this.turnOrder = List.copyOf(turnOrder);
        this.coordinatorId = coordinatorId;
        this.eventBus = eventBus;
        this.validator = validator;
        this.messageBudget = messageBudget;
        this.kickoffTask = kickoffTask;
    }

    public AttemptResult run() {
        if (state != State.IDLE) {
            throw new IllegalStateException("Attempt " + attempt + " already ran");
        }
        log.info("[Scheduler] attempt started: sessionId={}, attempt={}, participants={}, budget={}",
                sessionId, attempt, turnOrder.size(), messageBudget);

        int turn = 0;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                return terminate(TerminationReason.CANCELLED, null);
            }

            Participant participant = turnOrder.get(turn % turnOrder.size());
            state = State.AWAITING_TURN;
            currentParticipantId = participant.getId();

            String text;
            try {
                text = participant.nextTurn(new TurnContext(sessionId, attempt, kickoffTask, segment));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return terminate(TerminationReason.CANCELLED, null);
            } catch (SessionCancelledException e) {
                return terminate(TerminationReason.CANCELLED, null);
            } catch (CollaboratorException e) {
                log.error("[Scheduler] collaborator failed: sessionId={}, attempt={}, participant={}, kind={}: {}",
                        sessionId, attempt, participant.getId(), e.getKind(), e.getMessage());
                return terminate(TerminationReason.COLLABORATOR_FAILURE, e);
            }

            Utterance utterance;
            try {
                utterance = eventBus.append(participant.getId(), text, attempt);
            } catch (SessionCancelledException e) {
                return terminate(TerminationReason.CANCELLED, null);
            }
            segment.add(utterance);
            turn++;

            if (validator.findCandidate(segment, coordinatorId) != ConsensusVerdict.NO_CANDIDATE) {
                return terminate(TerminationReason.CANDIDATE, null);
            }
            if (segment.size() >= messageBudget) {
                return terminate(TerminationReason.MESSAGE_BUDGET_EXCEEDED, null);
            }
        }
    }

    private AttemptResult terminate(TerminationReason reason, Throwable failure) {
        state = State.TERMINATED;
        currentParticipantId = null;
        terminationReason = reason;
        log.info("[Scheduler] attempt terminated: sessionId={}, attempt={}, reason={}, utterances={}",
                sessionId, attempt, reason, segment.size());
        return new AttemptResult(attempt, reason, segment, failure);
    }

    public int getAttempt() {
        return attempt;
    }

    public State getState() {
        return state;
    }

    /**
     * Participant whose turn is being awaited, or {@code null} when none.
     */
    public String getCurrentParticipantId() {
        return currentParticipantId;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }
}
