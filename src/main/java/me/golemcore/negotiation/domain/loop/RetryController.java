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
import me.golemcore.negotiation.domain.model.AttemptResult;
import me.golemcore.negotiation.domain.model.ConsensusVerdict;
import me.golemcore.negotiation.domain.model.SessionOutcome;
import me.golemcore.negotiation.domain.model.SessionSettings;
import me.golemcore.negotiation.domain.participant.Participant;

import java.util.List;

/**
 * Runs up to {@code retryBound + 1} attempts of {@link TurnScheduler} for one
 * session.
 *
 * <p>
 * Each attempt starts with an empty segment; earlier attempts stay in the
 * session history but are invisible to the validator and to generated
 * participants. An invalid candidate and an exhausted message budget both
 * count as a failed attempt. A collaborator failure ends the sequence at once
 * without consuming a retry.
 */
@Slf4j
public class RetryController {

    private final String sessionId;
    private final List<Participant> turnOrder;
    private final String coordinatorId;
    private final SessionEventBus eventBus;
    private final ConsensusValidator validator;
    private final SessionSettings settings;
    private final List<String> rosterIds;

    private volatile int attemptCount = 0;
    private volatile TurnScheduler activeScheduler;
    private volatile AttemptResult lastResult;

    public RetryController(String sessionId, List<Participant> turnOrder, String coordinatorId,
            SessionEventBus eventBus, ConsensusValidator validator, SessionSettings settings) {
        this.sessionId = sessionId;
        this.turnOrder = List.copyOf(turnOrder);
        this.coordinatorId = coordinatorId;
        this.eventBus = eventBus;
        this.validator = validator;
        this.settings = settings;
        this.rosterIds = this.turnOrder.stream().map(Participant::getId).toList();
    }

    public SessionOutcome run() {
        int maxAttempts = settings.retryBound() + 1;
        while (attemptCount < maxAttempts) {
            attemptCount++;
            TurnScheduler scheduler = new TurnScheduler(sessionId, attemptCount, turnOrder, coordinatorId, eventBus,
                    validator, settings.messageBudget(), settings.kickoffTask());
            activeScheduler = scheduler;
            AttemptResult result = scheduler.run();
            lastResult = result;

            switch (result.reason()) {
                case CANCELLED:
                    log.info("[Retry] cancelled: sessionId={}, attempt={}", sessionId, attemptCount);
                    return SessionOutcome.CANCELLED;
                case COLLABORATOR_FAILURE:
                    String cause = result.failure() != null ? result.failure().getMessage() : "unknown";
                    eventBus.notice("completion service failure, negotiation aborted: " + cause);
                    return SessionOutcome.COLLABORATOR_FAILURE;
                case CANDIDATE:
                    ConsensusVerdict verdict = validator.validate(result.segment(), rosterIds, coordinatorId);
                    if (verdict.valid()) {
                        log.info("[Retry] agreement confirmed: sessionId={}, attempt={}", sessionId, attemptCount);
                        eventBus.notice("agreement confirmed");
                        return SessionOutcome.AGREEMENT_CONFIRMED;
                    }
                    log.info("[Retry] candidate rejected: sessionId={}, attempt={}, missing={}", sessionId,
                            attemptCount, verdict.missingAffirmations());
                    onFailedAttempt("agreement declared without affirmation from "
                            + String.join(", ", verdict.missingAffirmations()), maxAttempts);
                    break;
                case MESSAGE_BUDGET_EXCEEDED:
                    log.info("[Retry] message budget exhausted: sessionId={}, attempt={}", sessionId,
                            attemptCount);
                    onFailedAttempt("message budget of " + settings.messageBudget() + " exhausted", maxAttempts);
                    break;
                default:
                    throw new IllegalStateException("Unhandled termination reason: " + result.reason());
            }
        }

        log.info("[Retry] consensus not reached: sessionId={}, attempts={}", sessionId, attemptCount);
        eventBus.notice("consensus not reached after " + attemptCount + " attempts");
        return SessionOutcome.CONSENSUS_NOT_REACHED;
    }

    private void onFailedAttempt(String detail, int maxAttempts) {
        if (attemptCount < maxAttempts) {
            eventBus.notice("negotiation inconclusive (" + detail + "), restarting: attempt "
                    + (attemptCount + 1) + " of " + maxAttempts);
        } else {
            eventBus.notice("negotiation inconclusive (" + detail + ")");
        }
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    /**
     * Participant whose turn the running attempt awaits, or {@code null}.
     */
    public String getCurrentParticipantId() {
        TurnScheduler scheduler = activeScheduler;
        return scheduler != null ? scheduler.getCurrentParticipantId() : null;
    }

    public AttemptResult getLastResult() {
        return lastResult;
    }
}
