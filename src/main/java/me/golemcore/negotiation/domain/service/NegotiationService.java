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
import me.golemcore.negotiation.domain.exception.InvalidRosterException;
import me.golemcore.negotiation.domain.model.ParticipantKind;
import me.golemcore.negotiation.domain.model.ParticipantSpec;
import me.golemcore.negotiation.domain.model.RosterSpec;
import me.golemcore.negotiation.domain.model.SessionSettings;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.participant.GeneratedParticipant;
import me.golemcore.negotiation.domain.participant.ManualParticipant;
import me.golemcore.negotiation.domain.participant.Participant;
import me.golemcore.negotiation.domain.participant.TurnChannel;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import me.golemcore.negotiation.port.inbound.NegotiationPort;
import me.golemcore.negotiation.port.outbound.CompletionPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Boundary operations over the session registry: roster validation, session
 * construction and delegation of per-session calls.
 */
@Service
@Slf4j
public class NegotiationService implements NegotiationPort {

    private static final int DEFAULT_MESSAGE_BUDGET = 50;
    private static final int DEFAULT_RETRY_BOUND = 2;
    private static final int DEFAULT_QUEUE_DEPTH = 8;
    private static final long DEFAULT_COMPLETION_TIMEOUT_MS = 120_000;

    private final SessionRegistry registry;
    private final ConsensusValidator validator;
    private final CompletionPort completionPort;
    private final TranscriptLogRenderer logRenderer;
    private final NegotiationProperties properties;
    private final ExecutorService negotiationExecutor;
    private final Clock clock;
    private final int messageBudget;
    private final int retryBound;
    private final int manualInputQueueDepth;
    private final long completionTimeoutMs;

    public NegotiationService(SessionRegistry registry, ConsensusValidator validator, CompletionPort completionPort,
            TranscriptLogRenderer logRenderer, NegotiationProperties properties,
            @Qualifier("negotiationExecutor") ExecutorService negotiationExecutor, Clock clock) {
        this.registry = registry;
        this.validator = validator;
        this.completionPort = completionPort;
        this.logRenderer = logRenderer;
        this.properties = properties;
        this.negotiationExecutor = negotiationExecutor;
        this.clock = clock;
        this.messageBudget = normalizePositive(properties.getMessageBudget(), DEFAULT_MESSAGE_BUDGET);
        this.retryBound = properties.getRetryBound() >= 0 ? properties.getRetryBound() : DEFAULT_RETRY_BOUND;
        this.manualInputQueueDepth = normalizePositive(properties.getManualInputQueueDepth(), DEFAULT_QUEUE_DEPTH);
        this.completionTimeoutMs = properties.getCompletionTimeoutMs() > 0
                ? properties.getCompletionTimeoutMs()
                : DEFAULT_COMPLETION_TIMEOUT_MS;
    }

    @Override
    public NegotiationSession createSession(RosterSpec roster) {
        String coordinatorId = validateRoster(roster);
        String sessionId = isBlank(roster.getSessionId()) ? UUID.randomUUID().toString() : roster.getSessionId().trim();

        SessionRegistry.Registration registration = registry.register(sessionId,
                () -> buildSession(sessionId, coordinatorId, roster.getParticipants()));
        NegotiationSession session = registration.session();
        if (!registration.created()) {
            log.info("[Negotiation] session already exists, returning it: sessionId={}", sessionId);
            return session;
        }
        session.start(negotiationExecutor);
        return session;
    }

    String validateRoster(RosterSpec roster) {
        if (roster == null || roster.getParticipants() == null || roster.getParticipants().isEmpty()) {
            throw new InvalidRosterException("at least one participant is required");
        }
        Set<String> ids = new HashSet<>();
        for (ParticipantSpec spec : roster.getParticipants()) {
            if (spec == null || isBlank(spec.getId())) {
                throw new InvalidRosterException("participant id must not be blank");
            }
            if (spec.getKind() == null) {
                throw new InvalidRosterException("participant " + spec.getId() + " has no kind");
            }
            if (!ids.add(spec.getId())) {
                throw new InvalidRosterException("duplicate participant id " + spec.getId());
            }
        }
        String coordinatorId = isBlank(roster.getCoordinatorId())
                ? properties.getCoordinatorId()
                : roster.getCoordinatorId();
        if (!ids.contains(coordinatorId)) {
            throw new InvalidRosterException("coordinator " + coordinatorId + " is not in the roster");
        }
        return coordinatorId;
    }

    private NegotiationSession buildSession(String sessionId, String coordinatorId, List<ParticipantSpec> specs) {
        List<Participant> participants = new ArrayList<>(specs.size());
        for (ParticipantSpec spec : specs) {
            participants.add(buildParticipant(spec, spec.getId().equals(coordinatorId)));
        }
        SessionSettings settings = new SessionSettings(messageBudget, retryBound, properties.getKickoffTask());
        return new NegotiationSession(sessionId, coordinatorId, participants, settings, validator, clock,
                properties.getSubscriberQueueLimit());
    }

    private Participant buildParticipant(ParticipantSpec spec, boolean coordinator) {
        if (spec.getKind() == ParticipantKind.MANUAL) {
            return new ManualParticipant(spec.getId(),
                    new TurnChannel(spec.getId(), manualInputQueueDepth));
        }
        String instruction = spec.getInstruction();
        if (isBlank(instruction)) {
            instruction = coordinator
                    ? properties.getDefaultCoordinatorInstruction()
                    : properties.getDefaultParticipantInstruction();
        }
        return new GeneratedParticipant(spec.getId(), instruction, completionPort,
                Duration.ofMillis(completionTimeoutMs));
    }

    @Override
    public NegotiationSession getSession(String sessionId) {
        return registry.require(sessionId);
    }

    @Override
    public List<NegotiationSession> listSessions() {
        return registry.list();
    }

    @Override
    public EventSubscription subscribe(String sessionId) {
        return registry.require(sessionId).subscribe();
    }

    @Override
    public void unsubscribe(String sessionId, EventSubscription subscription) {
        registry.find(sessionId).ifPresent(session -> session.unsubscribe(subscription));
    }

    @Override
    public void feed(String sessionId, String participantId, String text) {
        registry.require(sessionId).feed(participantId, text);
    }

    @Override
    public void setTyping(String sessionId, String participantId, boolean active) {
        registry.require(sessionId).setTyping(participantId, active);
    }

    @Override
    public void stop(String sessionId) {
        registry.stop(sessionId);
    }

    @Override
    public List<Utterance> getHistory(String sessionId) {
        return registry.require(sessionId).getHistory();
    }

    @Override
    public String renderLog(String sessionId) {
        return logRenderer.render(registry.require(sessionId));
    }

    private static int normalizePositive(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
