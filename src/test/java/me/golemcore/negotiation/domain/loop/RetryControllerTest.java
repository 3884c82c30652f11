package me.golemcore.negotiation.domain.loop;

import me.golemcore.negotiation.domain.consensus.ConsensusValidator;
import me.golemcore.negotiation.domain.event.SessionEventBus;
import me.golemcore.negotiation.domain.exception.CollaboratorException;
import me.golemcore.negotiation.domain.model.SessionEvent;
import me.golemcore.negotiation.domain.model.SessionEventType;
import me.golemcore.negotiation.domain.model.SessionOutcome;
import me.golemcore.negotiation.domain.model.SessionSettings;
import me.golemcore.negotiation.domain.model.TerminationReason;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.participant.Participant;
import me.golemcore.negotiation.domain.participant.TurnContext;
import me.golemcore.negotiation.testsupport.ScriptedParticipant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryControllerTest {

    private static final String COORDINATOR = "moderator";
    private static final String AGREEMENT = "【AGREE】\n【FINAL_PLAN】 Sapporo, three days";

    private SessionEventBus bus;
    private ConsensusValidator validator;

    @BeforeEach
    void setUp() {
        bus = new SessionEventBus("s1", Clock.systemUTC(), 0);
        validator = new ConsensusValidator("【AGREE】", "【FINAL_PLAN】", List.of("賛成", "同意"));
    }

    @Test
    void shouldConfirmValidAgreementWithoutRetry() {
        ScriptedParticipant coordinator = new ScriptedParticipant(COORDINATOR,
                context -> context.segment().size() >= 3 ? AGREEMENT : "Sapporo?");
        List<Participant> order = List.of(coordinator,
                ScriptedParticipant.constant("p1", "賛成"),
                ScriptedParticipant.constant("p2", "同意"));
        RetryController controller = controller(order, 10, 2);

        SessionOutcome outcome = controller.run();

        assertEquals(SessionOutcome.AGREEMENT_CONFIRMED, outcome);
        assertEquals(1, controller.getAttemptCount());
        assertEquals(4, bus.getTranscript().size());
        assertTrue(notices().contains("agreement confirmed"));
    }

    @Test
    void shouldExhaustRetryBoundWhenBudgetKeepsRunningOut() {
        ScriptedParticipant p1 = ScriptedParticipant.constant("p1", "no idea");
        List<Participant> order = List.of(ScriptedParticipant.constant(COORDINATOR, "thoughts?"), p1,
                ScriptedParticipant.constant("p2", "not sure"));
        RetryController controller = controller(order, 6, 2);

        SessionOutcome outcome = controller.run();

        assertEquals(SessionOutcome.CONSENSUS_NOT_REACHED, outcome);
        assertEquals(3, controller.getAttemptCount());
        assertEquals(18, bus.getTranscript().size());
        assertEquals(TerminationReason.MESSAGE_BUDGET_EXCEEDED, controller.getLastResult().reason());
        assertEquals(List.of(1, 2, 3), bus.getTranscript().stream().map(Utterance::attempt).distinct().toList());
        assertTrue(notices().contains("consensus not reached after 3 attempts"));
        assertTrue(notices().stream().anyMatch(text -> text.contains("restarting: attempt 2 of 3")));
    }

    @Test
    void shouldRetryAfterPrematureAgreement() {
        ScriptedParticipant coordinator = new ScriptedParticipant(COORDINATOR, context -> {
            if (context.attempt() == 1) {
                return AGREEMENT;
            }
            return context.segment().size() >= 2 ? AGREEMENT : "Sapporo?";
        });
        List<Participant> order = List.of(coordinator, ScriptedParticipant.constant("p1", "賛成"));
        RetryController controller = controller(order, 10, 2);

        SessionOutcome outcome = controller.run();

        assertEquals(SessionOutcome.AGREEMENT_CONFIRMED, outcome);
        assertEquals(2, controller.getAttemptCount());
        assertTrue(notices().stream().anyMatch(text -> text.contains("without affirmation from p1")));
    }

    @Test
    void shouldResetParticipantMemoryBetweenAttempts() {
        ScriptedParticipant p1 = ScriptedParticipant.constant("p1", "hmm");
        List<Participant> order = List.of(ScriptedParticipant.constant(COORDINATOR, "thoughts?"), p1);
        controller(order, 2, 1).run();

        List<TurnContext> contexts = p1.getContexts();
        assertEquals(2, contexts.size());
        for (TurnContext context : contexts) {
            assertEquals(1, context.segment().size());
            assertEquals(context.attempt(), context.segment().get(0).attempt());
        }
        assertEquals(4, bus.getTranscript().size());
    }

    @Test
    void shouldAbortWithoutRetryOnCollaboratorFailure() {
        List<Participant> order = List.of(ScriptedParticipant.constant(COORDINATOR, "thoughts?"),
                new ScriptedParticipant("p1", context -> {
                    throw new CollaboratorException(CollaboratorException.Kind.UNAVAILABLE, "provider down");
                }));
        RetryController controller = controller(order, 10, 2);

        SessionOutcome outcome = controller.run();

        assertEquals(SessionOutcome.COLLABORATOR_FAILURE, outcome);
        assertEquals(1, controller.getAttemptCount());
        assertTrue(notices().stream().anyMatch(text -> text.contains("provider down")));
    }

    @Test
    void shouldRunSingleAttemptWhenRetryBoundIsZero() {
        List<Participant> order = List.of(ScriptedParticipant.constant(COORDINATOR, "thoughts?"));
        RetryController controller = controller(order, 3, 0);

        assertEquals(SessionOutcome.CONSENSUS_NOT_REACHED, controller.run());
        assertEquals(1, controller.getAttemptCount());
    }

    private RetryController controller(List<Participant> order, int budget, int retryBound) {
        return new RetryController("s1", order, COORDINATOR, bus, validator,
                new SessionSettings(budget, retryBound, "Plan a trip."));
    }

    private List<String> notices() {
        return bus.getHistory().stream()
                .filter(event -> event.type() == SessionEventType.SYSTEM_NOTICE)
                .map(SessionEvent::text)
                .toList();
    }
}
