package me.golemcore.negotiation.domain.service;

import me.golemcore.negotiation.domain.consensus.ConsensusValidator;
import me.golemcore.negotiation.domain.event.EventSubscription;
import me.golemcore.negotiation.domain.exception.NotManualParticipantException;
import me.golemcore.negotiation.domain.exception.SessionCancelledException;
import me.golemcore.negotiation.domain.exception.UnknownParticipantException;
import me.golemcore.negotiation.domain.model.ParticipantKind;
import me.golemcore.negotiation.domain.model.SessionEvent;
import me.golemcore.negotiation.domain.model.SessionEventType;
import me.golemcore.negotiation.domain.model.SessionOutcome;
import me.golemcore.negotiation.domain.model.SessionSettings;
import me.golemcore.negotiation.domain.model.SessionState;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.domain.participant.ManualParticipant;
import me.golemcore.negotiation.domain.participant.Participant;
import me.golemcore.negotiation.domain.participant.TurnChannel;
import me.golemcore.negotiation.testsupport.ScriptedParticipant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NegotiationSessionTest {

    private static final String COORDINATOR = "moderator";
    private static final Duration WAIT = Duration.ofSeconds(5);

    private ExecutorService executor;
    private ConsensusValidator validator;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        validator = new ConsensusValidator("【AGREE】", "【FINAL_PLAN】", List.of("賛成", "同意"));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldFailAfterRetriesWhenNobodyAgrees() throws InterruptedException {
        ManualParticipant p1 = manual("p1");
        NegotiationSession session = session(List.of(
                ScriptedParticipant.constant(COORDINATOR, "What does everyone think?"),
                p1,
                ScriptedParticipant.constant("p2", "I am still thinking.")), 6, 2);
        for (int i = 0; i < 6; i++) {
            session.feed("p1", "Let me see, round " + i);
        }
        EventSubscription subscription = session.subscribe();

        session.start(executor);
        List<SessionEvent> events = drain(subscription);

        assertEquals(SessionState.FAILED, session.getState());
        assertEquals(SessionOutcome.CONSENSUS_NOT_REACHED, session.getOutcome());
        assertEquals(3, session.getAttemptCount());
        assertEquals(18, session.getHistory().size());
        assertTrue(events.get(events.size() - 1).isEnd());
        assertEquals(18, events.stream().filter(event -> event.type() == SessionEventType.MESSAGE).count());
    }

    @Test
    void shouldCompleteOnFirstValidAgreement() throws InterruptedException {
        ManualParticipant p1 = manual("p1");
        ScriptedParticipant coordinator = new ScriptedParticipant(COORDINATOR,
                context -> context.segment().isEmpty() ? "Hokkaido in July?"
                        : "【AGREE】\nbody...【FINAL_PLAN】 details");
        NegotiationSession session = session(List.of(coordinator, p1,
                ScriptedParticipant.constant("p2", "同意します")), 6, 2);
        session.feed("p1", "賛成です");
        EventSubscription subscription = session.subscribe();

        session.start(executor);
        List<SessionEvent> events = drain(subscription);

        assertEquals(SessionState.COMPLETED, session.getState());
        assertEquals(SessionOutcome.AGREEMENT_CONFIRMED, session.getOutcome());
        assertEquals(1, session.getAttemptCount());
        List<Utterance> history = session.getHistory();
        assertEquals(4, history.size());
        assertEquals(COORDINATOR, history.get(3).speakerId());
        assertEquals(4, history.get(3).sequence());
        assertTrue(events.stream().anyMatch(event -> "agreement confirmed".equals(event.text())));
    }

    @Test
    void shouldUnblockManualParticipantOnStop() throws InterruptedException {
        ManualParticipant p1 = manual("p1");
        NegotiationSession session = session(List.of(ScriptedParticipant.constant(COORDINATOR, "Your turn, p1"),
                p1), 10, 2);
        EventSubscription subscription = session.subscribe();

        session.start(executor);
        waitUntil(() -> p1.getChannel().isAwaiting());
        assertEquals("p1", session.getCurrentParticipantId());

        session.stop();
        List<SessionEvent> events = drain(subscription);

        assertEquals(SessionState.STOPPED, session.getState());
        assertEquals(SessionOutcome.CANCELLED, session.getOutcome());
        assertTrue(events.stream().anyMatch(event -> "session stopped".equals(event.text())));
        assertTrue(events.get(events.size() - 1).isEnd());
        waitUntil(() -> !p1.getChannel().isAwaiting());
        assertThrows(SessionCancelledException.class, () -> session.feed("p1", "too late"));
    }

    @Test
    void shouldKeepTerminalStateWhenStoppedAfterCompletion() throws InterruptedException {
        NegotiationSession session = session(List.of(
                ScriptedParticipant.constant(COORDINATOR, "【AGREE】 【FINAL_PLAN】 solo plan")), 5, 0);
        EventSubscription subscription = session.subscribe();
        session.start(executor);
        drain(subscription);

        session.stop();
        session.stop();

        assertEquals(SessionState.COMPLETED, session.getState());
        assertTrue(session.getEventBus().getHistory().stream()
                .noneMatch(event -> "session stopped".equals(event.text())));
    }

    @Test
    void shouldStopBeforeStart() {
        NegotiationSession session = session(List.of(ScriptedParticipant.constant(COORDINATOR, "x")), 5, 0);

        session.stop();
        session.start(executor);

        assertEquals(SessionState.STOPPED, session.getState());
        assertTrue(session.getEventBus().isClosed());
    }

    @Test
    void shouldFailWithErrorNoticeOnUnexpectedException() throws InterruptedException {
        NegotiationSession session = session(List.of(new ScriptedParticipant(COORDINATOR, context -> {
            throw new IllegalStateException("boom");
        })), 5, 2);
        EventSubscription subscription = session.subscribe();

        session.start(executor);
        List<SessionEvent> events = drain(subscription);

        assertEquals(SessionState.FAILED, session.getState());
        assertNull(session.getOutcome());
        assertTrue(events.stream().anyMatch(event -> "error: IllegalStateException: boom".equals(event.text())));
        assertTrue(events.get(events.size() - 1).isEnd());
    }

    @Test
    void shouldFailWithErrorNoticeWhenParticipantThrowsError() {
        NegotiationSession session = session(List.of(new ScriptedParticipant(COORDINATOR, context -> {
            throw new StackOverflowError("deep");
        })), 5, 2);
        EventSubscription subscription = session.subscribe();

        session.start(executor);
        List<SessionEvent> events = drain(subscription);

        assertEquals(SessionState.FAILED, session.getState());
        assertEquals("error: StackOverflowError: deep", events.get(events.size() - 2).text());
        assertTrue(events.get(events.size() - 1).isEnd());
    }

    @Test
    void shouldDiscardUtteranceProducedAfterStop() throws InterruptedException {
        CountDownLatch inTurn = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        ScriptedParticipant slow = new ScriptedParticipant(COORDINATOR, context -> {
            inTurn.countDown();
            awaitIgnoringInterrupts(proceed);
            return "late proposal";
        });
        NegotiationSession session = session(List.of(slow), 5, 0);
        EventSubscription subscription = session.subscribe();

        session.start(executor);
        assertTrue(inTurn.await(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        session.stop();
        proceed.countDown();
        List<SessionEvent> events = drain(subscription);

        assertEquals(SessionState.STOPPED, session.getState());
        assertTrue(events.stream().noneMatch(event -> "late proposal".equals(event.text())));
        executor.shutdown();
        assertTrue(executor.awaitTermination(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        assertEquals(1, slow.getTurnCount());
        assertTrue(session.getHistory().isEmpty());
    }

    @Test
    void shouldReplayStartNoticesToLateSubscriber() throws InterruptedException {
        NegotiationSession session = session(List.of(ScriptedParticipant.constant(COORDINATOR, "hi")), 1, 0);
        session.start(executor);
        waitUntil(() -> session.getState().isTerminal());

        List<SessionEvent> events = drain(session.subscribe());

        assertEquals("session started", events.get(0).text());
        assertEquals("Plan a trip.", events.get(1).text());
        assertEquals(SessionEventType.MESSAGE, events.get(2).type());
    }

    @Test
    void shouldValidateManualInputTarget() {
        NegotiationSession session = session(List.of(ScriptedParticipant.constant(COORDINATOR, "x"),
                manual("p1")), 5, 0);

        assertThrows(UnknownParticipantException.class, () -> session.feed("ghost", "hi"));
        assertThrows(NotManualParticipantException.class, () -> session.feed(COORDINATOR, "hi"));
        assertThrows(UnknownParticipantException.class, () -> session.setTyping("ghost", true));
        assertEquals(List.of("p1"), session.getParticipantIds(ParticipantKind.MANUAL));
        assertEquals(List.of(COORDINATOR), session.getParticipantIds(ParticipantKind.GENERATED));
    }

    @Test
    void shouldBroadcastTypingToLiveSubscribersOnly() {
        NegotiationSession session = session(List.of(ScriptedParticipant.constant(COORDINATOR, "x"),
                manual("p1")), 5, 0);
        EventSubscription live = session.subscribe();

        session.setTyping("p1", true);

        StepVerifier.create(live.toFlux())
                .assertNext(typing -> {
                    assertEquals(SessionEventType.TYPING, typing.type());
                    assertEquals("p1", typing.speakerId());
                    assertTrue(typing.active());
                })
                .thenCancel()
                .verify(WAIT);
        StepVerifier.create(session.subscribe().toFlux())
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(50))
                .thenCancel()
                .verify(WAIT);
    }

    @Test
    void shouldRotateTurnOrderToStartWithCoordinator() {
        Participant a = ScriptedParticipant.constant("a", "x");
        Participant b = ScriptedParticipant.constant("b", "x");
        Participant c = ScriptedParticipant.constant("c", "x");

        List<Participant> order = NegotiationSession.rotateToCoordinator(List.of(a, b, c), "b");

        assertEquals(List.of(b, c, a), order);
    }

    private NegotiationSession session(List<Participant> roster, int budget, int retryBound) {
        return new NegotiationSession("s1", COORDINATOR, roster, new SessionSettings(budget, retryBound,
                "Plan a trip."), validator, Clock.systemUTC(), 0);
    }

    private ManualParticipant manual(String id) {
        return new ManualParticipant(id, new TurnChannel(id, 8));
    }

    private List<SessionEvent> drain(EventSubscription subscription) {
        List<SessionEvent> events = subscription.toFlux().collectList().block(WAIT);
        assertNotNull(events);
        assertTrue(events.get(events.size() - 1).isEnd(), "No end marker within " + WAIT);
        return events;
    }

    private static void awaitIgnoringInterrupts(CountDownLatch latch) {
        while (true) {
            try {
                latch.await();
                return;
            } catch (InterruptedException e) {
                // keep the turn in flight past the stop
            }
        }
    }

    private void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within " + WAIT);
            }
            Thread.sleep(5);
        }
    }
}
