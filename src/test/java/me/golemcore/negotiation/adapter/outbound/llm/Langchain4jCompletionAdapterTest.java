package me.golemcore.negotiation.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import me.golemcore.negotiation.domain.exception.CollaboratorException;
import me.golemcore.negotiation.domain.model.CompletionRequest;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Langchain4jCompletionAdapterTest {

    private NegotiationProperties properties;
    private Langchain4jCompletionAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new NegotiationProperties();
        adapter = new Langchain4jCompletionAdapter(properties);
    }

    @Test
    void shouldConvertTranscriptRelativeToRequestingParticipant() {
        CompletionRequest request = CompletionRequest.builder()
                .sessionId("s1")
                .participantId("p1")
                .instruction("You are p1.")
                .kickoffTask("Plan a trip.")
                .transcript(List.of(
                        utterance("moderator", "Where to?", 1),
                        utterance("p1", "Kyoto", 2),
                        utterance("p2", "Osaka", 3)))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertEquals("You are p1.", assertInstanceOf(SystemMessage.class, messages.get(0)).text());
        assertEquals("Plan a trip.", assertInstanceOf(UserMessage.class, messages.get(1)).singleText());
        assertEquals("[moderator] Where to?", assertInstanceOf(UserMessage.class, messages.get(2)).singleText());
        assertEquals("Kyoto", assertInstanceOf(AiMessage.class, messages.get(3)).text());
        assertEquals("[p2] Osaka", assertInstanceOf(UserMessage.class, messages.get(4)).singleText());
    }

    @Test
    void shouldSkipBlankInstructionAndKickoff() {
        CompletionRequest request = CompletionRequest.builder()
                .participantId("p1")
                .instruction(" ")
                .build();

        assertTrue(adapter.convertMessages(request).isEmpty());
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertFalse(adapter.isAvailable());

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.complete(CompletionRequest.builder().participantId("p1").build()).join());
        CollaboratorException cause = assertInstanceOf(CollaboratorException.class, ex.getCause());
        assertEquals(CollaboratorException.Kind.UNAVAILABLE, cause.getKind());
    }

    @Test
    void shouldReportAvailableWithApiKey() {
        properties.getLlm().setApiKey("sk-test");

        assertTrue(adapter.isAvailable());
    }

    private Utterance utterance(String speaker, String text, long sequence) {
        return Utterance.builder().speakerId(speaker).text(text).sequence(sequence).attempt(1).build();
    }
}
