package me.golemcore.negotiation.adapter.outbound.llm;

import me.golemcore.negotiation.domain.model.CompletionRequest;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompletionAdapterFactoryTest {

    private NegotiationProperties properties;
    private CompletionProviderAdapter langchain;
    private NoOpCompletionAdapter noOp;

    @BeforeEach
    void setUp() {
        properties = new NegotiationProperties();
        langchain = mock(CompletionProviderAdapter.class);
        when(langchain.getProviderId()).thenReturn("langchain4j");
        when(langchain.isAvailable()).thenReturn(true);
        noOp = new NoOpCompletionAdapter();
    }

    @Test
    void shouldSelectConfiguredProvider() {
        CompletionAdapterFactory factory = new CompletionAdapterFactory(properties, List.of(langchain, noOp));
        factory.init();

        assertSame(langchain, factory.getActiveAdapter());
        assertEquals("langchain4j", factory.getProviderId());
        assertTrue(factory.isAvailable());
    }

    @Test
    void shouldFallBackToNoOpForUnknownProvider() {
        properties.getLlm().setProvider("unknown");
        CompletionAdapterFactory factory = new CompletionAdapterFactory(properties, List.of(langchain, noOp));
        factory.init();

        assertSame(noOp, factory.getActiveAdapter());
        assertEquals("none", factory.getProviderId());
        assertFalse(factory.isAvailable());
    }

    @Test
    void shouldDelegateCompletionToActiveAdapter() {
        CompletionRequest request = CompletionRequest.builder().participantId("p1").build();
        when(langchain.complete(request)).thenReturn(CompletableFuture.completedFuture("hello"));
        CompletionAdapterFactory factory = new CompletionAdapterFactory(properties, List.of(langchain, noOp));
        factory.init();

        assertEquals("hello", factory.complete(request).join());
        verify(langchain).complete(request);
    }
}
