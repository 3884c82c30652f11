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

package me.golemcore.negotiation.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.exception.CollaboratorException;
import me.golemcore.negotiation.domain.model.CompletionRequest;
import me.golemcore.negotiation.domain.model.Utterance;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Completion adapter backed by an OpenAI-compatible chat model from
 * langchain4j.
 *
 * <p>
 * The requesting participant's own utterances become assistant messages; every
 * other speaker's utterance becomes a user message prefixed with the speaker
 * id. Provider retries are disabled: a failed call surfaces as a
 * {@link CollaboratorException} and aborts the session.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jCompletionAdapter implements CompletionProviderAdapter {

    private final NegotiationProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        NegotiationProperties.LlmProperties llm = properties.getLlm();
        if (!hasApiKey()) {
            log.warn("[LLM] langchain4j adapter has no api key configured");
            return;
        }
        try {
            this.chatModel = createModel(llm);
            initialized = true;
            log.info("[LLM] langchain4j adapter initialized with model: {}", llm.getModel());
        } catch (Exception e) { // NOSONAR - report as unavailable on first use
            log.warn("[LLM] failed to initialize langchain4j adapter: {}", e.getMessage());
        }
    }

    private ChatModel createModel(NegotiationProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new CollaboratorException(CollaboratorException.Kind.UNAVAILABLE,
                        "Langchain4j adapter not available");
            }
            try {
                ChatResponse response = chatModel.chat(convertMessages(request));
                String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                log.debug("[LLM] completion received: sessionId={}, participant={}, chars={}",
                        request.sessionId(), request.participantId(), text != null ? text.length() : 0);
                return text;
            } catch (Exception e) { // NOSONAR - every provider fault is a collaborator failure
                CollaboratorException failure = CompletionErrorClassifier.toCollaboratorException(e);
                log.error("[LLM] completion failed: sessionId={}, participant={}, kind={}",
                        request.sessionId(), request.participantId(), failure.getKind(), e);
                throw failure;
            }
        });
    }

    List<ChatMessage> convertMessages(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.instruction() != null && !request.instruction().isBlank()) {
            messages.add(SystemMessage.from(request.instruction()));
        }
        if (request.kickoffTask() != null && !request.kickoffTask().isBlank()) {
            messages.add(UserMessage.from(request.kickoffTask()));
        }
        for (Utterance utterance : request.transcript()) {
            if (utterance.speakerId().equals(request.participantId())) {
                messages.add(AiMessage.from(utterance.text()));
            } else {
                messages.add(UserMessage.from("[" + utterance.speakerId() + "] " + utterance.text()));
            }
        }
        return messages;
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private boolean hasApiKey() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public boolean isAvailable() {
        return hasApiKey();
    }
}
