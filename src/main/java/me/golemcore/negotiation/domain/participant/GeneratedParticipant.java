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

package me.golemcore.negotiation.domain.participant;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.exception.CollaboratorException;
import me.golemcore.negotiation.domain.model.CompletionRequest;
import me.golemcore.negotiation.domain.model.ParticipantKind;
import me.golemcore.negotiation.port.outbound.CompletionPort;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Participant whose turns are written by the completion collaborator from its
 * role instruction and the current attempt's transcript.
 *
 * <p>
 * A failed, timed out or empty completion surfaces as a
 * {@link CollaboratorException}; it never turns into an empty utterance.
 */
@Slf4j
public class GeneratedParticipant implements Participant {

    private final String id;
    private final String instruction;
    private final CompletionPort completionPort;
    private final Duration timeout;

    public GeneratedParticipant(String id, String instruction, CompletionPort completionPort, Duration timeout) {
        this.id = id;
        this.instruction = instruction;
        this.completionPort = completionPort;
        this.timeout = timeout;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public ParticipantKind getKind() {
        return ParticipantKind.GENERATED;
    }

    public String getInstruction() {
        return instruction;
    }

    @Override
    public String nextTurn(TurnContext context) throws InterruptedException {
        CompletionRequest request = CompletionRequest.builder()
                .sessionId(context.sessionId())
                .participantId(id)
                .instruction(instruction)
                .kickoffTask(context.kickoffTask())
                .transcript(context.segment())
                .build();

        CompletableFuture<String> future = completionPort.complete(request);
        String text;
        try {
            text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CollaboratorException(CollaboratorException.Kind.TIMEOUT,
                    "Completion for " + id + " timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw toCollaboratorException(e.getCause() != null ? e.getCause() : e);
        }

        if (text == null || text.isBlank()) {
            throw new CollaboratorException(CollaboratorException.Kind.UNAVAILABLE,
                    "Completion for " + id + " returned no content");
        }
        log.debug("[Participant] generated turn: participant={}, attempt={}, chars={}", id, context.attempt(),
                text.length());
        return text;
    }

    private CollaboratorException toCollaboratorException(Throwable cause) {
        if (cause instanceof CollaboratorException collaboratorException) {
            return collaboratorException;
        }
        return new CollaboratorException(CollaboratorException.Kind.UNAVAILABLE,
                "Completion for " + id + " failed: " + cause.getMessage(), cause);
    }
}
