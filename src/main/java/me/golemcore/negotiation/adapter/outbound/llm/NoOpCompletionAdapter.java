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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.exception.CollaboratorException;
import me.golemcore.negotiation.domain.model.CompletionRequest;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op completion adapter used when no provider is configured.
 *
 * <p>
 * Every request fails as unavailable, so a session with generated participants
 * ends with a collaborator failure instead of inventing text.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpCompletionAdapter implements CompletionProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        log.warn("[LLM] complete() called for participant {} but no provider is configured",
                request.participantId());
        return CompletableFuture.failedFuture(new CollaboratorException(CollaboratorException.Kind.UNAVAILABLE,
                "No completion provider configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
