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
package me.golemcore.negotiation.port.outbound;

import me.golemcore.negotiation.domain.model.CompletionRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the language-model completion collaborator that writes the next
 * line of a generated participant. Implementations are stateless per call and
 * may be shared across participants and sessions.
 */
public interface CompletionPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Produces the next utterance for the requesting participant. The future
     * fails with a {@code CollaboratorException} when the provider is
     * unavailable or times out. Implementations must not retry internally.
     */
    CompletableFuture<String> complete(CompletionRequest request);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
