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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.model.CompletionRequest;
import me.golemcore.negotiation.infrastructure.config.NegotiationProperties;
import me.golemcore.negotiation.port.outbound.CompletionPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active completion adapter from {@code negotiation.llm.provider}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible chat models via langchain4j
 * <li>none - always unavailable
 * </ul>
 *
 * <p>
 * Unknown providers fall back to {@code none}.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class CompletionAdapterFactory implements CompletionPort {

    private static final String PROVIDER_NONE = "none";

    private final NegotiationProperties properties;
    private final List<CompletionProviderAdapter> adapters;

    private final Map<String, CompletionProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private CompletionProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (CompletionProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered completion adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[LLM] provider '{}' not found, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE);
        } else {
            log.info("[LLM] active completion provider: {}", provider);
        }
    }

    public CompletionPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        return activeAdapter.complete(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
