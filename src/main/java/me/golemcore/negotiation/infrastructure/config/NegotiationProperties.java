package me.golemcore.negotiation.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code negotiation.*} prefix:
 * <ul>
 * <li>turn limits: message budget per attempt and retry bound</li>
 * <li>{@link MarkerProperties} - textual protocol for declaring agreement</li>
 * <li>default role instructions and the kickoff task</li>
 * <li>{@link LlmProperties} - completion collaborator settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "negotiation")
@Data
public class NegotiationProperties {

    private int messageBudget = 50;
    private int retryBound = 2;
    private String coordinatorId = "moderator";
    private MarkerProperties markers = new MarkerProperties();
    private List<String> affirmationPhrases = new ArrayList<>(List.of("賛成", "同意", "了承"));
    private String kickoffTask = "You are a group of travellers and a moderator. Agree on one domestic trip plan, "
            + "with a budget and a day-by-day schedule. Start the discussion.";
    private String defaultCoordinatorInstruction = "You moderate the negotiation. Manage the speaking order and "
            + "summarize positions. Never speak for other participants. Only when every participant has explicitly "
            + "agreed, put 【合意確定】 alone on the first line and follow it with 【最終合意プラン】 and the full plan.";
    private String defaultParticipantInstruction = "You take part in the negotiation. State your wishes, concede "
            + "where needed, and answer proposals with 賛成, 条件付き賛成 or 反対.";
    private int manualInputQueueDepth = 8;
    private int subscriberQueueLimit = 0;
    private long completionTimeoutMs = 120_000;
    private String websocketPath = "/ws/negotiations";
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class MarkerProperties {
        private String agreement = "【合意確定】";
        private String finalPlan = "【最終合意プラン】";
    }

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature;
        private long timeoutMs = 60_000;
    }
}
