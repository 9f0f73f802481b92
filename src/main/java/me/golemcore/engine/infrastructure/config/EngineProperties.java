package me.golemcore.engine.infrastructure.config;

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
import me.golemcore.engine.domain.model.ToolChoice;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code engine.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - agent profile, step bounds and tool policy</li>
 * <li>{@link StreamingProperties} - chunking, delta hand-off and pacing</li>
 * <li>{@link LlmProperties} - model client selection and connection</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineProperties {

    private AgentProperties agent = new AgentProperties();
    private StreamingProperties streaming = new StreamingProperties();
    private LlmProperties llm = new LlmProperties();

    @Data
    public static class AgentProperties {
        private String name = "assistant";
        private String systemPrompt = "You are a helpful agent. Use the available tools when they help, "
                + "and call terminate when the task is complete.";
        private String nextStepPrompt;
        private ToolChoice toolChoice = ToolChoice.AUTO;
        private List<String> specialTools = new ArrayList<>(List.of("terminate"));
        private int maxSteps = 30;
        private int duplicateThreshold = 2;
        private long toolTimeoutMs = 30_000;
        private boolean finishOnReply = true;
        private boolean silent = false;
    }

    @Data
    public static class StreamingProperties {
        private int chunkSize = 120;
        private int deltaQueueCapacity = 256;
        private boolean pacingEnabled = true;
        private long typewriterCharDelayMs = 30;
        private long lineBaseDelayMs = 500;
        private long lineCharDelayMs = 100;
        private long lineMinDelayMs = 500;
        private long lineMaxDelayMs = 6_000;
        private long lineRandomMinMs = 100;
        private long lineRandomMaxMs = 2_000;
    }

    @Data
    public static class LlmProperties {
        private String provider = "none";
        private String baseUrl;
        private String apiKey;
        private String model = "gpt-4o-mini";
        private long timeoutMs = 120_000;
        private double temperature = 0.7;
        private int maxRetries = 3;
    }
}
