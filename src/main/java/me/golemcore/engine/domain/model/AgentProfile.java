package me.golemcore.engine.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Static configuration of one agent: prompts, tool-choice policy, special tools
 * and run bounds. Shared by every run of the agent.
 */
@Value
@Builder(toBuilder = true)
public class AgentProfile {

    String name;
    String systemPrompt;

    /**
     * Appended as a system message before every model call. May contain a
     * {@code {current_step}} placeholder.
     */
    String nextStepPrompt;

    @Builder.Default
    ToolChoice toolChoice = ToolChoice.AUTO;

    @Builder.Default
    Set<String> specialToolNames = Set.of("terminate");

    @Builder.Default
    int maxSteps = 30;

    @Builder.Default
    int duplicateThreshold = 2;

    /**
     * When true the outer driver ends the run after a step that produced a
     * content-only reply.
     */
    @Builder.Default
    boolean finishOnReply = true;

    List<String> visibleFor;

    public boolean isSpecialTool(String toolName) {
        if (toolName == null || specialToolNames == null) {
            return false;
        }
        String normalized = toolName.toLowerCase(Locale.ROOT);
        return specialToolNames.stream()
                .anyMatch(name -> name.toLowerCase(Locale.ROOT).equals(normalized));
    }
}
