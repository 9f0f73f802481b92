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

package me.golemcore.engine.tools;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.DisplayType;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Picks the communication channel for the reply and records the inner monologue
 * behind it. The decision is returned as structured data so clients can switch
 * channels; the monologue is the display text.
 */
@Component
public class StrategyTool implements ToolComponent {

    public static final String NAME = "strategy";
    private static final List<String> DECISIONS = List.of(
            MessageCategory.SPEAK_IN_PERSON.getIndicator(), MessageCategory.TELEGRAM.getIndicator());

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("decision", ToolDefinition.enumParam(
                "The communication channel to use: 'speakinperson' for face-to-face conversation, "
                        + "'telegram' for remote messaging via Telegram.",
                DECISIONS));
        properties.put("inner_monologue", ToolDefinition.stringParam(
                "A comprehensive inner monologue covering all personal aspects for the conversation."));
        return ToolDefinition.of(NAME,
                "Decide whether to use speak_in_person (face-to-face conversation) or telegram (remote "
                        + "messaging). Use this tool to make an inner monologue about how to communicate "
                        + "with the user.",
                properties, List.of("decision", "inner_monologue"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String decision = parameters.get("decision") instanceof String value ? value.strip() : "";
        String monologue = parameters.get("inner_monologue") instanceof String value ? value.strip() : "";

        if (!DECISIONS.contains(decision)) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "decision must be one of " + DECISIONS));
        }
        if (monologue.isEmpty()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "inner_monologue is required"));
        }
        return CompletableFuture.completedFuture(ToolResult.success(monologue,
                Map.of("decision", decision, "strategy", monologue)));
    }

    @Override
    public MessageCategory getCategory() {
        return MessageCategory.THOUGHT;
    }

    @Override
    public DisplayType getDisplayType() {
        return DisplayType.INNER_THOUGHT;
    }
}
