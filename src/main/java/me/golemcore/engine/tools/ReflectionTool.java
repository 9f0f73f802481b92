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
import me.golemcore.engine.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Private reflection and next-step plan. Stored as a thought and shown as an
 * inner thought, never sent to the user.
 */
@Component
public class ReflectionTool implements ToolComponent {

    public static final String NAME = "reflection";
    static final String EMPTY_REFLECTION = "Reflection: (empty)";
    static final String NEXT_PLAN_PREFIX = "Next plan: ";

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("reflection", ToolDefinition.stringParam(
                "Your private reflection about the current situation: what the user wants, what your goals "
                        + "are, and any uncertainties you need to resolve."));
        properties.put("next_plan", ToolDefinition.stringParam(
                "A concrete, concise plan for your next one or two actions."));
        return ToolDefinition.of(NAME,
                "Use this tool at each reasoning step to explicitly reflect on what you should do next. "
                        + "This reflection is internal thinking and is NOT sent to the user.",
                properties, List.of("reflection"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String reflection = stringParam(parameters, "reflection");
        String nextPlan = stringParam(parameters, "next_plan");

        List<String> parts = new ArrayList<>();
        if (!reflection.isEmpty()) {
            parts.add(reflection.replace("\n", ""));
        }
        if (!nextPlan.isEmpty()) {
            parts.add(NEXT_PLAN_PREFIX + nextPlan);
        }
        if (parts.isEmpty()) {
            parts.add(EMPTY_REFLECTION);
        }
        return CompletableFuture.completedFuture(ToolResult.success(String.join("\n", parts)));
    }

    @Override
    public MessageCategory getCategory() {
        return MessageCategory.THOUGHT;
    }

    @Override
    public DisplayType getDisplayType() {
        return DisplayType.INNER_THOUGHT;
    }

    private static String stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        return value instanceof String text ? text.strip() : "";
    }
}
