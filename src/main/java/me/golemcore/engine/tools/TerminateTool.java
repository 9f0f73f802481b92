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
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ends the interaction. Listed among the special tools, so a completed call
 * finishes the agent whatever status it reports.
 */
@Component
public class TerminateTool implements ToolComponent {

    public static final String NAME = "terminate";
    private static final List<String> STATUSES = List.of("success", "failure");

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.of(NAME,
                "Terminate the interaction when the request is met OR if the assistant cannot proceed "
                        + "further with the task.",
                Map.of("status", ToolDefinition.enumParam("The finish status of the interaction.", STATUSES)),
                List.of("status"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object status = parameters.get("status");
        if (!(status instanceof String value) || !STATUSES.contains(value)) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "status must be one of " + STATUSES));
        }
        return CompletableFuture.completedFuture(
                ToolResult.success("The interaction has been completed with status: " + value));
    }
}
