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
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Face-to-face speech. The output is the speech itself and is streamed with the
 * typewriter pacing.
 */
@Component
public class SpeakInPersonTool implements ToolComponent {

    public static final String NAME = "speak_in_person";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.of(NAME,
                "Use this tool to express speech in person (face-to-face conversation). "
                        + "You can use parentheses to include actions, expressions, and other objective elements.",
                Map.of("content", ToolDefinition.stringParam("The in-person speech content.")),
                List.of("content"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object content = parameters.get("content");
        if (!(content instanceof String text) || text.isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "content is required"));
        }
        return CompletableFuture.completedFuture(ToolResult.success(text));
    }

    @Override
    public MessageCategory getCategory() {
        return MessageCategory.SPEAK_IN_PERSON;
    }
}
