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
 * Remote chat message. The output is streamed line by line with a human-like
 * delay between lines.
 */
@Component
public class SendTelegramMessageTool implements ToolComponent {

    public static final String NAME = "send_telegram_message";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.of(NAME,
                "Use this tool to send a message to the user on Telegram. This is the primary way to "
                        + "communicate with the user on Telegram. Simulate real chat style by using short "
                        + "sentences with line breaks; reply with one to two lines for normal communication.",
                Map.of("response", ToolDefinition.stringParam(
                        "The message text that should be sent to the user on Telegram.")),
                List.of("response"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object response = parameters.get("response");
        if (!(response instanceof String text) || text.isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "response is required"));
        }
        return CompletableFuture.completedFuture(ToolResult.success(text));
    }

    @Override
    public MessageCategory getCategory() {
        return MessageCategory.TELEGRAM;
    }
}
