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

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable transcript entry. Assistant messages may carry tool calls; tool
 * messages carry the id of the call they answer. Category, speaker and
 * visibility are only interpreted by message formatters.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    String id;
    MessageRole role;
    String content;

    List<ToolCall> toolCalls;
    String toolCallId; // For tool result messages
    String toolName;

    Instant timestamp;
    MessageCategory category;
    String speaker;
    List<String> visibleFor; // null means visible for everyone

    public boolean isUserMessage() {
        return role == MessageRole.USER;
    }

    public boolean isAssistantMessage() {
        return role == MessageRole.ASSISTANT;
    }

    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }

    public boolean isToolMessage() {
        return role == MessageRole.TOOL;
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public static Message system(String content, Instant timestamp) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.SYSTEM)
                .content(content)
                .category(MessageCategory.NORMAL)
                .timestamp(timestamp)
                .build();
    }

    public static Message user(String content, MessageCategory category, Instant timestamp) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(MessageRole.USER)
                .content(content)
                .category(category != null ? category : MessageCategory.NORMAL)
                .timestamp(timestamp)
                .build();
    }

    /**
     * Represents a tool invocation requested by the LLM. Arguments are kept as the
     * raw JSON text the model produced, which may be malformed.
     */
    @Value
    @Builder
    public static class ToolCall {
        String id;
        String name;
        String arguments;
    }
}
