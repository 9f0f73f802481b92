package me.golemcore.engine.domain.service;

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

import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.Message;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops messages that are not visible to the agent's speaker. Tool results follow
 * the assistant message that requested them, so a hidden tool call never leaves
 * an orphaned result behind.
 */
public class VisibilityMessageFormatter implements MessageFormatter {

    @Override
    public List<Message> format(List<Message> transcript, AgentContext context) {
        String speaker = context != null ? context.getSpeaker() : null;
        Set<String> hiddenCallIds = new HashSet<>();
        List<Message> visible = new ArrayList<>(transcript.size());

        for (Message message : transcript) {
            if (message.isToolMessage() && hiddenCallIds.contains(message.getToolCallId())) {
                continue;
            }
            if (isVisible(message, speaker)) {
                visible.add(message);
            } else if (message.hasToolCalls()) {
                message.getToolCalls().forEach(call -> hiddenCallIds.add(call.getId()));
            }
        }
        return visible;
    }

    private boolean isVisible(Message message, String speaker) {
        List<String> scope = message.getVisibleFor();
        if (scope == null || scope.isEmpty()) {
            return true;
        }
        return speaker != null && scope.contains(speaker);
    }
}
