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

import java.util.List;

/**
 * Turns the raw transcript into the message list sent to the model for one
 * agent. Implementations must not mutate the input list.
 */
@FunctionalInterface
public interface MessageFormatter {

    List<Message> format(List<Message> transcript, AgentContext context);

    static MessageFormatter identity() {
        return (transcript, context) -> List.copyOf(transcript);
    }
}
