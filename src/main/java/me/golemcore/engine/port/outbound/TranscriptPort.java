package me.golemcore.engine.port.outbound;

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

import me.golemcore.engine.domain.model.Message;

import java.util.List;

/**
 * Port for the memory layer holding session transcripts. The engine only ever
 * appends; retrieval returns the pre-assembled message list for a session.
 */
public interface TranscriptPort {

    void append(String sessionId, Message message);

    /**
     * Returns an immutable snapshot of the session transcript in append order.
     * Unknown sessions yield an empty list.
     */
    List<Message> getMessages(String sessionId);

    List<String> listSessions();
}
