package me.golemcore.engine.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.port.outbound.TranscriptPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local transcript store. Each session keeps its messages in append
 * order; readers always get a copy.
 */
@Component
@Slf4j
public class InMemoryTranscriptAdapter implements TranscriptPort {

    private final Map<String, List<Message>> transcripts = new ConcurrentHashMap<>();

    @Override
    public void append(String sessionId, Message message) {
        if (sessionId == null || message == null) {
            throw new IllegalArgumentException("sessionId and message are required");
        }
        List<Message> transcript = transcripts.computeIfAbsent(sessionId,
                id -> Collections.synchronizedList(new ArrayList<>()));
        transcript.add(message);
        log.trace("Appended {} message to session {} ({} total)", message.getRole(), sessionId, transcript.size());
    }

    @Override
    public List<Message> getMessages(String sessionId) {
        List<Message> transcript = sessionId != null ? transcripts.get(sessionId) : null;
        if (transcript == null) {
            return List.of();
        }
        synchronized (transcript) {
            return List.copyOf(transcript);
        }
    }

    @Override
    public List<String> listSessions() {
        List<String> sessions = new ArrayList<>(transcripts.keySet());
        Collections.sort(sessions);
        return sessions;
    }
}
