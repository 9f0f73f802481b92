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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.loop.AgentRunner;
import me.golemcore.engine.domain.loop.StepLoop;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.system.HistoryWriter;
import me.golemcore.engine.port.outbound.TranscriptPort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link AgentRunner} per session so consecutive inputs of a session
 * share their step state and transcript.
 */
@Slf4j
public class AgentSessionService {

    private final AgentProfile profile;
    private final StepLoop stepLoop;
    private final HistoryWriter historyWriter;
    private final TranscriptPort transcriptPort;

    private final Map<String, AgentRunner> runners = new ConcurrentHashMap<>();

    public AgentSessionService(AgentProfile profile, StepLoop stepLoop, HistoryWriter historyWriter,
            TranscriptPort transcriptPort) {
        this.profile = profile;
        this.stepLoop = stepLoop;
        this.historyWriter = historyWriter;
        this.transcriptPort = transcriptPort;
    }

    public AgentRunner getOrCreate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return runners.computeIfAbsent(sessionId, this::createRunner);
    }

    public Optional<AgentRunner> find(String sessionId) {
        return Optional.ofNullable(sessionId != null ? runners.get(sessionId) : null);
    }

    /**
     * Cancels the active run of a session.
     *
     * @return false if the session is unknown
     */
    public boolean stop(String sessionId) {
        Optional<AgentRunner> runner = find(sessionId);
        runner.ifPresent(AgentRunner::cancel);
        return runner.isPresent();
    }

    public List<String> listSessions() {
        List<String> sessions = new ArrayList<>(runners.keySet());
        Collections.sort(sessions);
        return sessions;
    }

    private AgentRunner createRunner(String sessionId) {
        log.info("[Loop] Creating agent '{}' for session {}", profile.getName(), sessionId);
        AgentContext context = AgentContext.builder()
                .sessionId(sessionId)
                .profile(profile)
                .nextStepPrompt(profile.getNextStepPrompt())
                .build();
        return new AgentRunner(context, stepLoop, historyWriter, transcriptPort);
    }
}
