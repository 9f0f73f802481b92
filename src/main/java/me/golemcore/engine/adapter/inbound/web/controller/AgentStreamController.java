package me.golemcore.engine.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.adapter.inbound.web.dto.AgentEventDto;
import me.golemcore.engine.adapter.inbound.web.dto.MessageDto;
import me.golemcore.engine.adapter.inbound.web.dto.SessionStatusDto;
import me.golemcore.engine.adapter.inbound.web.dto.StreamRequest;
import me.golemcore.engine.domain.loop.AgentRunner;
import me.golemcore.engine.domain.model.AgentState;
import me.golemcore.engine.domain.model.InputMode;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.service.AgentSessionService;
import me.golemcore.engine.port.outbound.TranscriptPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Agent endpoints: run a session and stream its events as SSE, stop it, and
 * read its transcript.
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentStreamController {

    private final AgentSessionService sessionService;
    private final TranscriptPort transcriptPort;

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AgentEventDto>> stream(@RequestBody StreamRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        InputMode inputMode = InputMode.fromValue(request.getInputMode());
        boolean hasMessage = request.getMessage() != null && !request.getMessage().isBlank();
        if (!hasMessage && inputMode != InputMode.SKIP) {
            throw new IllegalArgumentException("message is required unless inputMode is skip");
        }

        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : UUID.randomUUID().toString();
        AgentRunner runner = sessionService.getOrCreate(sessionId);
        if (runner.getState() != AgentState.IDLE) {
            throw new IllegalStateException("Session " + sessionId + " is busy (" + runner.getState() + ")");
        }

        log.info("[API] Streaming run for session {} (input mode {})", sessionId, inputMode.getValue());
        return runner.stream(request.getMessage(), inputMode)
                .map(event -> ServerSentEvent.builder(AgentEventDto.from(event))
                        .id(sessionId)
                        .event(event.type().getValue())
                        .build())
                .doOnCancel(() -> log.info("[API] Client left session {}", sessionId));
    }

    @PostMapping("/{sessionId}/stop")
    public Mono<ResponseEntity<SessionStatusDto>> stop(@PathVariable String sessionId) {
        if (!sessionService.stop(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        return Mono.just(ResponseEntity.ok(toStatus(sessionId)));
    }

    @GetMapping("/{sessionId}")
    public Mono<ResponseEntity<SessionStatusDto>> getStatus(@PathVariable String sessionId) {
        if (sessionService.find(sessionId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        return Mono.just(ResponseEntity.ok(toStatus(sessionId)));
    }

    @GetMapping("/{sessionId}/transcript")
    public Mono<ResponseEntity<List<MessageDto>>> getTranscript(@PathVariable String sessionId) {
        List<Message> messages = transcriptPort.getMessages(sessionId);
        if (messages.isEmpty() && sessionService.find(sessionId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        return Mono.just(ResponseEntity.ok(messages.stream().map(MessageDto::from).toList()));
    }

    @GetMapping("/sessions")
    public Mono<ResponseEntity<List<String>>> listSessions() {
        return Mono.just(ResponseEntity.ok(sessionService.listSessions()));
    }

    private SessionStatusDto toStatus(String sessionId) {
        AgentRunner runner = sessionService.getOrCreate(sessionId);
        return SessionStatusDto.builder()
                .sessionId(sessionId)
                .state(runner.getState().name())
                .lastRunState(runner.getLastRunState().name())
                .currentStep(runner.getContext().getCurrentStep())
                .messageCount(transcriptPort.getMessages(sessionId).size())
                .build();
    }
}
