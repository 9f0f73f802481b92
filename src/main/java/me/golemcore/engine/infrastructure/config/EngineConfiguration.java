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

package me.golemcore.engine.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.loop.StepLoop;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.service.AgentSessionService;
import me.golemcore.engine.domain.service.MessageFormatter;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.domain.service.VisibilityMessageFormatter;
import me.golemcore.engine.domain.system.DefaultHistoryWriter;
import me.golemcore.engine.domain.system.HistoryWriter;
import me.golemcore.engine.domain.system.act.Actor;
import me.golemcore.engine.domain.system.act.PacingStreamer;
import me.golemcore.engine.domain.system.act.ResultPresenter;
import me.golemcore.engine.domain.system.act.SilentResultPresenter;
import me.golemcore.engine.domain.system.act.Sleeper;
import me.golemcore.engine.domain.system.act.StreamingResultPresenter;
import me.golemcore.engine.domain.system.act.ToolCallExecutor;
import me.golemcore.engine.domain.system.think.Thinker;
import me.golemcore.engine.port.outbound.LlmPort;
import me.golemcore.engine.port.outbound.TranscriptPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the framework-free engine classes from {@link EngineProperties}.
 */
@Configuration
@Slf4j
public class EngineConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public AgentProfile agentProfile(EngineProperties properties) {
        EngineProperties.AgentProperties agent = properties.getAgent();
        AgentProfile profile = AgentProfile.builder()
                .name(agent.getName())
                .systemPrompt(agent.getSystemPrompt())
                .nextStepPrompt(agent.getNextStepPrompt())
                .toolChoice(agent.getToolChoice())
                .specialToolNames(new LinkedHashSet<>(agent.getSpecialTools()))
                .maxSteps(agent.getMaxSteps())
                .duplicateThreshold(agent.getDuplicateThreshold())
                .finishOnReply(agent.isFinishOnReply())
                .build();
        log.info("[Loop] Agent profile '{}': toolChoice={}, maxSteps={}, specialTools={}",
                profile.getName(), profile.getToolChoice(), profile.getMaxSteps(), profile.getSpecialToolNames());
        return profile;
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> toolComponents) {
        return new ToolRegistry(toolComponents);
    }

    @Bean
    public HistoryWriter historyWriter(TranscriptPort transcriptPort, Clock clock) {
        return new DefaultHistoryWriter(transcriptPort, clock);
    }

    @Bean
    public MessageFormatter messageFormatter() {
        return new VisibilityMessageFormatter();
    }

    @Bean
    public PacingStreamer pacingStreamer(EngineProperties properties) {
        return new PacingStreamer(properties.getStreaming(), Sleeper.THREAD, new Random());
    }

    @Bean
    public ToolCallExecutor toolCallExecutor(ToolRegistry toolRegistry, ObjectMapper objectMapper,
            EngineProperties properties) {
        return new ToolCallExecutor(toolRegistry, objectMapper,
                Duration.ofMillis(properties.getAgent().getToolTimeoutMs()));
    }

    @Bean
    public ResultPresenter resultPresenter(ToolRegistry toolRegistry, HistoryWriter historyWriter,
            PacingStreamer pacingStreamer, EngineProperties properties) {
        if (properties.getAgent().isSilent()) {
            log.info("[Act] Silent mode: tool results are recorded without events");
            return new SilentResultPresenter(toolRegistry, historyWriter);
        }
        return new StreamingResultPresenter(toolRegistry, historyWriter, pacingStreamer,
                properties.getStreaming().getChunkSize());
    }

    @Bean
    public Actor actor(ToolCallExecutor toolCallExecutor, ResultPresenter resultPresenter) {
        return new Actor(toolCallExecutor, resultPresenter);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService llmStreamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "llm-stream-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Thinker thinker(LlmPort llmPort, ToolRegistry toolRegistry, TranscriptPort transcriptPort,
            HistoryWriter historyWriter, MessageFormatter messageFormatter, ExecutorService llmStreamExecutor,
            EngineProperties properties, Clock clock) {
        return new Thinker(llmPort, toolRegistry, transcriptPort, historyWriter, messageFormatter,
                llmStreamExecutor, properties.getStreaming().getDeltaQueueCapacity(), clock);
    }

    @Bean
    public StepLoop stepLoop(Thinker thinker, Actor actor) {
        return new StepLoop(thinker, actor);
    }

    @Bean
    public AgentSessionService agentSessionService(AgentProfile agentProfile, StepLoop stepLoop,
            HistoryWriter historyWriter, TranscriptPort transcriptPort) {
        return new AgentSessionService(agentProfile, stepLoop, historyWriter, transcriptPort);
    }
}
