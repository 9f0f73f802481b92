package me.golemcore.engine.domain.loop;

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
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentEvent;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.system.EventSink;
import me.golemcore.engine.domain.system.act.Actor;
import me.golemcore.engine.domain.system.think.ThinkOutcome;
import me.golemcore.engine.domain.system.think.Thinker;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Map;

/**
 * Drives exactly one step: think, then act if the thinker asks for it. Never
 * retries; repeating steps is the job of {@link AgentRunner}.
 *
 * <p>
 * After a step either the agent is FINISHED, or the transcript gained one
 * assistant message plus one tool-result message per requested tool.
 */
@Slf4j
public class StepLoop {

    private final Thinker thinker;
    private final Actor actor;

    public StepLoop(Thinker thinker, Actor actor) {
        this.thinker = thinker;
        this.actor = actor;
    }

    /**
     * Non-streaming step.
     */
    public StepResult runStep(AgentContext context) {
        ThinkOutcome outcome = thinker.thinkBlocking(context);
        if (!outcome.shouldAct()) {
            return new StepResult(outcome, List.of());
        }
        List<ToolResult> results = actor.act(context, EventSink.NONE);
        return new StepResult(outcome, results);
    }

    /**
     * Streaming step. Every event is stamped with the current step and budget.
     *
     * @throws me.golemcore.engine.domain.system.act.ToolCallRequiredException
     *             if tool calls were required but the model produced none
     */
    public StepResult runStep(AgentContext context, EventSink sink) {
        EventSink stamped = event -> sink.emit(event.withStep(context.getCurrentStep(), context.getMaxSteps()));
        stamped.emit(AgentEvent.toolStatus("Thinking...", null, null, Map.of()));

        ThinkOutcome outcome = thinker.thinkStream(context, stamped);
        if (!outcome.shouldAct()) {
            log.debug("[Loop] Step {} ends without acting", context.getCurrentStep());
            return new StepResult(outcome, List.of());
        }
        List<ToolResult> results = actor.act(context, stamped);
        return new StepResult(outcome, results);
    }

    /**
     * One streaming step as a cold {@link Flux}. A protocol violation terminates
     * the flux with an error after the events that preceded it.
     */
    public Flux<AgentEvent> streamStep(AgentContext context) {
        return Flux.create(emitter -> {
            try {
                runStep(context, emitter::next);
                emitter.complete();
            } catch (RuntimeException e) {
                emitter.error(e);
            }
        });
    }
}
