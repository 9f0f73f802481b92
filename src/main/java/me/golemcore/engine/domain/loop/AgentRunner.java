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
import me.golemcore.engine.domain.model.AgentEventType;
import me.golemcore.engine.domain.model.AgentState;
import me.golemcore.engine.domain.model.InputMode;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.system.EventSink;
import me.golemcore.engine.domain.system.HistoryWriter;
import me.golemcore.engine.port.outbound.TranscriptPort;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outer driver of one agent: appends the user input, then repeats steps until
 * the agent finishes, the step budget is spent, or the run is cancelled.
 *
 * <p>
 * Only one run may be active at a time. A run starts from IDLE; during it the
 * agent is RUNNING, and once it ends the terminal state is recorded in
 * {@link #getLastRunState()} and the agent returns to IDLE for the next input.
 * An exception escaping a step marks the run as ERROR and is rethrown.
 *
 * <p>
 * When the last transcript entry repeats earlier assistant replies
 * {@code duplicateThreshold} times, a change-of-strategy hint is prepended to
 * the next-step prompt.
 */
@Slf4j
public class AgentRunner {

    static final String STUCK_PROMPT = "Observed duplicate responses. Consider new strategies and avoid "
            + "repeating ineffective paths already attempted.";

    private final AgentContext context;
    private final StepLoop stepLoop;
    private final HistoryWriter historyWriter;
    private final TranscriptPort transcriptPort;
    private final Scheduler scheduler;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile AgentState lastRunState = AgentState.IDLE;

    public AgentRunner(AgentContext context, StepLoop stepLoop, HistoryWriter historyWriter,
            TranscriptPort transcriptPort) {
        this(context, stepLoop, historyWriter, transcriptPort, Schedulers.boundedElastic());
    }

    public AgentRunner(AgentContext context, StepLoop stepLoop, HistoryWriter historyWriter,
            TranscriptPort transcriptPort, Scheduler scheduler) {
        this.context = context;
        this.stepLoop = stepLoop;
        this.historyWriter = historyWriter;
        this.transcriptPort = transcriptPort;
        this.scheduler = scheduler;
    }

    /**
     * Runs to completion without events.
     *
     * <p>
     * The return value is a step log ({@code "Step N: <summary>"} per step, or
     * {@code "No steps executed"}), not the assistant text. Callers that need the
     * generated text read the transcript or use {@link #stream}.
     *
     * @return one summary line per executed step
     * @throws IllegalStateException
     *             if the agent is not IDLE
     */
    public String run(String userInput, InputMode inputMode) {
        List<String> results = execute(userInput, inputMode, EventSink.NONE, false);
        return results.isEmpty() ? "No steps executed" : String.join("\n", results);
    }

    /**
     * Runs on a bounded-elastic worker and streams every event. A STEP event
     * opens each step and a FINAL event closes the run. Cancelling the
     * subscription cancels the in-flight model or tool call and stops before the
     * next step. If a step throws, an error event is emitted before the flux
     * terminates with the exception.
     */
    public Flux<AgentEvent> stream(String userInput, InputMode inputMode) {
        if (context.getState() != AgentState.IDLE) {
            return Flux.error(new IllegalStateException("Cannot run agent from state: " + context.getState()));
        }
        return Flux.<AgentEvent>create(emitter -> {
            emitter.onCancel(this::cancel);
            try {
                execute(userInput, inputMode, emitter::next, true);
                emitter.next(AgentEvent.builder()
                        .type(AgentEventType.FINAL)
                        .metadata(Map.of(AgentEvent.META_STATE, lastRunState.name()))
                        .build()
                        .withStep(context.getCurrentStep(), context.getMaxSteps()));
                emitter.complete();
            } catch (RuntimeException e) {
                emitter.next(AgentEvent.error(e.getMessage(), null, null)
                        .withStep(context.getCurrentStep(), context.getMaxSteps()));
                emitter.error(e);
            }
        }).subscribeOn(scheduler);
    }

    /**
     * Requests the active run to stop. The in-flight call is cancelled; the run
     * ends before its next step.
     */
    public void cancel() {
        if (!running.get()) {
            return;
        }
        cancelRequested.set(true);
        boolean cancelled = context.cancelInFlight();
        log.info("[Loop] Cancellation requested for session {} (in-flight call cancelled: {})",
                context.getSessionId(), cancelled);
    }

    public AgentState getState() {
        return context.getState();
    }

    public AgentState getLastRunState() {
        return lastRunState;
    }

    public AgentContext getContext() {
        return context;
    }

    private List<String> execute(String userInput, InputMode inputMode, EventSink sink, boolean streaming) {
        begin();
        List<String> results = new ArrayList<>();
        AgentState finalState = AgentState.IDLE;
        try {
            appendUserInput(userInput, inputMode);
            int maxSteps = context.getMaxSteps();

            while (context.getCurrentStep() < maxSteps && !context.isFinished() && !cancelRequested.get()) {
                context.setCurrentStep(context.getCurrentStep() + 1);
                int step = context.getCurrentStep();
                log.info("[Loop] Executing step {}/{}", step, maxSteps);
                sink.emit(AgentEvent.builder()
                        .type(AgentEventType.STEP)
                        .content("Step " + step + "/" + maxSteps)
                        .build()
                        .withStep(step, maxSteps));

                StepResult result = streaming ? stepLoop.runStep(context, sink) : stepLoop.runStep(context);
                results.add("Step " + step + ": " + result.summary());

                if (result.replied() && context.getProfile().isFinishOnReply()) {
                    context.markFinished();
                }
                if (isStuck()) {
                    handleStuckState();
                }
            }

            if (context.getCurrentStep() >= maxSteps && !context.isFinished()) {
                log.warn("[Loop] Terminated: reached max steps ({})", maxSteps);
            }
            finalState = context.isFinished() ? AgentState.FINISHED : AgentState.IDLE;
            return results;
        } catch (RuntimeException e) {
            finalState = AgentState.ERROR;
            context.setState(AgentState.ERROR);
            log.error("[Loop] Step {} failed for session {}", context.getCurrentStep(), context.getSessionId(), e);
            throw e;
        } finally {
            end(finalState);
        }
    }

    private void begin() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Cannot run agent from state: " + context.getState());
        }
        if (context.getState() != AgentState.IDLE) {
            running.set(false);
            throw new IllegalStateException("Cannot run agent from state: " + context.getState());
        }
        cancelRequested.set(false);
        context.setState(AgentState.RUNNING);
        context.setCurrentStep(0);
        context.setNextStepPrompt(context.getProfile().getNextStepPrompt());
    }

    private void end(AgentState finalState) {
        lastRunState = finalState;
        context.setState(AgentState.IDLE);
        context.setInFlightCall(null);
        running.set(false);
        log.info("[Loop] Run for session {} ended after {} steps with state {}",
                context.getSessionId(), context.getCurrentStep(), finalState);
    }

    private void appendUserInput(String userInput, InputMode inputMode) {
        InputMode mode = inputMode != null ? inputMode : InputMode.PHONE;
        if (userInput == null || userInput.isBlank() || mode == InputMode.SKIP) {
            return;
        }
        historyWriter.appendUser(context, userInput, mode.getCategory());
    }

    boolean isStuck() {
        List<Message> messages = transcriptPort.getMessages(context.getSessionId());
        if (messages.size() < 2) {
            return false;
        }
        Message last = messages.get(messages.size() - 1);
        if (!last.hasContent()) {
            return false;
        }
        long duplicates = messages.subList(0, messages.size() - 1).stream()
                .filter(Message::isAssistantMessage)
                .filter(message -> last.getContent().equals(message.getContent()))
                .count();
        return duplicates >= context.getProfile().getDuplicateThreshold();
    }

    private void handleStuckState() {
        String current = context.getNextStepPrompt();
        context.setNextStepPrompt(current == null || current.isBlank() ? STUCK_PROMPT : STUCK_PROMPT + "\n" + current);
        log.warn("[Loop] Agent detected stuck state. Added prompt: {}", STUCK_PROMPT);
    }
}
