package me.golemcore.engine.domain.system.think;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentEvent;
import me.golemcore.engine.domain.model.LlmDelta;
import me.golemcore.engine.domain.model.LlmRequest;
import me.golemcore.engine.domain.model.LlmResponse;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolChoice;
import me.golemcore.engine.domain.service.MessageFormatter;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.domain.system.EventSink;
import me.golemcore.engine.domain.system.HistoryWriter;
import me.golemcore.engine.port.outbound.LlmPort;
import me.golemcore.engine.port.outbound.TranscriptPort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Think phase: asks the model for the next assistant message and decides whether
 * the act phase should run.
 *
 * <p>
 * Policy handling:
 * <ul>
 * <li>{@code none} - tool calls are dropped, content is committed as a
 * reply.</li>
 * <li>{@code auto} - tool calls lead to acting, content alone is a reply.</li>
 * <li>{@code required} - always acts; the actor rejects a step without tool
 * calls.</li>
 * </ul>
 * A response with neither content nor tool calls commits nothing and finishes
 * the agent, except under {@code required}. A failing model call is recorded as
 * a synthetic assistant message and never acts.
 */
@Slf4j
public class Thinker {

    static final String FAILURE_PREFIX = "Error encountered while processing: ";
    private static final String STEP_PLACEHOLDER = "{current_step}";

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final TranscriptPort transcriptPort;
    private final HistoryWriter historyWriter;
    private final MessageFormatter messageFormatter;
    private final Executor streamExecutor;
    private final int deltaQueueCapacity;
    private final Clock clock;

    public Thinker(LlmPort llmPort, ToolRegistry toolRegistry, TranscriptPort transcriptPort,
            HistoryWriter historyWriter, MessageFormatter messageFormatter, Executor streamExecutor,
            int deltaQueueCapacity, Clock clock) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.transcriptPort = transcriptPort;
        this.historyWriter = historyWriter;
        this.messageFormatter = messageFormatter;
        this.streamExecutor = streamExecutor;
        this.deltaQueueCapacity = deltaQueueCapacity;
        this.clock = clock;
    }

    /**
     * Non-streaming think.
     *
     * @return whether the act phase should run
     */
    public boolean think(AgentContext context) {
        return thinkBlocking(context).shouldAct();
    }

    /**
     * Non-streaming think returning the full decision.
     */
    public ThinkOutcome thinkBlocking(AgentContext context) {
        LlmRequest request = buildRequest(context);
        LlmResponse response;
        try {
            CompletableFuture<LlmResponse> call = llmPort.chat(request);
            context.setInFlightCall(call);
            response = call.join();
        } catch (CompletionException | CancellationException e) {
            recordFailure(context, unwrap(e));
            return ThinkOutcome.failure();
        } catch (RuntimeException e) {
            recordFailure(context, e);
            return ThinkOutcome.failure();
        } finally {
            context.setInFlightCall(null);
        }
        if (response == null) {
            response = LlmResponse.builder().build();
        }
        return commit(context, response.getContent(), response.getToolCalls());
    }

    /**
     * Streaming think. Emits a token event per text delta, a status event per
     * tool call delta, a summary of the selected tools, and always finishes with a
     * status event whose metadata carries {@code should_act}.
     */
    public ThinkOutcome thinkStream(AgentContext context, EventSink sink) {
        LlmRequest request = buildRequest(context);
        DeltaChannel channel = openChannel();
        CompletableFuture<LlmResponse> producer = startProducer(request, channel);
        context.setInFlightCall(producer);

        StringBuilder streamed = new StringBuilder();
        boolean drained = false;
        try {
            drained = channel.drain(delta -> forward(delta, streamed, sink));
            if (!drained) {
                producer.cancel(true);
            }
            LlmResponse response = producer.join();
            if (response == null) {
                response = LlmResponse.builder().build();
            }

            String content = response.getContent();
            if ((content == null || content.isEmpty()) && !response.hasToolCalls() && streamed.length() > 0) {
                content = streamed.toString().strip();
            }
            if (response.hasToolCalls()) {
                List<String> toolNames = response.getToolCalls().stream()
                        .filter(Objects::nonNull)
                        .map(Message.ToolCall::getName)
                        .toList();
                log.info("[Think] {} selected {} tools: {}", context.getSpeaker(), toolNames.size(), toolNames);
                sink.emit(AgentEvent.toolStatus("Preparing to call tools: " + String.join(", ", toolNames),
                        null, null, Map.of(AgentEvent.META_TOOL_NAMES, toolNames)));
            }

            ThinkOutcome outcome = commit(context, content, response.getToolCalls());
            sink.emit(AgentEvent.toolStatus(outcome.replied() || outcome.shouldAct() ? "Thinking complete"
                    : "Thinking complete (no output)", null, null,
                    Map.of(AgentEvent.META_SHOULD_ACT, outcome.shouldAct())));
            return outcome;
        } catch (CompletionException | CancellationException e) {
            Throwable cause = unwrap(e);
            recordFailure(context, cause);
            sink.emit(AgentEvent.error("Thinking failed: " + describe(cause), null, null));
            sink.emit(AgentEvent.toolStatus("Thinking failed", null, null,
                    Map.of(AgentEvent.META_SHOULD_ACT, false)));
            return ThinkOutcome.failure();
        } finally {
            if (!channel.isClosed() || !drained) {
                channel.abandon();
                producer.cancel(true);
            }
            context.setInFlightCall(null);
        }
    }

    protected DeltaChannel openChannel() {
        return new DeltaChannel(deltaQueueCapacity);
    }

    /**
     * Runs the streaming call on the stream executor. The end marker is sent by
     * whichever thread completes or cancels the returned future, never by the
     * draining thread.
     */
    private CompletableFuture<LlmResponse> startProducer(LlmRequest request, DeltaChannel channel) {
        CompletableFuture<LlmResponse> producer = new CompletableFuture<>();
        AtomicReference<CompletableFuture<LlmResponse>> modelCall = new AtomicReference<>();
        producer.whenComplete((response, error) -> {
            channel.close();
            CompletableFuture<LlmResponse> call = modelCall.get();
            if (producer.isCancelled() && call != null) {
                call.cancel(true);
            }
        });

        try {
            streamExecutor.execute(() -> {
                try {
                    CompletableFuture<LlmResponse> call = llmPort.chatStream(request, channel::publish);
                    modelCall.set(call);
                    call.whenComplete((response, error) -> {
                        if (error != null) {
                            producer.completeExceptionally(unwrap(error));
                        } else {
                            producer.complete(response);
                        }
                    });
                } catch (RuntimeException e) {
                    producer.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            producer.completeExceptionally(e);
        }
        return producer;
    }

    private void forward(LlmDelta delta, StringBuilder streamed, EventSink sink) {
        if (delta.isText()) {
            if (delta.text() != null && !delta.text().isEmpty()) {
                streamed.append(delta.text());
                sink.emit(AgentEvent.token(delta.text(), null, null));
            }
        } else if (delta.toolName() != null && !delta.toolName().isBlank()) {
            sink.emit(AgentEvent.toolStatus("Preparing tool: " + delta.toolName(), delta.toolName(), null,
                    Map.of()));
        }
    }

    private ThinkOutcome commit(AgentContext context, String content, List<Message.ToolCall> requested) {
        ToolChoice choice = context.getToolChoice();
        List<Message.ToolCall> toolCalls = requested == null ? List.of()
                : requested.stream().filter(Objects::nonNull).toList();

        if (choice == ToolChoice.NONE && !toolCalls.isEmpty()) {
            log.warn("[Think] {} asked to use tools when they weren't available: {}", context.getSpeaker(),
                    toolCalls.stream().map(Message.ToolCall::getName).toList());
            toolCalls = List.of();
        }

        boolean hasContent = content != null && !content.isEmpty();
        context.setPendingToolCalls(new ArrayList<>(toolCalls));

        if (!hasContent && toolCalls.isEmpty()) {
            if (choice == ToolChoice.REQUIRED) {
                log.warn("[Think] {} returned nothing although tool calls are required", context.getSpeaker());
                return ThinkOutcome.act();
            }
            log.info("[Think] {} has no content and no tool calls, finishing", context.getSpeaker());
            context.markFinished();
            return ThinkOutcome.idle();
        }

        historyWriter.appendAssistant(context, content, toolCalls);

        if (!toolCalls.isEmpty() || choice == ToolChoice.REQUIRED) {
            return ThinkOutcome.act();
        }
        return ThinkOutcome.reply();
    }

    private void recordFailure(AgentContext context, Throwable error) {
        log.error("[Think] {}'s thinking process hit a snag: {}", context.getSpeaker(), describe(error), error);
        context.setPendingToolCalls(new ArrayList<>());
        historyWriter.appendAssistant(context, FAILURE_PREFIX + describe(error), null);
    }

    LlmRequest buildRequest(AgentContext context) {
        List<Message> systemMessages = new ArrayList<>();
        String systemPrompt = context.getProfile() != null ? context.getProfile().getSystemPrompt() : null;
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            systemMessages.add(Message.system(systemPrompt, clock.instant()));
        }

        List<Message> messages = new ArrayList<>(
                messageFormatter.format(transcriptPort.getMessages(context.getSessionId()), context));
        String nextStepPrompt = context.getNextStepPrompt();
        if (nextStepPrompt != null && !nextStepPrompt.isBlank()) {
            String formatted = nextStepPrompt.replace(STEP_PLACEHOLDER, String.valueOf(context.getCurrentStep()));
            messages.add(Message.system(formatted, clock.instant()));
        }

        return LlmRequest.builder()
                .sessionId(context.getSessionId())
                .systemMessages(systemMessages)
                .messages(messages)
                .tools(context.getToolChoice() == ToolChoice.NONE ? List.of() : toolRegistry.getDefinitions())
                .toolChoice(context.getToolChoice())
                .build();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error instanceof CancellationException) {
            return "model call cancelled";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
