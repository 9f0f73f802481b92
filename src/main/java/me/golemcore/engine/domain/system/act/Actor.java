package me.golemcore.engine.domain.system.act;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentEvent;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolChoice;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.system.EventSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Act phase: executes the pending tool calls strictly one after another, in the
 * order the model requested them. The result of call N is in the transcript
 * before call N+1 starts.
 */
@Slf4j
public class Actor {

    static final String TOOL_CALLS_REQUIRED = "Tool calls required but none provided";

    private final ToolCallExecutor executor;
    private final ResultPresenter presenter;

    public Actor(ToolCallExecutor executor, ResultPresenter presenter) {
        this.executor = executor;
        this.presenter = presenter;
    }

    /**
     * Executes and presents every pending call. Pending calls are consumed even if
     * presentation fails half-way.
     *
     * @return the results in call order
     * @throws ToolCallRequiredException
     *             if the policy is {@code required} and there is nothing to run
     */
    public List<ToolResult> act(AgentContext context, EventSink sink) {
        EventSink out = presenter.emitsEvents() ? sink : EventSink.NONE;
        if (!context.hasPendingToolCalls()) {
            context.setPendingToolCalls(new ArrayList<>());
            if (context.getToolChoice() == ToolChoice.REQUIRED) {
                log.warn("[Act] {}: {}", context.getSpeaker(), TOOL_CALLS_REQUIRED);
                out.emit(AgentEvent.error(TOOL_CALLS_REQUIRED, null, null));
                throw new ToolCallRequiredException(TOOL_CALLS_REQUIRED);
            }
            return List.of();
        }

        List<Message.ToolCall> batch = List.copyOf(context.getPendingToolCalls());
        context.setPendingToolCalls(new ArrayList<>());
        int total = batch.size();
        List<ToolResult> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            Message.ToolCall toolCall = batch.get(i);
            String name = toolCall.getName();
            out.emit(AgentEvent.toolStatus("Executing tool: " + name + " (" + (i + 1) + "/" + total + ")",
                    name, toolCall.getId(), Map.of(AgentEvent.META_STATUS, AgentEvent.STATUS_STARTED)));

            ToolResult result;
            try {
                result = executor.execute(context, toolCall);
                out.emit(AgentEvent.toolStatus("Tool " + name + " completed", name, toolCall.getId(),
                        Map.of(AgentEvent.META_STATUS, AgentEvent.STATUS_COMPLETED)));
            } catch (RuntimeException e) {
                log.error("[Act] Tool '{}' failed outside normalization", name, e);
                out.emit(AgentEvent.error("Tool " + name + " failed: " + e.getMessage(), name, toolCall.getId()));
                result = ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Error: " + e.getMessage());
            }

            presenter.present(context, toolCall, result, out);
            results.add(result);
        }
        return results;
    }

    /**
     * Non-streaming act: runs the same protocol without events and returns the
     * display texts of all results, separated by blank lines.
     */
    public String act(AgentContext context) {
        return act(context, EventSink.NONE).stream()
                .map(ToolResult::displayText)
                .collect(Collectors.joining("\n\n"));
    }
}
