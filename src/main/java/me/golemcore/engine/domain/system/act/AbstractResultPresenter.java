package me.golemcore.engine.domain.system.act;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.DisplayType;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.domain.system.HistoryWriter;

/**
 * Shared bookkeeping of result presenters: result cache, tool classification
 * and the tool-result message.
 */
abstract class AbstractResultPresenter implements ResultPresenter {

    private final ToolRegistry toolRegistry;
    private final HistoryWriter historyWriter;

    AbstractResultPresenter(ToolRegistry toolRegistry, HistoryWriter historyWriter) {
        this.toolRegistry = toolRegistry;
        this.historyWriter = historyWriter;
    }

    protected void cacheResult(AgentContext context, Message.ToolCall toolCall, ToolResult result) {
        context.addToolResult(toolCall.getId(), result);
    }

    protected void appendToTranscript(AgentContext context, Message.ToolCall toolCall, String text,
            MessageCategory category) {
        historyWriter.appendToolResult(context, toolCall, text, category);
    }

    protected MessageCategory categoryOf(Message.ToolCall toolCall) {
        return toolRegistry.get(toolCall.getName())
                .map(ToolComponent::getCategory)
                .orElse(MessageCategory.TOOL);
    }

    /**
     * Message type of events for this call: the tool name, unless the tool asks
     * for a dedicated display type.
     */
    protected String messageTypeOf(Message.ToolCall toolCall) {
        DisplayType displayType = toolRegistry.get(toolCall.getName())
                .map(ToolComponent::getDisplayType)
                .orElse(DisplayType.TOOL);
        return displayType == DisplayType.TOOL ? toolCall.getName() : displayType.getValue();
    }
}
