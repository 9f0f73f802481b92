package me.golemcore.engine.domain.system.act;

import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.system.EventSink;

/**
 * Turns one tool result into transcript state and events. Every implementation
 * caches the result by call id and appends exactly one tool-result message
 * carrying the full display text; they differ only in what reaches the stream.
 */
public interface ResultPresenter {

    void present(AgentContext context, Message.ToolCall toolCall, ToolResult result, EventSink sink);

    /**
     * Whether the act phase around this presenter may emit status events.
     */
    default boolean emitsEvents() {
        return true;
    }
}
