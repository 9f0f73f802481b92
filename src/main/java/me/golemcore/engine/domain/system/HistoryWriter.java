package me.golemcore.engine.domain.system;

import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;

import java.util.List;

/**
 * Single point of mutation for the transcript during a run. Strictly append-only.
 *
 * <p>
 * Thinker and actor should not write messages directly.
 */
public interface HistoryWriter {

    Message appendUser(AgentContext context, String content, MessageCategory category);

    Message appendAssistant(AgentContext context, String content, List<Message.ToolCall> toolCalls);

    Message appendToolResult(AgentContext context, Message.ToolCall toolCall, String content,
            MessageCategory category);
}
