package me.golemcore.engine.domain.system;

import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.MessageRole;
import me.golemcore.engine.port.outbound.TranscriptPort;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation that stamps speaker, visibility and time from the agent
 * context and appends through the transcript port.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final TranscriptPort transcriptPort;
    private final Clock clock;

    public DefaultHistoryWriter(TranscriptPort transcriptPort, Clock clock) {
        this.transcriptPort = transcriptPort;
        this.clock = clock;
    }

    @Override
    public Message appendUser(AgentContext context, String content, MessageCategory category) {
        Message user = base(context, MessageRole.USER)
                .content(content)
                .category(category != null ? category : MessageCategory.NORMAL)
                .speaker(null)
                .build();
        return append(context, user);
    }

    @Override
    public Message appendAssistant(AgentContext context, String content, List<Message.ToolCall> toolCalls) {
        Message assistant = base(context, MessageRole.ASSISTANT)
                .content(content)
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls))
                .category(MessageCategory.NORMAL)
                .build();
        return append(context, assistant);
    }

    @Override
    public Message appendToolResult(AgentContext context, Message.ToolCall toolCall, String content,
            MessageCategory category) {
        Message toolMsg = base(context, MessageRole.TOOL)
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .content(content)
                .category(category != null ? category : MessageCategory.TOOL)
                .build();
        return append(context, toolMsg);
    }

    private Message.MessageBuilder base(AgentContext context, MessageRole role) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .speaker(context.getSpeaker())
                .visibleFor(context.getProfile() != null ? context.getProfile().getVisibleFor() : null)
                .timestamp(now());
    }

    private Message append(AgentContext context, Message message) {
        transcriptPort.append(context.getSessionId(), message);
        return message;
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
