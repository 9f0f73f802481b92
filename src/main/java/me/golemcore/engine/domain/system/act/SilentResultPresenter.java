package me.golemcore.engine.domain.system.act;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.domain.system.EventSink;
import me.golemcore.engine.domain.system.HistoryWriter;

/**
 * Presenter for background agents: same transcript mutation and result cache as
 * the streaming presenter, but nothing is emitted.
 */
@Slf4j
public class SilentResultPresenter extends AbstractResultPresenter {

    public SilentResultPresenter(ToolRegistry toolRegistry, HistoryWriter historyWriter) {
        super(toolRegistry, historyWriter);
    }

    @Override
    public void present(AgentContext context, Message.ToolCall toolCall, ToolResult result, EventSink sink) {
        cacheResult(context, toolCall, result);
        log.info("[Act] {} tool '{}' completed silently", context.getSpeaker(), toolCall.getName());
        appendToTranscript(context, toolCall, result.displayText(), categoryOf(toolCall));
    }

    @Override
    public boolean emitsEvents() {
        return false;
    }
}
