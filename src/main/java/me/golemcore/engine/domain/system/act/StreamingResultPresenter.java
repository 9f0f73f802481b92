package me.golemcore.engine.domain.system.act;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentEvent;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.domain.system.EventSink;
import me.golemcore.engine.domain.system.HistoryWriter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Presents results on the live stream. Structured data goes out first as a
 * {@code tool_output} event with null text. Communication-channel text is paced,
 * everything else is cut into fixed-size token events. The transcript receives
 * the full text once the stream is done.
 */
@Slf4j
public class StreamingResultPresenter extends AbstractResultPresenter {

    private static final String RESULT_TYPE_TOOL = "tool_result";

    private final PacingStreamer pacingStreamer;
    private final int chunkSize;

    public StreamingResultPresenter(ToolRegistry toolRegistry, HistoryWriter historyWriter,
            PacingStreamer pacingStreamer, int chunkSize) {
        super(toolRegistry, historyWriter);
        this.pacingStreamer = pacingStreamer;
        this.chunkSize = chunkSize;
    }

    @Override
    public void present(AgentContext context, Message.ToolCall toolCall, ToolResult result, EventSink sink) {
        cacheResult(context, toolCall, result);
        String text = result.displayText();
        String messageType = messageTypeOf(toolCall);
        MessageCategory category = categoryOf(toolCall);
        log.info("[Act] Tool '{}' completed its mission", toolCall.getName());

        if (result.hasData()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(AgentEvent.META_STRUCTURED_DATA, result.getData());
            metadata.put(AgentEvent.META_RESULT_TYPE, RESULT_TYPE_TOOL);
            sink.emit(AgentEvent.toolOutput(null, messageType, toolCall.getId(), metadata));
        }

        if (category.isCommunication()) {
            pacingStreamer.stream(text, category,
                    piece -> sink.emit(AgentEvent.token(piece, messageType, toolCall.getId())));
        } else {
            for (String chunk : ContentChunker.chunk(text, chunkSize)) {
                sink.emit(AgentEvent.token(chunk, messageType, toolCall.getId()));
            }
        }

        appendToTranscript(context, toolCall, text, category);
    }
}
