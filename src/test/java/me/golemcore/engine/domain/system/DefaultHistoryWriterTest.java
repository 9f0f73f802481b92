package me.golemcore.engine.domain.system;

import me.golemcore.engine.adapter.outbound.memory.InMemoryTranscriptAdapter;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.MessageRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DefaultHistoryWriterTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private InMemoryTranscriptAdapter transcript;
    private DefaultHistoryWriter writer;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        transcript = new InMemoryTranscriptAdapter();
        writer = new DefaultHistoryWriter(transcript, Clock.fixed(NOW, ZoneId.of("UTC")));
        context = AgentContext.builder()
                .sessionId("s1")
                .profile(AgentProfile.builder().name("lina").visibleFor(List.of("lina", "bob")).build())
                .build();
    }

    @Test
    void shouldStampAssistantMessageFromContext() {
        Message.ToolCall call = Message.ToolCall.builder().id("tc-1").name("echo").arguments("{}").build();

        Message assistant = writer.appendAssistant(context, "Calling echo", List.of(call));

        assertEquals(MessageRole.ASSISTANT, assistant.getRole());
        assertEquals("lina", assistant.getSpeaker());
        assertEquals(List.of("lina", "bob"), assistant.getVisibleFor());
        assertEquals(NOW, assistant.getTimestamp());
        assertEquals(List.of(call), assistant.getToolCalls());
        assertEquals(List.of(assistant), transcript.getMessages("s1"));
    }

    @Test
    void shouldStoreNoToolCallsForPlainReply() {
        assertNull(writer.appendAssistant(context, "Hi", List.of()).getToolCalls());
    }

    @Test
    void shouldLinkToolResultToItsCall() {
        Message.ToolCall call = Message.ToolCall.builder().id("tc-1").name("echo").arguments("{}").build();

        Message result = writer.appendToolResult(context, call, "ok", null);

        assertEquals(MessageRole.TOOL, result.getRole());
        assertEquals("tc-1", result.getToolCallId());
        assertEquals("echo", result.getToolName());
        assertEquals(MessageCategory.TOOL, result.getCategory());
    }

    @Test
    void shouldRecordUserWithoutSpeaker() {
        Message user = writer.appendUser(context, "hello", MessageCategory.TELEGRAM);

        assertNull(user.getSpeaker());
        assertEquals(MessageCategory.TELEGRAM, user.getCategory());
    }
}
