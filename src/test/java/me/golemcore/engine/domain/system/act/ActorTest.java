package me.golemcore.engine.domain.system.act;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.adapter.outbound.memory.InMemoryTranscriptAdapter;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentEvent;
import me.golemcore.engine.domain.model.AgentEventType;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.model.AgentState;
import me.golemcore.engine.domain.model.DisplayType;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.ToolChoice;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.domain.system.DefaultHistoryWriter;
import me.golemcore.engine.domain.system.HistoryWriter;
import me.golemcore.engine.infrastructure.config.EngineProperties;
import me.golemcore.engine.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActorTest {

    private static final String SESSION_ID = "session-1";

    private InMemoryTranscriptAdapter transcript;
    private ToolRegistry registry;
    private HistoryWriter historyWriter;
    private ToolCallExecutor executor;
    private PacingStreamer pacingStreamer;
    private Actor actor;
    private AgentContext context;
    private List<AgentEvent> events;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        transcript = new InMemoryTranscriptAdapter();
        registry = new ToolRegistry(new ArrayList<>());
        historyWriter = new DefaultHistoryWriter(transcript, clock);
        executor = new ToolCallExecutor(registry, new ObjectMapper(), Duration.ofSeconds(5));
        pacingStreamer = new PacingStreamer(new EngineProperties.StreamingProperties(), millis -> {
        }, new Random(42));
        actor = new Actor(executor, new StreamingResultPresenter(registry, historyWriter, pacingStreamer, 4));
        context = AgentContext.builder()
                .sessionId(SESSION_ID)
                .profile(AgentProfile.builder().name("lina").build())
                .state(AgentState.RUNNING)
                .build();
        events = new ArrayList<>();
    }

    private static Message.ToolCall call(String id, String name) {
        return Message.ToolCall.builder().id(id).name(name).arguments("{}").build();
    }

    private List<Message> toolMessages() {
        return transcript.getMessages(SESSION_ID).stream().filter(Message::isToolMessage).toList();
    }

    private List<AgentEvent> eventsOf(AgentEventType type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }

    @Test
    void shouldFinishAgentWhenSpecialToolCompletes() {
        registry.register(StubTool.returning("terminate", "The interaction has been completed"));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("tc-1", "terminate"))));

        actor.act(context, events::add);

        assertEquals(AgentState.FINISHED, context.getState());
        List<AgentEvent> completed = eventsOf(AgentEventType.TOOL_STATUS).stream()
                .filter(event -> AgentEvent.STATUS_COMPLETED.equals(event.metadata().get(AgentEvent.META_STATUS)))
                .toList();
        assertEquals(1, completed.size());
        assertEquals("Tool terminate completed", completed.get(0).content());
        assertEquals(1, toolMessages().size());
    }

    @Test
    void shouldRecordUnknownToolAsErrorResult() {
        context.setPendingToolCalls(new ArrayList<>(List.of(call("tc-1", "foo"))));

        List<ToolResult> results = actor.act(context, events::add);

        assertEquals("Error: Unknown tool 'foo'", results.get(0).displayText());
        List<Message> messages = toolMessages();
        assertEquals(1, messages.size());
        assertEquals("Error: Unknown tool 'foo'", messages.get(0).getContent());
        assertEquals("tc-1", messages.get(0).getToolCallId());
        assertEquals(AgentState.RUNNING, context.getState());
    }

    @Test
    void shouldExecuteCallsInOrderAndAppendOneResultPerCall() {
        registry.register(StubTool.returning("first", "1"));
        registry.register(StubTool.returning("second", "2"));
        registry.register(StubTool.returning("third", "3"));
        context.setPendingToolCalls(new ArrayList<>(List.of(
                call("a", "first"), call("b", "second"), call("c", "third"))));

        List<ToolResult> results = actor.act(context, events::add);

        assertEquals(List.of("1", "2", "3"), results.stream().map(ToolResult::displayText).toList());
        assertEquals(List.of("a", "b", "c"), toolMessages().stream().map(Message::getToolCallId).toList());
        assertTrue(context.getPendingToolCalls().isEmpty());
        assertEquals(3, context.getToolResults().size());
        assertEquals("Executing tool: second (2/3)", eventsOf(AgentEventType.TOOL_STATUS).get(2).content());
    }

    @Test
    void shouldCommitEachResultBeforeStartingNextCall() {
        List<Integer> transcriptSizes = new ArrayList<>();
        registry.register(new StubTool("probe", MessageCategory.TOOL, DisplayType.TOOL, args -> {
            transcriptSizes.add(toolMessages().size());
            return CompletableFuture.completedFuture(ToolResult.success("ok"));
        }));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "probe"), call("b", "probe"))));

        actor.act(context, events::add);

        assertEquals(List.of(0, 1), transcriptSizes);
    }

    @Test
    void shouldKeepGoingAfterFailingTool() {
        registry.register(StubTool.failing("broken", new IllegalStateException("boom")));
        registry.register(StubTool.returning("fine", "ok"));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "broken"), call("b", "fine"))));

        List<ToolResult> results = actor.act(context, events::add);

        assertEquals(2, results.size());
        assertEquals("Error: Tool 'broken' encountered a problem: boom", results.get(0).displayText());
        assertEquals("ok", results.get(1).displayText());
        assertEquals(2, toolMessages().size());
    }

    @Test
    void shouldThrowWhenToolCallsRequiredButNoneProvided() {
        context.setProfile(context.getProfile().toBuilder().toolChoice(ToolChoice.REQUIRED).build());

        assertThrows(ToolCallRequiredException.class, () -> actor.act(context, events::add));

        assertEquals(1, events.size());
        assertEquals(AgentEventType.ERROR, events.get(0).type());
        assertEquals("Tool calls required but none provided", events.get(0).content());
        assertEquals(AgentState.RUNNING, context.getState());
    }

    @Test
    void shouldDoNothingWithoutPendingCallsUnderAuto() {
        List<ToolResult> results = actor.act(context, events::add);

        assertTrue(results.isEmpty());
        assertTrue(events.isEmpty());
        assertTrue(transcript.getMessages(SESSION_ID).isEmpty());
    }

    @Test
    void shouldTreatMissingPendingListAsNothingToRun() {
        context.setPendingToolCalls(null);

        List<ToolResult> results = actor.act(context, events::add);

        assertTrue(results.isEmpty());
        assertTrue(events.isEmpty());
        assertFalse(context.hasPendingToolCalls());
    }

    @Test
    void shouldClearPendingCallsOnceActed() {
        registry.register(StubTool.returning("first", "1"));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "first"))));
        assertTrue(context.hasPendingToolCalls());

        actor.act(context, events::add);

        assertFalse(context.hasPendingToolCalls());
    }

    @Test
    void shouldChunkRegularToolOutputIntoTokenEvents() {
        registry.register(StubTool.returning("long", "abcdefghij"));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "long"))));

        actor.act(context, events::add);

        List<AgentEvent> tokens = eventsOf(AgentEventType.TOKEN);
        assertEquals(List.of("abcd", "efgh", "ij"), tokens.stream().map(AgentEvent::content).toList());
        assertTrue(tokens.stream().allMatch(token -> "long".equals(token.messageType())));
        assertEquals("abcdefghij", toolMessages().get(0).getContent());
    }

    @Test
    void shouldEmitStructuredDataBeforeText() {
        registry.register(StubTool.returning("strategy", ToolResult.success("plan", Map.of("decision", "telegram"))));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "strategy"))));

        actor.act(context, events::add);

        AgentEvent output = eventsOf(AgentEventType.TOOL_OUTPUT).get(0);
        assertNull(output.content());
        assertEquals(Map.of("decision", "telegram"), output.metadata().get(AgentEvent.META_STRUCTURED_DATA));
        assertEquals("tool_result", output.metadata().get(AgentEvent.META_RESULT_TYPE));
        assertTrue(events.indexOf(output) < events.indexOf(eventsOf(AgentEventType.TOKEN).get(0)));
    }

    @Test
    void shouldPaceTelegramOutputAndStoreFullText() {
        registry.register(new StubTool("send_telegram_message", MessageCategory.TELEGRAM, DisplayType.TOOL,
                args -> CompletableFuture.completedFuture(ToolResult.success("hey\nhow are you"))));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "send_telegram_message"))));

        actor.act(context, events::add);

        assertEquals(List.of("hey\n", "how are you"),
                eventsOf(AgentEventType.TOKEN).stream().map(AgentEvent::content).toList());
        Message stored = toolMessages().get(0);
        assertEquals("hey\nhow are you", stored.getContent());
        assertEquals(MessageCategory.TELEGRAM, stored.getCategory());
        assertEquals("lina", stored.getSpeaker());
    }

    @Test
    void shouldTagInnerThoughtsWithDisplayType() {
        registry.register(new StubTool("reflection", MessageCategory.THOUGHT, DisplayType.INNER_THOUGHT,
                args -> CompletableFuture.completedFuture(ToolResult.success("thinking"))));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "reflection"))));

        actor.act(context, events::add);

        assertEquals("inner_thought", eventsOf(AgentEventType.TOKEN).get(0).messageType());
        assertEquals(MessageCategory.THOUGHT, toolMessages().get(0).getCategory());
    }

    @Test
    void shouldEmitNothingWithSilentPresenter() {
        Actor silent = new Actor(executor, new SilentResultPresenter(registry, historyWriter));
        registry.register(StubTool.returning("echo", "quiet"));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "echo"))));

        List<ToolResult> results = silent.act(context, events::add);

        assertEquals("quiet", results.get(0).displayText());
        assertTrue(events.isEmpty());
        assertEquals(1, toolMessages().size());
        assertEquals(1, context.getToolResults().size());
    }

    @Test
    void shouldJoinDisplayTextsInNonStreamingForm() {
        registry.register(StubTool.returning("one", "first"));
        context.setPendingToolCalls(new ArrayList<>(List.of(call("a", "one"), call("b", "missing"))));

        String text = actor.act(context);

        assertEquals("first\n\nError: Unknown tool 'missing'", text);
    }
}
