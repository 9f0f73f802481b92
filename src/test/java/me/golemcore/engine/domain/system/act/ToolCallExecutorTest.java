package me.golemcore.engine.domain.system.act;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.model.AgentState;
import me.golemcore.engine.domain.model.DisplayType;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.service.ToolRegistry;
import me.golemcore.engine.testsupport.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallExecutorTest {

    private static final String TOOL_NAME = "echo";

    private StubTool echo;
    private ToolRegistry registry;
    private ToolCallExecutor executor;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        echo = StubTool.returning(TOOL_NAME, "echoed");
        registry = new ToolRegistry(List.of(echo));
        executor = new ToolCallExecutor(registry, new ObjectMapper(), Duration.ofSeconds(5));
        context = AgentContext.builder()
                .sessionId("s-1")
                .profile(AgentProfile.builder().name("agent").build())
                .state(AgentState.RUNNING)
                .build();
    }

    private static Message.ToolCall call(String name, String arguments) {
        return Message.ToolCall.builder().id("tc-1").name(name).arguments(arguments).build();
    }

    @Test
    void shouldExecuteToolWithDecodedArguments() {
        ToolResult result = executor.execute(context, call(TOOL_NAME, "{\"input\":\"hi\",\"n\":2}"));

        assertTrue(result.isSuccess());
        assertEquals("echoed", result.getOutput());
        assertEquals(List.of(Map.of("input", "hi", "n", 2)), echo.getInvocations());
        assertNull(context.getInFlightCall());
    }

    @Test
    void shouldTreatBlankArgumentsAsEmptyObject() {
        executor.execute(context, call(TOOL_NAME, "  "));

        assertEquals(List.of(Map.of()), echo.getInvocations());
    }

    @Test
    void shouldRejectCallWithoutName() {
        ToolResult result = executor.execute(context, call(" ", "{}"));

        assertEquals(ToolFailureKind.INVALID_REQUEST, result.getFailureKind());
        assertEquals("Error: Invalid command format", result.displayText());
    }

    @Test
    void shouldRejectNullCall() {
        ToolResult result = executor.execute(context, null);

        assertEquals(ToolFailureKind.INVALID_REQUEST, result.getFailureKind());
    }

    @Test
    void shouldReportUnknownToolWithoutTouchingTheState() {
        ToolResult result = executor.execute(context, call("nope", "{}"));

        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.getFailureKind());
        assertEquals("Error: Unknown tool 'nope'", result.displayText());
        assertEquals(AgentState.RUNNING, context.getState());
    }

    @Test
    void shouldReportMalformedArgumentsTheSameWayEveryTime() {
        ToolResult first = executor.execute(context, call(TOOL_NAME, "{not json"));
        ToolResult second = executor.execute(context, call(TOOL_NAME, "{not json"));

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, first.getFailureKind());
        assertEquals("Error: Error parsing arguments for echo: Invalid JSON format", first.displayText());
        assertEquals(first.displayText(), second.displayText());
        assertTrue(echo.getInvocations().isEmpty());
    }

    @Test
    void shouldRejectArgumentsWithTrailingContent() {
        ToolResult result = executor.execute(context, call("echo", "{\"input\":\"x\"}} garbage"));

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertEquals("Error: Error parsing arguments for echo: Invalid JSON format", result.displayText());
        assertTrue(echo.getInvocations().isEmpty());
    }

    @Test
    void shouldRejectNonObjectArguments() {
        ToolResult result = executor.execute(context, call(TOOL_NAME, "[1,2,3]"));

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        assertTrue(echo.getInvocations().isEmpty());
    }

    @Test
    void shouldConvertToolExceptionIntoErrorResult() {
        registry.register(StubTool.failing("broken", new IllegalStateException("db down")));

        ToolResult result = executor.execute(context, call("broken", "{}"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Error: Tool 'broken' encountered a problem: db down", result.displayText());
        assertEquals(AgentState.RUNNING, context.getState());
    }

    @Test
    void shouldConvertSynchronousThrowIntoErrorResult() {
        registry.register(new StubTool("thrower", MessageCategory.TOOL, DisplayType.TOOL, args -> {
            throw new IllegalArgumentException("bad input");
        }));

        ToolResult result = executor.execute(context, call("thrower", "{}"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.displayText().endsWith("bad input"));
    }

    @Test
    void shouldTimeOutSlowTool() {
        executor = new ToolCallExecutor(registry, new ObjectMapper(), Duration.ofMillis(50));
        CompletableFuture<ToolResult> pending = new CompletableFuture<>();
        registry.register(new StubTool("slow", MessageCategory.TOOL, DisplayType.TOOL, args -> pending));

        ToolResult result = executor.execute(context, call("slow", "{}"));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertEquals("Error: Tool 'slow' encountered a problem: timed out after 50ms", result.displayText());
        assertTrue(pending.isCancelled());
        assertNull(context.getInFlightCall());
    }

    @Test
    void shouldTreatNullResultAsEmptySuccess() {
        registry.register(new StubTool("silent", MessageCategory.TOOL, DisplayType.TOOL,
                args -> CompletableFuture.completedFuture(null)));

        ToolResult result = executor.execute(context, call("silent", "{}"));

        assertTrue(result.isSuccess());
        assertEquals("", result.displayText());
    }

    @Test
    void shouldFinishAgentWhenSpecialToolCompletes() {
        registry.register(StubTool.returning("Terminate", "bye"));
        context.setProfile(context.getProfile().toBuilder().specialToolNames(Set.of("terminate")).build());

        ToolResult result = executor.execute(context, call("Terminate", "{}"));

        assertTrue(result.isSuccess());
        assertEquals(AgentState.FINISHED, context.getState());
    }

    @Test
    void shouldFinishAgentEvenWhenSpecialToolReportsFailure() {
        registry.register(StubTool.returning("terminate",
                ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "status missing")));

        executor.execute(context, call("terminate", "{}"));

        assertEquals(AgentState.FINISHED, context.getState());
    }

    @Test
    void shouldNotFinishAgentWhenSpecialToolThrows() {
        registry.register(StubTool.failing("terminate", new IllegalStateException("no")));

        ToolResult result = executor.execute(context, call("terminate", "{}"));

        assertFalse(result.isSuccess());
        assertEquals(AgentState.RUNNING, context.getState());
    }
}
