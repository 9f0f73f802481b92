package me.golemcore.engine.domain.loop;

import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentEvent;
import me.golemcore.engine.domain.model.AgentEventType;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.model.AgentState;
import me.golemcore.engine.domain.model.ToolResult;
import me.golemcore.engine.domain.system.EventSink;
import me.golemcore.engine.domain.system.act.Actor;
import me.golemcore.engine.domain.system.act.ToolCallRequiredException;
import me.golemcore.engine.domain.system.think.ThinkOutcome;
import me.golemcore.engine.domain.system.think.Thinker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StepLoopTest {

    private Thinker thinker;
    private Actor actor;
    private StepLoop stepLoop;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        thinker = mock(Thinker.class);
        actor = mock(Actor.class);
        stepLoop = new StepLoop(thinker, actor);
        context = AgentContext.builder()
                .sessionId("session-1")
                .profile(AgentProfile.builder().name("lina").maxSteps(5).build())
                .state(AgentState.RUNNING)
                .currentStep(2)
                .build();
    }

    @Test
    void shouldStampEveryEventWithStepAndBudget() {
        when(thinker.thinkStream(any(AgentContext.class), any(EventSink.class))).thenAnswer(invocation -> {
            EventSink sink = invocation.getArgument(1);
            sink.emit(AgentEvent.token("hi", null, null));
            return ThinkOutcome.act();
        });
        when(actor.act(any(AgentContext.class), any(EventSink.class))).thenAnswer(invocation -> {
            EventSink sink = invocation.getArgument(1);
            sink.emit(AgentEvent.token("tool output", "echo", "tc-1"));
            return List.of(ToolResult.success("tool output"));
        });
        List<AgentEvent> events = new ArrayList<>();

        StepResult result = stepLoop.runStep(context, events::add);

        assertTrue(result.acted());
        assertEquals(3, events.size());
        assertEquals("Thinking...", events.get(0).content());
        assertEquals(AgentEventType.TOOL_STATUS, events.get(0).type());
        assertTrue(events.stream().allMatch(event -> event.step() == 2 && event.totalSteps() == 5));
        assertEquals("tool output", result.summary());
    }

    @Test
    void shouldSkipActWhenThinkerDeclines() {
        when(thinker.thinkStream(any(AgentContext.class), any(EventSink.class))).thenReturn(ThinkOutcome.reply());

        StepResult result = stepLoop.runStep(context, EventSink.NONE);

        assertFalse(result.acted());
        assertTrue(result.replied());
        assertTrue(result.toolResults().isEmpty());
        assertEquals("Thinking complete - no action needed", result.summary());
        verify(actor, never()).act(any(AgentContext.class), any(EventSink.class));
    }

    @Test
    void shouldRunNonStreamingStepWithoutEvents() {
        when(thinker.thinkBlocking(context)).thenReturn(ThinkOutcome.act());
        when(actor.act(context, EventSink.NONE)).thenReturn(List.of(ToolResult.success("a"),
                ToolResult.success("b")));

        StepResult result = stepLoop.runStep(context);

        assertEquals("a\n\nb", result.summary());
    }

    @Test
    void shouldSummarizeFailedThinking() {
        when(thinker.thinkBlocking(context)).thenReturn(ThinkOutcome.failure());

        StepResult result = stepLoop.runStep(context);

        assertEquals("Thinking failed", result.summary());
        verify(actor, never()).act(any(AgentContext.class), any(EventSink.class));
    }

    @Test
    void shouldTerminateStreamWithProtocolViolation() {
        when(thinker.thinkStream(any(AgentContext.class), any(EventSink.class))).thenReturn(ThinkOutcome.act());
        when(actor.act(any(AgentContext.class), any(EventSink.class)))
                .thenThrow(new ToolCallRequiredException("Tool calls required but none provided"));

        StepVerifier.create(stepLoop.streamStep(context))
                .expectNextMatches(event -> "Thinking...".equals(event.content()))
                .expectError(ToolCallRequiredException.class)
                .verify();
    }
}
