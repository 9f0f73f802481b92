package me.golemcore.engine.domain.service;

import me.golemcore.engine.domain.model.AgentContext;
import me.golemcore.engine.domain.model.AgentProfile;
import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class VisibilityMessageFormatterTest {

    private final VisibilityMessageFormatter formatter = new VisibilityMessageFormatter();

    private static AgentContext contextFor(String speaker) {
        return AgentContext.builder().sessionId("s1").profile(AgentProfile.builder().name(speaker).build()).build();
    }

    private static Message message(String id, MessageRole role, List<String> visibleFor) {
        return Message.builder().id(id).role(role).content(id).visibleFor(visibleFor).build();
    }

    @Test
    void shouldKeepMessagesWithoutVisibilityScope() {
        List<Message> transcript = List.of(message("a", MessageRole.USER, null),
                message("b", MessageRole.ASSISTANT, List.of()));

        assertEquals(transcript, formatter.format(transcript, contextFor("lina")));
    }

    @Test
    void shouldDropMessagesScopedToOtherSpeakers() {
        List<Message> transcript = List.of(message("a", MessageRole.USER, List.of("lina")),
                message("b", MessageRole.USER, List.of("bob")));

        List<Message> visible = formatter.format(transcript, contextFor("lina"));

        assertEquals(List.of("a"), visible.stream().map(Message::getId).toList());
    }

    @Test
    void shouldDropResultsOfHiddenToolCalls() {
        Message.ToolCall call = Message.ToolCall.builder().id("tc-1").name("echo").arguments("{}").build();
        Message hiddenCall = Message.builder().id("call").role(MessageRole.ASSISTANT).toolCalls(List.of(call))
                .visibleFor(List.of("bob")).build();
        Message result = Message.builder().id("result").role(MessageRole.TOOL).toolCallId("tc-1").content("ok")
                .build();

        List<Message> visible = formatter.format(List.of(hiddenCall, result), contextFor("lina"));

        assertEquals(List.of(), visible);
    }

    @Test
    void shouldNotMutateInput() {
        List<Message> transcript = new ArrayList<>(List.of(message("a", MessageRole.USER, List.of("bob"))));

        formatter.format(transcript, contextFor("lina"));

        assertEquals(1, transcript.size());
    }
}
