package me.golemcore.engine.adapter.outbound.llm;

import me.golemcore.engine.domain.model.LlmDelta;
import me.golemcore.engine.domain.model.LlmRequest;
import me.golemcore.engine.domain.model.LlmResponse;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldReplyWithPlaceholder() {
        LlmResponse response = adapter.chat(LlmRequest.builder().build()).join();

        assertEquals(NoOpLlmAdapter.PLACEHOLDER, response.getContent());
        assertFalse(response.hasToolCalls());
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
    }

    @Test
    void shouldReplayPlaceholderAsSingleDelta() {
        List<LlmDelta> deltas = new ArrayList<>();

        adapter.chatStream(LlmRequest.builder().build(), deltas::add).join();

        assertEquals(List.of(LlmDelta.text(NoOpLlmAdapter.PLACEHOLDER)), deltas);
    }
}
