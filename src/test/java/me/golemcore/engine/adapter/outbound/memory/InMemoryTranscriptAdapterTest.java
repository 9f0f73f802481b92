package me.golemcore.engine.adapter.outbound.memory;

import me.golemcore.engine.domain.model.Message;
import me.golemcore.engine.domain.model.MessageCategory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTranscriptAdapterTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private final InMemoryTranscriptAdapter adapter = new InMemoryTranscriptAdapter();

    @Test
    void shouldKeepAppendOrderPerSession() {
        adapter.append("s1", Message.user("one", MessageCategory.NORMAL, NOW));
        adapter.append("s2", Message.user("other", MessageCategory.NORMAL, NOW));
        adapter.append("s1", Message.user("two", MessageCategory.NORMAL, NOW));

        assertEquals(List.of("one", "two"), adapter.getMessages("s1").stream().map(Message::getContent).toList());
        assertEquals(List.of("s1", "s2"), adapter.listSessions());
    }

    @Test
    void shouldReturnSnapshotUnaffectedByLaterAppends() {
        adapter.append("s1", Message.user("one", null, NOW));
        List<Message> snapshot = adapter.getMessages("s1");

        adapter.append("s1", Message.user("two", null, NOW));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Message.user("x", null, NOW)));
    }

    @Test
    void shouldReturnEmptyListForUnknownSession() {
        assertTrue(adapter.getMessages("missing").isEmpty());
        assertTrue(adapter.getMessages(null).isEmpty());
    }

    @Test
    void shouldRejectNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> adapter.append(null, Message.user("x", null, NOW)));
        assertThrows(IllegalArgumentException.class, () -> adapter.append("s1", null));
    }
}
