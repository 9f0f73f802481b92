package me.golemcore.engine.adapter.inbound.web.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.engine.domain.model.AgentEvent;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentEventDtoTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldSerializeWithSnakeCaseKeys() throws Exception {
        AgentEvent event = AgentEvent.toolStatus("Tool echo completed", "echo", "tc-1",
                Map.of(AgentEvent.META_STATUS, AgentEvent.STATUS_COMPLETED)).withStep(2, 5);

        JsonNode json = objectMapper.valueToTree(AgentEventDto.from(event));

        assertEquals("tool_status", json.get("type").asText());
        assertEquals("echo", json.get("message_type").asText());
        assertEquals("tc-1", json.get("message_id").asText());
        assertEquals(2, json.get("step").asInt());
        assertEquals(5, json.get("total_steps").asInt());
        assertEquals("completed", json.get("metadata").get("status").asText());
    }

    @Test
    void shouldOmitNullFieldsAndEmptyMetadata() {
        JsonNode json = objectMapper.valueToTree(AgentEventDto.from(AgentEvent.token("hi", null, null)));

        assertTrue(json.has("content"));
        assertFalse(json.has("message_type"));
        assertFalse(json.has("metadata"));
    }
}
