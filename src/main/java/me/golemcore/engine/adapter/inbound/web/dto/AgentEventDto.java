package me.golemcore.engine.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.engine.domain.model.AgentEvent;

import java.util.Map;

/**
 * Wire form of an {@link AgentEvent}, one per SSE frame.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentEventDto {

    private String type;
    private String content;

    @JsonProperty("message_type")
    private String messageType;

    @JsonProperty("message_id")
    private String messageId;

    private int step;

    @JsonProperty("total_steps")
    private int totalSteps;

    private Map<String, Object> metadata;

    public static AgentEventDto from(AgentEvent event) {
        return AgentEventDto.builder()
                .type(event.type().getValue())
                .content(event.content())
                .messageType(event.messageType())
                .messageId(event.messageId())
                .step(event.step())
                .totalSteps(event.totalSteps())
                .metadata(event.metadata().isEmpty() ? null : event.metadata())
                .build();
    }
}
