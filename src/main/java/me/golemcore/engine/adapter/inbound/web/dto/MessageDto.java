package me.golemcore.engine.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.engine.domain.model.Message;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {
    private String id;
    private String role;
    private String content;
    private String category;
    private String speaker;
    private String toolCallId;
    private String toolName;
    private List<ToolCallDto> toolCalls;
    private String timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCallDto {
        private String id;
        private String name;
        private String arguments;
    }

    public static MessageDto from(Message message) {
        return MessageDto.builder()
                .id(message.getId())
                .role(message.getRole() != null ? message.getRole().getValue() : null)
                .content(message.getContent())
                .category(message.getCategory() != null ? message.getCategory().getIndicator() : null)
                .speaker(message.getSpeaker())
                .toolCallId(message.getToolCallId())
                .toolName(message.getToolName())
                .toolCalls(message.hasToolCalls()
                        ? message.getToolCalls().stream()
                                .map(call -> new ToolCallDto(call.getId(), call.getName(), call.getArguments()))
                                .toList()
                        : null)
                .timestamp(message.getTimestamp() != null ? message.getTimestamp().toString() : null)
                .build();
    }
}
