package me.golemcore.engine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamRequest {
    private String sessionId;
    private String message;
    private String inputMode; // phone, in_person, inner_voice, command, skip
}
