package me.golemcore.engine.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStatusDto {
    private String sessionId;
    private String state;
    private String lastRunState;
    private int currentStep;
    private int messageCount;
}
