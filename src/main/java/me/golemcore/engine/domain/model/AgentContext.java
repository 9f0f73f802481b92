package me.golemcore.engine.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * Mutable per-agent execution state shared by the thinker, the actor and the
 * step loop: lifecycle state, step counter, the tool calls awaiting execution
 * and the results of the ones already executed.
 *
 * <p>
 * Owned by exactly one driving thread. The only field touched from other threads
 * is {@link #inFlightCall}, which the driver may cancel.
 */
@Data
@Builder
public class AgentContext {

    private String sessionId;
    private AgentProfile profile;

    @Builder.Default
    private volatile AgentState state = AgentState.IDLE;

    private int currentStep;

    /**
     * Effective next-step prompt. Starts as the profile prompt and may be
     * prefixed by stuck-detection hints.
     */
    private String nextStepPrompt;

    @Builder.Default
    private List<Message.ToolCall> pendingToolCalls = new ArrayList<>();

    @Builder.Default
    private Map<String, ToolResult> toolResults = new LinkedHashMap<>();

    private volatile Future<?> inFlightCall;

    /**
     * Adds a tool execution result to the context for correlation with tool calls.
     */
    public void addToolResult(String toolCallId, ToolResult result) {
        if (toolResults == null) {
            toolResults = new LinkedHashMap<>();
        }
        toolResults.put(toolCallId, result);
    }

    public boolean hasPendingToolCalls() {
        return pendingToolCalls != null && !pendingToolCalls.isEmpty();
    }

    public boolean isFinished() {
        return state == AgentState.FINISHED;
    }

    public void markFinished() {
        this.state = AgentState.FINISHED;
    }

    public String getSpeaker() {
        return profile != null ? profile.getName() : null;
    }

    public int getMaxSteps() {
        return profile != null ? profile.getMaxSteps() : 0;
    }

    public ToolChoice getToolChoice() {
        return profile != null ? profile.getToolChoice() : ToolChoice.AUTO;
    }

    /**
     * Cancels the model or tool call currently in flight, if any.
     */
    public boolean cancelInFlight() {
        Future<?> call = inFlightCall;
        return call != null && call.cancel(true);
    }
}
