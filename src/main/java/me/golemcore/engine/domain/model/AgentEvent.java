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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of observable progress on the agent stream.
 *
 * <p>
 * Step index and step budget are stamped by the step loop, so producers create
 * events with zeros and never need to know where in the run they are.
 *
 * @param type
 *            event kind
 * @param content
 *            text payload, may be null (e.g. structured tool output)
 * @param messageType
 *            tool name or display type tag
 * @param messageId
 *            correlating tool call id
 * @param step
 *            current step index (1-based)
 * @param totalSteps
 *            step budget of the run
 * @param metadata
 *            extra fields, never null
 */
@Builder(toBuilder = true)
public record AgentEvent(AgentEventType type, String content, String messageType, String messageId,
        int step, int totalSteps, Map<String, Object> metadata) {

    public static final String META_SHOULD_ACT = "should_act";
    public static final String META_TOOL_NAMES = "tool_names";
    public static final String META_STRUCTURED_DATA = "structured_data";
    public static final String META_RESULT_TYPE = "result_type";
    public static final String META_STATUS = "status";
    public static final String META_STATE = "state";

    public static final String STATUS_STARTED = "started";
    public static final String STATUS_COMPLETED = "completed";

    public AgentEvent {
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static AgentEvent token(String content, String messageType, String messageId) {
        return AgentEvent.builder()
                .type(AgentEventType.TOKEN)
                .content(content)
                .messageType(messageType)
                .messageId(messageId)
                .build();
    }

    public static AgentEvent toolStatus(String content, String messageType, String messageId,
            Map<String, Object> metadata) {
        return AgentEvent.builder()
                .type(AgentEventType.TOOL_STATUS)
                .content(content)
                .messageType(messageType)
                .messageId(messageId)
                .metadata(metadata)
                .build();
    }

    public static AgentEvent toolOutput(String content, String messageType, String messageId,
            Map<String, Object> metadata) {
        return AgentEvent.builder()
                .type(AgentEventType.TOOL_OUTPUT)
                .content(content)
                .messageType(messageType)
                .messageId(messageId)
                .metadata(metadata)
                .build();
    }

    public static AgentEvent error(String content, String messageType, String messageId) {
        return AgentEvent.builder()
                .type(AgentEventType.ERROR)
                .content(content)
                .messageType(messageType)
                .messageId(messageId)
                .build();
    }

    public AgentEvent withStep(int step, int totalSteps) {
        return toBuilder().step(step).totalSteps(totalSteps).build();
    }

    public boolean shouldAct() {
        return Boolean.TRUE.equals(metadata.get(META_SHOULD_ACT));
    }
}
