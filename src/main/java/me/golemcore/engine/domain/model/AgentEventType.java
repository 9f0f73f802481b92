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

/**
 * Kinds of events on the agent stream. STEP and FINAL are only produced by the
 * outer driver.
 */
public enum AgentEventType {

    TOKEN("token"),
    TOOL_STATUS("tool_status"),
    TOOL_OUTPUT("tool_output"),
    ERROR("error"),
    STEP("step"),
    FINAL("final");

    private final String value;

    AgentEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
