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
 * Partial output of a streaming model call: either a text fragment or a tool
 * call fragment carrying a (possibly partial) tool name.
 */
public record LlmDelta(Kind kind, String text, String toolName) {

    public enum Kind {
        TEXT, TOOL_CALL
    }

    public static LlmDelta text(String text) {
        return new LlmDelta(Kind.TEXT, text, null);
    }

    public static LlmDelta toolCall(String toolName) {
        return new LlmDelta(Kind.TOOL_CALL, null, toolName);
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }
}
