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

import java.util.Locale;

/**
 * How a user reached the agent. Determines the category of the user message
 * appended to the transcript; {@link #SKIP} appends nothing.
 */
public enum InputMode {

    PHONE("phone", MessageCategory.TELEGRAM),
    IN_PERSON("in_person", MessageCategory.SPEAK_IN_PERSON),
    INNER_VOICE("inner_voice", MessageCategory.THOUGHT),
    COMMAND("command", MessageCategory.SYSTEM_INSTRUCTION),
    SKIP("skip", null);

    private final String value;
    private final MessageCategory category;

    InputMode(String value, MessageCategory category) {
        this.value = value;
        this.category = category;
    }

    public String getValue() {
        return value;
    }

    public MessageCategory getCategory() {
        return category;
    }

    /**
     * Resolves a wire value, falling back to {@link #PHONE} for null or unknown
     * input.
     */
    public static InputMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PHONE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (InputMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        return PHONE;
    }
}
