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
 * Semantic classification of a transcript message. Each category carries a
 * numeric code and a short indicator string used by message formatters.
 *
 * <p>
 * Independent from {@link DisplayType}, which only hints how an event should be
 * rendered.
 */
public enum MessageCategory {

    NORMAL(0, "normal"),
    TELEGRAM(1, "telegram"),
    SPEAK_IN_PERSON(2, "speakinperson"),
    THOUGHT(3, "thought"),
    TOOL(4, "tool"),
    SYSTEM_INSTRUCTION(5, "system_instruction");

    private final int code;
    private final String indicator;

    MessageCategory(int code, String indicator) {
        this.code = code;
        this.indicator = indicator;
    }

    public int getCode() {
        return code;
    }

    public String getIndicator() {
        return indicator;
    }

    /**
     * Whether messages of this category are delivered to a person over a
     * communication channel rather than kept internal.
     */
    public boolean isCommunication() {
        return this == TELEGRAM || this == SPEAK_IN_PERSON;
    }

    public static MessageCategory fromIndicator(String indicator) {
        if (indicator == null) {
            return NORMAL;
        }
        String normalized = indicator.trim().toLowerCase(Locale.ROOT);
        for (MessageCategory category : values()) {
            if (category.indicator.equals(normalized)) {
                return category;
            }
        }
        return NORMAL;
    }
}
