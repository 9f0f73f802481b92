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
 * Whether the model must, may, or must not request tools on a step.
 */
public enum ToolChoice {

    NONE("none"), AUTO("auto"), REQUIRED("required");

    private final String value;

    ToolChoice(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ToolChoice fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ToolChoice choice : values()) {
            if (choice.value.equals(normalized)) {
                return choice;
            }
        }
        throw new IllegalArgumentException("Unknown tool choice: " + value);
    }
}
