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

package me.golemcore.engine.tools;

import me.golemcore.engine.domain.component.ToolComponent;
import me.golemcore.engine.domain.model.ToolDefinition;
import me.golemcore.engine.domain.model.ToolFailureKind;
import me.golemcore.engine.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting the current date and time.
 *
 * <p>
 * Returns {@code yyyy-MM-dd HH:mm:ss} in the requested timezone (or the clock's
 * zone) plus structured fields (timezone, epoch millis, day of week).
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 */
@Component
public class DateTimeTool implements ToolComponent {

    public static final String NAME = "get_current_time";
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.of(NAME,
                "Get the current date and time in a readable format (YYYY-MM-DD HH:MM:SS). "
                        + "Optionally specify a timezone.",
                Map.of("timezone", ToolDefinition.stringParam(
                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is server time.")),
                List.of());
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone instanceof String value && !value.isBlank()) {
            try {
                zoneId = ZoneId.of(value);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Invalid timezone: " + value));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String formatted = now.format(FORMATTER);
        Map<String, Object> data = Map.of(
                "datetime", formatted,
                "timezone", zoneId.getId(),
                "timestamp", now.toInstant().toEpochMilli(),
                "dayOfWeek", now.getDayOfWeek().name());
        return CompletableFuture.completedFuture(ToolResult.success(formatted, data));
    }
}
