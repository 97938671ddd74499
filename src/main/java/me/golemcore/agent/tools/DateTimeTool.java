package me.golemcore.agent.tools;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.ToolExecutionContext;
import me.golemcore.agent.domain.model.ToolResult;
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
 * Tool for getting current date and time.
 *
 * <p>
 * Returns current date/time in a specified timezone (or the clock's zone).
 * Output includes formatted string and structured data (year, month, day,
 * hour, minute, etc.).
 *
 * <p>
 * Timezone parameter examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}
 */
@Component
public class DateTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .name("datetime")
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is system timezone.")),
                        "required", List.of(),
                        "additionalProperties", false))
                .outputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "datetime", Map.of("type", "string"),
                                "timezone", Map.of("type", "string", "minLength", 1),
                                "timestamp", Map.of("type", "integer"),
                                "dayOfWeek", Map.of("type", "string", "enum", List.of(
                                        "MONDAY", "TUESDAY", "WEDNESDAY", "THURSDAY", "FRIDAY", "SATURDAY", "SUNDAY")),
                                "year", Map.of("type", "integer"),
                                "month", Map.of("type", "string"),
                                "day", Map.of("type", "integer", "minimum", 1, "maximum", 31),
                                "hour", Map.of("type", "integer", "minimum", 0, "maximum", 23),
                                "minute", Map.of("type", "integer", "minimum", 0, "maximum", 59)),
                        "required", List.of("datetime", "timezone", "timestamp")))
                .idempotent(true)
                .concurrencySafe(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolExecutionContext context, Map<String, Object> parameters) {
        String timezone = (String) parameters.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.isBlank()) {
            try {
                zoneId = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + timezone));
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
                "dayOfWeek", now.getDayOfWeek().name(),
                "year", now.getYear(),
                "month", now.getMonth().name(),
                "day", now.getDayOfMonth(),
                "hour", now.getHour(),
                "minute", now.getMinute());

        return CompletableFuture.completedFuture(ToolResult.structured(formatted, data));
    }
}
