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
import me.golemcore.agent.domain.model.ToolDefinition;
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
 * Reports the current date and time, optionally in a given timezone.
 *
 * <p>
 * Timezone examples: {@code "America/New_York"}, {@code "Europe/London"},
 * {@code "UTC"}. Without one, the zone of the injected {@link Clock} is used.
 */
@Component
public class DateTimeTool implements ToolComponent {

    static final String NAME = "datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time. Optionally specify a timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "IANA timezone such as 'America/New_York' or 'UTC'. Defaults to the server zone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object timezone = parameters.get("timezone");
        ZoneId zoneId;
        if (timezone != null && !timezone.toString().isBlank()) {
            try {
                zoneId = ZoneId.of(timezone.toString().trim());
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
                "dayOfWeek", now.getDayOfWeek().name());
        return CompletableFuture.completedFuture(ToolResult.success(formatted, data));
    }
}
