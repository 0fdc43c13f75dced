package me.golemcore.converse.tools;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.converse.domain.component.ToolComponent;
import me.golemcore.converse.domain.model.ToolDefinition;
import me.golemcore.converse.domain.model.ToolResult;
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
 * Returns the current date/time in the requested time zone, or in the zone of
 * the injected {@link Clock}. Time zone examples: {@code "America/New_York"},
 * {@code "Europe/London"}, {@code "UTC"}.
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    public static final String NAME = "datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time. Optionally specify a timezone.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "Timezone (e.g., 'America/New_York', 'Europe/London', 'UTC'). Default is the server timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object timezone = parameters.get("timezone");
            ZoneId zoneId;
            if (timezone instanceof String zone && !zone.isBlank()) {
                try {
                    zoneId = ZoneId.of(zone);
                } catch (DateTimeException e) {
                    return ToolResult.failure("Invalid timezone: " + zone);
                }
            } else {
                zoneId = clock.getZone();
            }

            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
            return ToolResult.success(now.format(FORMATTER) + " (" + now.getDayOfWeek() + ")");
        });
    }
}
