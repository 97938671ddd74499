package me.golemcore.agent.domain.model;

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
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Describes a tool the reasoning engine can call: name, description, JSON
 * Schema for input and output, and the invocation contract used by the
 * dispatcher.
 *
 * <p>
 * {@code idempotent} and {@code concurrencySafe} decide how calls are
 * scheduled within one turn: concurrency-safe calls may run in parallel,
 * repeated calls to a non-idempotent tool always run in request order.
 * {@code timeout} and {@code maxAttempts} override the configured defaults when
 * set.
 */
@Value
@Builder(toBuilder = true)
public class ToolDescriptor {

    String name;
    String description;

    @Builder.Default
    Map<String, Object> inputSchema = emptyObjectSchema();

    @Builder.Default
    Map<String, Object> outputSchema = Map.of();

    @Builder.Default
    boolean idempotent = false;

    @Builder.Default
    boolean concurrencySafe = false;

    Duration timeout;
    Integer maxAttempts;

    /**
     * Creates a simple descriptor without input parameters.
     */
    public static ToolDescriptor simple(String name, String description) {
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .build();
    }

    private static Map<String, Object> emptyObjectSchema() {
        return Map.of("type", "object", "properties", Map.of(), "required", List.of());
    }
}
