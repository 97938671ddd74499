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
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.ToolExecutionContext;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the latest memory value stored under a key for the calling session,
 * e.g. {@code "answer"} or {@code "tool:datetime"}. Read-only.
 */
@Component
public class MemoryRecallTool implements ToolComponent {

    private final MemoryStorePort memoryStore;

    public MemoryRecallTool(MemoryStorePort memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Override
    public ToolDescriptor getDescriptor() {
        return ToolDescriptor.builder()
                .name("memory_recall")
                .description("Recall the latest value remembered in this session under a key, "
                        + "such as 'input', 'answer' or 'tool:<name>'.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "key", Map.of(
                                        "type", "string",
                                        "description", "Memory key to look up")),
                        "required", List.of("key"),
                        "additionalProperties", false))
                .outputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "key", Map.of("type", "string"),
                                "found", Map.of("type", "boolean"),
                                "index", Map.of("type", "integer", "minimum", 0),
                                "turnId", Map.of("type", "string")),
                        "required", List.of("key", "found"),
                        "additionalProperties", false))
                .idempotent(true)
                .concurrencySafe(true)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ToolExecutionContext context, Map<String, Object> parameters) {
        String key = (String) parameters.get("key");
        Optional<MemoryEntry> entry = memoryStore.latest(context.sessionId(), key);
        if (entry.isEmpty()) {
            return CompletableFuture.completedFuture(ToolResult.structured(
                    "Nothing remembered under '" + key + "'",
                    Map.of("key", key, "found", false)));
        }
        MemoryEntry found = entry.get();
        String value = found.getValue() != null ? found.getValue() : "";
        return CompletableFuture.completedFuture(ToolResult.structured(value, Map.of(
                "key", key,
                "found", true,
                "index", found.getIndex(),
                "turnId", found.getTurnId() != null ? found.getTurnId() : "")));
    }
}
