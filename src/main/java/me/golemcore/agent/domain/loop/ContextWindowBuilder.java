package me.golemcore.agent.domain.loop;

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

import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.MemoryWindow;
import me.golemcore.agent.domain.model.ReasoningContext;
import me.golemcore.agent.domain.model.TurnInput;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.port.outbound.MemoryStorePort;

import java.util.List;

/**
 * Builds the request-time view handed to the reasoning engine: the newest
 * memory entries of the session, bounded by entry count and optionally by a
 * token budget, plus every registered tool descriptor.
 */
public class ContextWindowBuilder {

    private final MemoryStorePort memoryStore;
    private final ToolRegistry toolRegistry;
    private final int maxEntries;
    private final int tokenBudget;

    public ContextWindowBuilder(MemoryStorePort memoryStore, ToolRegistry toolRegistry, int maxEntries,
            int tokenBudget) {
        this.memoryStore = memoryStore;
        this.toolRegistry = toolRegistry;
        this.maxEntries = maxEntries;
        this.tokenBudget = tokenBudget;
    }

    public ReasoningContext build(String sessionId, int turnNumber, TurnInput input) {
        return ReasoningContext.builder()
                .sessionId(sessionId)
                .turnNumber(turnNumber)
                .input(input)
                .memory(window(sessionId))
                .tools(toolRegistry.list())
                .build();
    }

    List<MemoryEntry> window(String sessionId) {
        MemoryWindow window = maxEntries > 0 ? MemoryWindow.lastEntries(maxEntries) : MemoryWindow.all();
        List<MemoryEntry> entries = memoryStore.query(sessionId, window).toList();
        if (tokenBudget <= 0) {
            return entries;
        }
        // Newest entries win when both bounds apply.
        int start = MemoryWindow.tokenBudget(tokenBudget).startOffset(entries, entries.size());
        return entries.subList(start, entries.size());
    }
}
