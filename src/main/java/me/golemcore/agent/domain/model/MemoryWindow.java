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

import java.util.List;

/**
 * Caller-supplied bound for a memory query. Windows always keep the newest
 * entries and return them oldest first.
 */
public record MemoryWindow(Type type, int limit) {

    /** Rough token estimate used by {@link Type#TOKEN_BUDGET} windows. */
    public static final int CHARS_PER_TOKEN = 4;

    public enum Type {
        ALL, LAST_ENTRIES, TOKEN_BUDGET
    }

    public MemoryWindow {
        if (type != Type.ALL && limit < 0) {
            throw new IllegalArgumentException("Window limit must be >= 0: " + limit);
        }
    }

    public static MemoryWindow all() {
        return new MemoryWindow(Type.ALL, 0);
    }

    public static MemoryWindow lastEntries(int count) {
        return new MemoryWindow(Type.LAST_ENTRIES, count);
    }

    public static MemoryWindow tokenBudget(int tokens) {
        return new MemoryWindow(Type.TOKEN_BUDGET, tokens);
    }

    /**
     * Returns the position of the first entry inside the window, given a snapshot
     * of the session's entries in index order, of which the first {@code end}
     * are visible.
     */
    public int startOffset(List<MemoryEntry> entries, int end) {
        return switch (type) {
        case ALL -> 0;
        case LAST_ENTRIES -> Math.max(0, end - limit);
        case TOKEN_BUDGET -> tokenBudgetStart(entries, end);
        };
    }

    private int tokenBudgetStart(List<MemoryEntry> entries, int end) {
        int used = 0;
        int start = end;
        while (start > 0) {
            int cost = estimateTokens(entries.get(start - 1));
            if (used + cost > limit) {
                break;
            }
            used += cost;
            start--;
        }
        return start;
    }

    public static int estimateTokens(MemoryEntry entry) {
        int chars = length(entry.getKey()) + length(entry.getValue());
        return Math.max(1, (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    private static int length(String text) {
        return text != null ? text.length() : 0;
    }
}
