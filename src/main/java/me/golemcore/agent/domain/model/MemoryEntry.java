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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only memory record scoped to a session.
 *
 * <p>
 * The store assigns {@code index} on append; indexes are strictly increasing
 * and gap-free per session, starting at 1. Entries are never mutated; a later
 * entry under the same {@code key} supersedes earlier ones.
 */
@Value
@Builder(toBuilder = true)
public class MemoryEntry {

    public static final String KEY_INPUT = "input";
    public static final String KEY_ANSWER = "answer";
    public static final String KEY_NEEDS_INPUT = "needs_input";
    public static final String KEY_ERROR = "error";
    public static final String TOOL_KEY_PREFIX = "tool:";

    String sessionId;
    long index;
    String key;
    String value;
    String turnId;
    Instant createdAt;

    @JsonCreator
    public MemoryEntry(@JsonProperty("sessionId") String sessionId,
            @JsonProperty("index") long index,
            @JsonProperty("key") String key,
            @JsonProperty("value") String value,
            @JsonProperty("turnId") String turnId,
            @JsonProperty("createdAt") Instant createdAt) {
        this.sessionId = sessionId;
        this.index = index;
        this.key = key;
        this.value = value;
        this.turnId = turnId;
        this.createdAt = createdAt;
    }

    /**
     * Creates an entry that is not yet appended (index 0).
     */
    public static MemoryEntry pending(String key, String value, String turnId, Instant createdAt) {
        return new MemoryEntry(null, 0, key, value, turnId, createdAt);
    }

    public static String toolKey(String toolName) {
        return TOOL_KEY_PREFIX + toolName;
    }

    @JsonIgnore
    public boolean isToolResult() {
        return key != null && key.startsWith(TOOL_KEY_PREFIX);
    }
}
