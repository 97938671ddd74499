package me.golemcore.agent.adapter.outbound.memory;

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
import me.golemcore.agent.domain.model.MemorySequence;
import me.golemcore.agent.domain.model.MemoryWindow;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only log of one session's memory entries.
 *
 * <p>
 * Appends are serialized on this log only, so sessions never contend with each
 * other. Reads are lock-free: the backing list is copy-on-write, which lets a
 * {@link MemorySequence} iterate lazily while new entries are appended.
 */
final class SessionMemoryLog {

    private final List<MemoryEntry> entries = new CopyOnWriteArrayList<>();
    private final Map<String, MemoryEntry> latestByKey = new ConcurrentHashMap<>();

    /**
     * Assigns the next index and commits the entry. {@code beforeCommit} runs
     * under the log lock with the final entry; if it throws, nothing is committed
     * and the index is not consumed.
     */
    synchronized MemoryEntry append(String sessionId, MemoryEntry entry, Consumer<MemoryEntry> beforeCommit) {
        MemoryEntry stored = entry.toBuilder()
                .sessionId(sessionId)
                .index(entries.size() + 1L)
                .build();
        beforeCommit.accept(stored);
        commit(stored);
        return stored;
    }

    /**
     * Re-adds an entry read back from durable storage.
     */
    synchronized void restore(MemoryEntry entry) {
        long expected = entries.size() + 1L;
        if (entry.getIndex() != expected) {
            throw new IllegalStateException("Corrupt memory log for session " + entry.getSessionId()
                    + ": expected index " + expected + " but found " + entry.getIndex());
        }
        commit(entry);
    }

    MemorySequence query(MemoryWindow window) {
        int end = entries.size();
        return new MemorySequence(entries, window.startOffset(entries, end), end);
    }

    Optional<MemoryEntry> latest(String key) {
        return Optional.ofNullable(latestByKey.get(key));
    }

    long size() {
        return entries.size();
    }

    private void commit(MemoryEntry entry) {
        entries.add(entry);
        if (entry.getKey() != null) {
            latestByKey.put(entry.getKey(), entry);
        }
    }
}
