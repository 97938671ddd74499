package me.golemcore.agent.port.outbound;

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

import java.util.Optional;

/**
 * Port for the append-only session memory. Implementations keep a per-session
 * log and never mutate entries once written.
 */
public interface MemoryStorePort {

    /**
     * Appends an entry, assigning the session's next ordering index atomically.
     * The {@code sessionId} and {@code index} of the given entry are ignored.
     *
     * @return the stored entry with session id and index set
     */
    MemoryEntry append(String sessionId, MemoryEntry entry);

    /**
     * Returns the entries inside the window, oldest first. Unknown sessions yield
     * an empty sequence.
     */
    MemorySequence query(String sessionId, MemoryWindow window);

    /**
     * Returns the newest entry under the key, i.e. the one that supersedes all
     * earlier entries with the same key.
     */
    Optional<MemoryEntry> latest(String sessionId, String key);

    /**
     * Number of entries appended so far, which is also the last assigned index.
     */
    long size(String sessionId);

    /**
     * Drops the whole session log (session close or expiry).
     */
    void delete(String sessionId);
}
