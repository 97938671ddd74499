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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.MemorySequence;
import me.golemcore.agent.domain.model.MemoryWindow;
import me.golemcore.agent.port.outbound.MemoryStorePort;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process memory store. Entries live as long as the JVM or until the
 * session is deleted.
 */
@Slf4j
public class InMemoryMemoryStore implements MemoryStorePort {

    private final Map<String, SessionMemoryLog> logs = new ConcurrentHashMap<>();

    @Override
    public MemoryEntry append(String sessionId, MemoryEntry entry) {
        SessionMemoryLog sessionLog = logs.computeIfAbsent(sessionId, id -> new SessionMemoryLog());
        MemoryEntry stored = sessionLog.append(sessionId, entry, committed -> {
        });
        log.trace("[Memory] {} #{} {}", sessionId, stored.getIndex(), stored.getKey());
        return stored;
    }

    @Override
    public MemorySequence query(String sessionId, MemoryWindow window) {
        SessionMemoryLog sessionLog = logs.get(sessionId);
        return sessionLog != null ? sessionLog.query(window) : MemorySequence.empty();
    }

    @Override
    public Optional<MemoryEntry> latest(String sessionId, String key) {
        SessionMemoryLog sessionLog = logs.get(sessionId);
        return sessionLog != null ? sessionLog.latest(key) : Optional.empty();
    }

    @Override
    public long size(String sessionId) {
        SessionMemoryLog sessionLog = logs.get(sessionId);
        return sessionLog != null ? sessionLog.size() : 0;
    }

    @Override
    public void delete(String sessionId) {
        if (logs.remove(sessionId) != null) {
            log.debug("[Memory] Dropped memory of session {}", sessionId);
        }
    }
}
