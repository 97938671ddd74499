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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.MemorySequence;
import me.golemcore.agent.domain.model.MemoryWindow;
import me.golemcore.agent.port.outbound.MemoryStorePort;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Durable memory store keeping one append log per session.
 *
 * <p>
 * Layout: {@code <base-path>/<sessionId>.jsonl}, one JSON-serialized
 * {@link MemoryEntry} per line carrying session id, ordering index, provenance
 * turn id and content. A session's log is replayed on first access, which
 * restores its entries and its next ordering index; the replay is sufficient
 * to reconstruct the full history.
 *
 * <p>
 * Base path configured via {@code agent.memory.base-path}, defaults to
 * {@code ${user.home}/.golemcore/agent/memory}.
 */
@Slf4j
public class JsonlMemoryStore implements MemoryStorePort {

    private static final String EXTENSION = ".jsonl";
    private static final Pattern SAFE_SESSION_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path basePath;
    private final ObjectMapper objectMapper;
    private final Map<String, SessionMemoryLog> logs = new ConcurrentHashMap<>();

    public JsonlMemoryStore(String basePath, ObjectMapper objectMapper) {
        this.basePath = Paths.get(basePath.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create memory directory: " + this.basePath, e);
        }
        log.info("[Memory] JSONL memory store initialized at: {}", this.basePath);
    }

    @Override
    public MemoryEntry append(String sessionId, MemoryEntry entry) {
        Path file = resolveLog(sessionId);
        SessionMemoryLog sessionLog = logs.computeIfAbsent(sessionId, this::replay);
        return sessionLog.append(sessionId, entry, stored -> writeLine(file, stored));
    }

    @Override
    public MemorySequence query(String sessionId, MemoryWindow window) {
        return logFor(sessionId).map(sessionLog -> sessionLog.query(window)).orElse(MemorySequence.empty());
    }

    @Override
    public Optional<MemoryEntry> latest(String sessionId, String key) {
        return logFor(sessionId).flatMap(sessionLog -> sessionLog.latest(key));
    }

    @Override
    public long size(String sessionId) {
        return logFor(sessionId).map(SessionMemoryLog::size).orElse(0L);
    }

    @Override
    public void delete(String sessionId) {
        logs.remove(sessionId);
        try {
            Files.deleteIfExists(resolveLog(sessionId));
            log.debug("[Memory] Deleted memory log of session {}", sessionId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete memory log: " + sessionId, e);
        }
    }

    private Optional<SessionMemoryLog> logFor(String sessionId) {
        SessionMemoryLog cached = logs.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (!Files.exists(resolveLog(sessionId))) {
            return Optional.empty();
        }
        return Optional.of(logs.computeIfAbsent(sessionId, this::replay));
    }

    private SessionMemoryLog replay(String sessionId) {
        SessionMemoryLog sessionLog = new SessionMemoryLog();
        Path file = resolveLog(sessionId);
        if (!Files.exists(file)) {
            return sessionLog;
        }
        int restored = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                sessionLog.restore(objectMapper.readValue(line, MemoryEntry.class));
                restored++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to replay memory log: " + file, e);
        }
        log.info("[Memory] Replayed {} entries for session {}", restored, sessionId);
        return sessionLog;
    }

    private void writeLine(Path file, MemoryEntry entry) {
        try {
            String line = objectMapper.writeValueAsString(entry) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Memory entry is not serializable: " + entry.getKey(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append memory entry to " + file, e);
        }
    }

    private Path resolveLog(String sessionId) {
        if (sessionId == null || !SAFE_SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id for memory log: " + sessionId);
        }
        return basePath.resolve(sessionId + EXTENSION);
    }
}
