package me.golemcore.agent.domain.service;

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
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.model.AgentSession;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by id. Sessions exist here from creation until they are
 * closed or expire.
 */
@Slf4j
public class SessionRegistry {

    private final Map<String, AgentSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionRegistry(Clock clock) {
        this.clock = clock;
    }

    public AgentSession create() {
        AgentSession session = new AgentSession(UUID.randomUUID().toString(), clock.instant());
        sessions.put(session.getId(), session);
        log.debug("[Sessions] Created session {}", session.getId());
        return session;
    }

    public Optional<AgentSession> find(String sessionId) {
        return sessionId != null ? Optional.ofNullable(sessions.get(sessionId)) : Optional.empty();
    }

    public AgentSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<AgentSession> remove(String sessionId) {
        return sessionId != null ? Optional.ofNullable(sessions.remove(sessionId)) : Optional.empty();
    }

    public List<AgentSession> snapshot() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
