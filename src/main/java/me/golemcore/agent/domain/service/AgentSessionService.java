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
import me.golemcore.agent.domain.exception.SessionCancelledException;
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.exception.SessionTerminatedException;
import me.golemcore.agent.domain.loop.AgentLoop;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.SessionHandle;
import me.golemcore.agent.domain.model.SessionStatus;
import me.golemcore.agent.domain.model.TurnInput;
import me.golemcore.agent.domain.model.TurnResult;
import me.golemcore.agent.port.inbound.AgentSessionPort;
import me.golemcore.agent.port.outbound.MemoryStorePort;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process call surface for callers driving agent sessions.
 *
 * <p>
 * Runs are synchronous except {@link #startSessionAsync(String)}, which runs
 * on the session runner pool and hands back the session id before the run
 * starts. Concurrent calls on the same session are
 * serialized by the loop; calls on different sessions never block each other.
 */
@Slf4j
public class AgentSessionService implements AgentSessionPort {

    private final SessionRegistry sessionRegistry;
    private final AgentLoop agentLoop;
    private final MemoryStorePort memoryStore;
    private final ExecutorService sessionRunner;

    public AgentSessionService(SessionRegistry sessionRegistry, AgentLoop agentLoop, MemoryStorePort memoryStore,
            ExecutorService sessionRunner) {
        this.sessionRegistry = sessionRegistry;
        this.agentLoop = agentLoop;
        this.memoryStore = memoryStore;
        this.sessionRunner = sessionRunner;
    }

    @Override
    public String startSession(String initialInput) {
        AgentSession session = sessionRegistry.create();
        agentLoop.run(session, TurnInput.user(initialInput));
        return session.getId();
    }

    @Override
    public SessionHandle startSessionAsync(String initialInput) {
        AgentSession session = sessionRegistry.create();
        CompletableFuture<TurnResult> result = CompletableFuture.supplyAsync(
                () -> agentLoop.run(session, TurnInput.user(initialInput)), sessionRunner);
        result.whenComplete((turnResult, error) -> {
            if (result.isCancelled()) {
                cancel(session);
            }
        });
        return new SessionHandle(session.getId(), result);
    }

    @Override
    public TurnResult continueSession(String sessionId, String input) {
        AgentSession session = sessionRegistry.require(sessionId);
        if (session.getStatus().isTerminal()) {
            throw new SessionTerminatedException(sessionId, session.getStatus());
        }
        return agentLoop.run(session, TurnInput.user(input));
    }

    @Override
    public SessionStatus getStatus(String sessionId) {
        return sessionRegistry.require(sessionId).getStatus();
    }

    @Override
    public TurnResult getResult(String sessionId) {
        return TurnResult.of(sessionRegistry.require(sessionId));
    }

    @Override
    public AgentSession getSession(String sessionId) {
        return sessionRegistry.require(sessionId);
    }

    @Override
    public void cancelSession(String sessionId) {
        cancel(sessionRegistry.require(sessionId));
    }

    private void cancel(AgentSession session) {
        String sessionId = session.getId();
        if (session.getStatus().isTerminal()) {
            log.debug("[Sessions] Cancel ignored, session {} is already {}", sessionId, session.getStatus());
            return;
        }
        session.getCancellationToken().cancel();
        if (!agentLoop.failIdle(session, new SessionCancelledException(sessionId))) {
            log.info("[Sessions] Cancellation signalled to running session {}", sessionId);
        }
    }

    @Override
    public void closeSession(String sessionId) {
        AgentSession session = sessionRegistry.remove(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        session.getCancellationToken().cancel();

        // Wait for an in-flight run to observe the cancellation before dropping memory.
        ReentrantLock lock = session.getRunLock();
        lock.lock();
        try {
            memoryStore.delete(sessionId);
        } finally {
            lock.unlock();
        }
        log.info("[Sessions] Closed session {} ({})", sessionId, session.getStatus());
    }
}
