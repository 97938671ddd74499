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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.BudgetExceededException;
import me.golemcore.agent.domain.exception.EngineRejectedException;
import me.golemcore.agent.domain.exception.EngineUnavailableException;
import me.golemcore.agent.domain.exception.SessionCancelledException;
import me.golemcore.agent.domain.exception.SessionTerminatedException;
import me.golemcore.agent.domain.model.AgentFailure;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.Decision;
import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.ReasoningContext;
import me.golemcore.agent.domain.model.SessionStatus;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.Turn;
import me.golemcore.agent.domain.model.TurnInput;
import me.golemcore.agent.domain.model.TurnResult;
import me.golemcore.agent.domain.tool.ToolDispatcher;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.MemoryStorePort;
import me.golemcore.agent.port.outbound.ReasoningEnginePort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives a session through reason/act steps until it completes, fails, or
 * needs input from the caller.
 *
 * <p>
 * Every step records exactly one {@link Turn}:
 * <ol>
 * <li>build the context window and ask the reasoning engine for a
 * {@link Decision} (unavailable engines are retried with backoff);</li>
 * <li>{@code FinalAnswer} completes the session, {@code NeedsInput} suspends
 * it until the caller continues;</li>
 * <li>{@code ToolRequests} are resolved and validated as a whole, dispatched,
 * and their results appended to memory in request order before the next
 * step.</li>
 * </ol>
 *
 * <p>
 * Any failure that ends the session is written as an {@code error} memory
 * entry and a failed Turn before the status moves to
 * {@link SessionStatus#FAILED}. A run holds the session's own lock, so runs of
 * the same session are serialized while different sessions run freely.
 */
@Slf4j
public class AgentLoop {

    private static final Duration START_POLL = Duration.ofMillis(50);

    private final ReasoningEnginePort reasoningEngine;
    private final MemoryStorePort memoryStore;
    private final ToolRegistry toolRegistry;
    private final ToolDispatcher toolDispatcher;
    private final ContextWindowBuilder windowBuilder;
    private final ExecutorService engineExecutor;
    private final RetryPolicy engineRetryPolicy;
    private final Duration engineTimeout;
    private final AgentProperties.LoopProperties settings;
    private final Clock clock;

    public AgentLoop(ReasoningEnginePort reasoningEngine, MemoryStorePort memoryStore, ToolRegistry toolRegistry,
            ToolDispatcher toolDispatcher, ContextWindowBuilder windowBuilder, ExecutorService engineExecutor,
            AgentProperties.EngineProperties engineSettings, AgentProperties.LoopProperties settings, Clock clock) {
        this.reasoningEngine = reasoningEngine;
        this.memoryStore = memoryStore;
        this.toolRegistry = toolRegistry;
        this.toolDispatcher = toolDispatcher;
        this.windowBuilder = windowBuilder;
        this.engineExecutor = engineExecutor;
        this.engineRetryPolicy = RetryPolicy.from(engineSettings.getRetry());
        this.engineTimeout = engineSettings.getTimeout();
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Runs the session from its current state with the given input.
     *
     * @throws SessionTerminatedException
     *             if the session already reached a terminal status
     */
    public TurnResult run(AgentSession session, TurnInput input) {
        ReentrantLock lock = session.getRunLock();
        lock.lock();
        try {
            if (session.getStatus().isTerminal()) {
                throw new SessionTerminatedException(session.getId(), session.getStatus());
            }
            return drive(session, input);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fails a session that is not currently running, recording the failure the
     * same way a run would. Does nothing if the session is already terminal.
     *
     * @return false if a run currently holds the session
     */
    public boolean failIdle(AgentSession session, AgentException cause) {
        ReentrantLock lock = session.getRunLock();
        if (!lock.tryLock()) {
            return false;
        }
        try {
            if (!session.getStatus().isTerminal()) {
                int number = session.nextTurnNumber();
                StepRecord step = new StepRecord(session.getId(), number, TurnInput.none(), clock.instant());
                failSession(session, step, cause);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private TurnResult drive(AgentSession session, TurnInput input) {
        String sessionId = session.getId();
        Duration deadlineBudget = settings.getDeadline();
        Instant deadline = deadlineBudget != null && !deadlineBudget.isZero()
                ? clock.instant().plus(deadlineBudget)
                : null;
        CancellationToken cancellation = session.getCancellationToken();
        log.info("[AgentLoop] Session {} run started ({} turns so far)", sessionId, session.getTurns().size());

        TurnInput next = input != null ? input : TurnInput.none();
        while (true) {
            StepRecord step = new StepRecord(sessionId, session.nextTurnNumber(), next, clock.instant());
            try {
                cancellation.throwIfCancelled(sessionId);
                checkTurnBudget(step.number);
                checkDeadline(deadline);
                session.transitionTo(SessionStatus.REASONING, clock.instant());

                if (next.kind() == TurnInput.Kind.USER) {
                    step.memoryDeltas.add(remember(step, MemoryEntry.KEY_INPUT, next.text()));
                }

                ReasoningContext context = windowBuilder.build(sessionId, step.number, next);
                step.decision = decideWithRetry(context, cancellation);
                cancellation.throwIfCancelled(sessionId);

                if (step.decision instanceof Decision.FinalAnswer answer) {
                    step.memoryDeltas.add(remember(step, MemoryEntry.KEY_ANSWER, answer.text()));
                    session.appendTurn(step.toTurn(null, clock.instant()), clock.instant());
                    session.complete(answer.text(), clock.instant());
                    log.info("[AgentLoop] Session {} completed after {} turns", sessionId, step.number);
                    return TurnResult.of(session);
                }
                if (step.decision instanceof Decision.NeedsInput needsInput) {
                    step.memoryDeltas.add(remember(step, MemoryEntry.KEY_NEEDS_INPUT, needsInput.prompt()));
                    session.appendTurn(step.toTurn(null, clock.instant()), clock.instant());
                    session.awaitInput(needsInput.prompt(), clock.instant());
                    log.info("[AgentLoop] Session {} awaiting input at turn {}", sessionId, step.number);
                    return TurnResult.of(session);
                }

                Decision.ToolRequests requests = (Decision.ToolRequests) step.decision;
                ToolInvocation failed = executeTools(session, step, requests.calls(), deadline);
                if (failed != null) {
                    return failSession(session, step, failed.getFailure());
                }
                session.appendTurn(step.toTurn(null, clock.instant()), clock.instant());
                next = TurnInput.toolResults(summarize(step.invocations));
            } catch (SessionCancelledException e) {
                // Partial tool results of a cancelled turn are never committed.
                step.invocations.clear();
                return failSession(session, step, e);
            } catch (AgentException e) {
                return failSession(session, step, e);
            } catch (RuntimeException e) {
                log.error("[AgentLoop] Unexpected error in session {}", sessionId, e);
                return failSession(session, step,
                        new AgentException(ErrorKind.INTERNAL, "Unexpected error: " + e.getMessage(), e));
            }
        }
    }

    /**
     * Resolves, validates and dispatches one batch of tool calls, appending the
     * results to memory in request order.
     *
     * @return the invocation that should fail the session, or null
     */
    private ToolInvocation executeTools(AgentSession session, StepRecord step, List<ToolCall> calls,
            Instant deadline) {
        String sessionId = session.getId();
        session.transitionTo(SessionStatus.TOOL_EXECUTING, clock.instant());

        int used = session.getToolInvocationCount();
        if (used + calls.size() > settings.getMaxToolInvocations()) {
            throw new BudgetExceededException("Tool invocation budget exceeded: " + used + " used, "
                    + calls.size() + " requested, limit " + settings.getMaxToolInvocations());
        }

        boolean stopOnFailure = settings.isStopOnToolFailure();
        ToolInvocation[] slots = new ToolInvocation[calls.size()];
        List<ToolDispatcher.PreparedCall> prepared = new ArrayList<>();
        List<Integer> preparedSlots = new ArrayList<>();
        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            try {
                ToolRegistry.RegisteredTool tool = toolRegistry.validate(call.getName(), call.getArguments());
                prepared.add(new ToolDispatcher.PreparedCall(call, tool));
                preparedSlots.add(i);
            } catch (AgentException e) {
                if (stopOnFailure) {
                    throw e;
                }
                log.warn("[AgentLoop] Rejected tool call '{}': {}", call.getName(), e.getMessage());
                slots[i] = rejected(call, e);
            }
        }

        log.debug("[AgentLoop] Session {} turn {} dispatching {} tool call(s)", sessionId, step.number,
                prepared.size());
        List<ToolInvocation> dispatched = toolDispatcher.dispatch(sessionId, step.turnId, prepared,
                session.getCancellationToken(), stopOnFailure);
        session.getCancellationToken().throwIfCancelled(sessionId);

        for (int i = 0; i < dispatched.size(); i++) {
            slots[preparedSlots.get(i)] = dispatched.get(i);
        }

        ToolInvocation firstFailure = null;
        for (ToolInvocation invocation : slots) {
            if (invocation == null) {
                continue;
            }
            step.invocations.add(invocation);
            step.memoryDeltas.add(remember(step, MemoryEntry.toolKey(invocation.getToolName()),
                    invocation.toMemoryValue()));
            if (firstFailure == null && !invocation.isSuccess()) {
                firstFailure = invocation;
            }
        }
        checkDeadline(deadline);
        return stopOnFailure ? firstFailure : null;
    }

    private Decision decideWithRetry(ReasoningContext context, CancellationToken cancellation) {
        String sessionId = context.getSessionId();
        AgentException lastFailure = null;
        for (int attempt = 1; attempt <= engineRetryPolicy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                Duration backoff = engineRetryPolicy.backoffBefore(attempt);
                log.warn("[AgentLoop] Reasoning engine unavailable (attempt {}/{}), retrying in {}ms: {}",
                        attempt, engineRetryPolicy.maxAttempts(), backoff.toMillis(),
                        lastFailure != null ? lastFailure.getMessage() : null);
                sleepOrCancel(sessionId, backoff, cancellation);
            }
            try {
                return callEngine(context, cancellation);
            } catch (SessionCancelledException e) {
                throw e;
            } catch (AgentException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    private Decision callEngine(ReasoningContext context, CancellationToken cancellation) {
        String sessionId = context.getSessionId();
        CountDownLatch started = new CountDownLatch(1);
        Future<Decision> future = cancellation.register(engineExecutor.submit(() -> {
            started.countDown();
            return reasoningEngine.decide(context);
        }));
        try {
            // The timeout covers the call itself, not time spent queued for a thread
            awaitStart(started, future);
            Decision decision = future.get(engineTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (decision == null) {
                throw new EngineRejectedException("Reasoning engine returned no decision");
            }
            return decision;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new EngineUnavailableException("Reasoning engine timed out after " + engineTimeout.toMillis()
                    + "ms");
        } catch (CancellationException e) {
            throw new SessionCancelledException(sessionId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SessionCancelledException(sessionId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            throw new AgentException(ErrorKind.INTERNAL, "Reasoning engine failed: " + cause.getMessage(), cause);
        } finally {
            cancellation.unregister(future);
        }
    }

    private static void awaitStart(CountDownLatch started, Future<?> future) throws InterruptedException {
        boolean running = started.await(START_POLL.toMillis(), TimeUnit.MILLISECONDS);
        while (!running && !future.isDone()) {
            running = started.await(START_POLL.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private TurnResult failSession(AgentSession session, StepRecord step, AgentException cause) {
        return failSession(session, step, AgentFailure.from(cause));
    }

    private TurnResult failSession(AgentSession session, StepRecord step, AgentFailure failure) {
        try {
            step.memoryDeltas.add(remember(step, MemoryEntry.KEY_ERROR, failure.describe()));
        } catch (RuntimeException e) {
            log.error("[AgentLoop] Could not write error entry for session {}: {}", session.getId(),
                    e.getMessage());
        }
        Instant now = clock.instant();
        session.appendTurn(step.toTurn(failure, now), now);
        session.fail(failure, now);
        log.error("[AgentLoop] Session {} failed at turn {}: {}", session.getId(), step.number, failure.describe());
        return TurnResult.of(session);
    }

    private long remember(StepRecord step, String key, String value) {
        MemoryEntry entry = MemoryEntry.pending(key, value, step.turnId, clock.instant());
        return memoryStore.append(step.sessionId, entry).getIndex();
    }

    private void checkTurnBudget(int turnNumber) {
        if (turnNumber > settings.getMaxTurns()) {
            throw new BudgetExceededException("Turn budget exceeded: limit " + settings.getMaxTurns());
        }
    }

    private void checkDeadline(Instant deadline) {
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new BudgetExceededException("Run deadline of " + settings.getDeadline().toMillis()
                    + "ms exceeded");
        }
    }

    private void sleepOrCancel(String sessionId, Duration backoff, CancellationToken cancellation) {
        try {
            if (cancellation.sleep(backoff)) {
                throw new SessionCancelledException(sessionId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionCancelledException(sessionId);
        }
    }

    private ToolInvocation rejected(ToolCall call, AgentException error) {
        return ToolInvocation.builder()
                .callId(call.getId())
                .toolName(call.getName())
                .arguments(call.getArguments())
                .failure(AgentFailure.from(error))
                .build();
    }

    private static String summarize(List<ToolInvocation> invocations) {
        StringBuilder summary = new StringBuilder();
        for (ToolInvocation invocation : invocations) {
            if (summary.length() > 0) {
                summary.append('\n');
            }
            summary.append(invocation.getToolName()).append(": ")
                    .append(invocation.isSuccess() ? "ok" : "error");
        }
        return summary.toString();
    }

    /**
     * Mutable accumulator for the Turn being recorded by the current step.
     */
    private static final class StepRecord {

        private final String sessionId;
        private final int number;
        private final String turnId;
        private final TurnInput input;
        private final Instant startedAt;
        private final List<Long> memoryDeltas = new ArrayList<>();
        private final List<ToolInvocation> invocations = new ArrayList<>();
        private Decision decision;

        private StepRecord(String sessionId, int number, TurnInput input, Instant startedAt) {
            this.sessionId = sessionId;
            this.number = number;
            this.turnId = Turn.idFor(sessionId, number);
            this.input = input;
            this.startedAt = startedAt;
        }

        private Turn toTurn(AgentFailure failure, Instant completedAt) {
            return Turn.builder()
                    .id(turnId)
                    .number(number)
                    .input(input)
                    .decision(decision)
                    .toolInvocations(invocations)
                    .memoryDeltas(memoryDeltas)
                    .failure(failure)
                    .startedAt(startedAt)
                    .completedAt(completedAt)
                    .build();
        }
    }
}
