package me.golemcore.agent.domain.tool;

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
import me.golemcore.agent.domain.exception.SessionCancelledException;
import me.golemcore.agent.domain.model.AgentFailure;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.ToolInvocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Schedules the tool calls of one turn.
 *
 * <p>
 * Calls are taken in request order and grouped into segments:
 * <ul>
 * <li>a call to a tool that is not concurrency-safe runs alone, after
 * everything requested before it and before everything requested after
 * it;</li>
 * <li>consecutive calls to concurrency-safe tools form a parallel segment.
 * Inside a segment every call to an idempotent tool gets its own lane, while
 * all calls to the same non-idempotent tool share one lane and run strictly
 * in request order.</li>
 * </ul>
 * A segment is joined before the next one starts. Results are returned in
 * request order regardless of completion order.
 *
 * <p>
 * Once a call to a non-idempotent tool times out, its execution may still be
 * running. Later calls to the same tool in the same dispatch are not started
 * and are recorded as {@link ErrorKind#TOOL_FAILURE}.
 */
@Slf4j
public class ToolDispatcher {

    private final ToolInvoker invoker;
    private final ExecutorService executor;

    public ToolDispatcher(ToolInvoker invoker, ExecutorService executor) {
        this.invoker = invoker;
        this.executor = executor;
    }

    /**
     * @param stopOnFailure
     *            when true, segments after a failed invocation are not started
     *            and their calls are left out of the result
     * @throws SessionCancelledException
     *             if the session is cancelled while calls are in flight
     */
    public List<ToolInvocation> dispatch(String sessionId, String turnId, List<PreparedCall> calls,
            CancellationToken cancellation, boolean stopOnFailure) {
        AtomicReferenceArray<ToolInvocation> results = new AtomicReferenceArray<>(calls.size());
        Set<String> timedOutTools = ConcurrentHashMap.newKeySet();

        int position = 0;
        while (position < calls.size()) {
            cancellation.throwIfCancelled(sessionId);

            int segmentEnd = segmentEnd(calls, position);
            List<List<Integer>> lanes = buildLanes(calls, position, segmentEnd);
            if (lanes.size() == 1) {
                runLane(sessionId, turnId, calls, lanes.get(0), results, timedOutTools, cancellation);
            } else {
                runParallel(sessionId, turnId, calls, lanes, results, timedOutTools, cancellation);
            }

            if (stopOnFailure && hasFailure(results, position, segmentEnd)) {
                if (segmentEnd < calls.size()) {
                    log.warn("[Tools] Skipping {} remaining tool call(s) after failure in turn {}",
                            calls.size() - segmentEnd, turnId);
                }
                break;
            }
            position = segmentEnd;
        }

        List<ToolInvocation> ordered = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            if (results.get(i) != null) {
                ordered.add(results.get(i));
            }
        }
        return ordered;
    }

    private int segmentEnd(List<PreparedCall> calls, int start) {
        if (!calls.get(start).descriptor().isConcurrencySafe()) {
            return start + 1;
        }
        int end = start;
        while (end < calls.size() && calls.get(end).descriptor().isConcurrencySafe()) {
            end++;
        }
        return end;
    }

    private List<List<Integer>> buildLanes(List<PreparedCall> calls, int start, int end) {
        Map<String, List<Integer>> lanes = new LinkedHashMap<>();
        for (int i = start; i < end; i++) {
            ToolDescriptor descriptor = calls.get(i).descriptor();
            String laneKey = descriptor.isIdempotent() ? "call#" + i : "tool:" + descriptor.getName();
            lanes.computeIfAbsent(laneKey, key -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(lanes.values());
    }

    private void runLane(String sessionId, String turnId, List<PreparedCall> calls, List<Integer> lane,
            AtomicReferenceArray<ToolInvocation> results, Set<String> timedOutTools, CancellationToken cancellation) {
        for (int index : lane) {
            PreparedCall call = calls.get(index);
            ToolDescriptor descriptor = call.descriptor();
            if (!descriptor.isIdempotent() && timedOutTools.contains(descriptor.getName())) {
                log.warn("[Tools] Not starting '{}' (call {}): an earlier call timed out and may still be running",
                        descriptor.getName(), call.call().getId());
                results.set(index, notStarted(call));
                continue;
            }
            ToolInvocation invocation = invoker.invoke(sessionId, turnId, call.call(), call.tool(), cancellation);
            if (!descriptor.isIdempotent() && invocation.getFailure() != null
                    && invocation.getFailure().kind() == ErrorKind.TOOL_TIMEOUT) {
                timedOutTools.add(descriptor.getName());
            }
            results.set(index, invocation);
        }
    }

    private ToolInvocation notStarted(PreparedCall call) {
        return ToolInvocation.builder()
                .callId(call.call().getId())
                .toolName(call.call().getName())
                .arguments(call.call().getArguments())
                .failure(AgentFailure.of(ErrorKind.TOOL_FAILURE,
                        "Not started: an earlier call to " + call.call().getName() + " timed out"))
                .build();
    }

    private void runParallel(String sessionId, String turnId, List<PreparedCall> calls, List<List<Integer>> lanes,
            AtomicReferenceArray<ToolInvocation> results, Set<String> timedOutTools, CancellationToken cancellation) {
        log.debug("[Tools] Running {} lanes in parallel for turn {}", lanes.size(), turnId);
        List<Future<?>> futures = new ArrayList<>(lanes.size());
        for (List<Integer> lane : lanes) {
            futures.add(cancellation.register(executor.submit(
                    () -> runLane(sessionId, turnId, calls, lane, results, timedOutTools, cancellation))));
        }

        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new SessionCancelledException(sessionId);
        } catch (CancellationException e) {
            cancelAll(futures);
            throw new SessionCancelledException(sessionId);
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause();
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            throw new AgentException(ErrorKind.INTERNAL, "Tool lane failed: " + cause, cause);
        } finally {
            futures.forEach(cancellation::unregister);
        }
    }

    private void cancelAll(List<Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    private boolean hasFailure(AtomicReferenceArray<ToolInvocation> results, int start, int end) {
        for (int i = start; i < end; i++) {
            ToolInvocation invocation = results.get(i);
            if (invocation != null && !invocation.isSuccess()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A tool call that already passed resolution and schema validation.
     */
    public record PreparedCall(ToolCall call, ToolRegistry.RegisteredTool tool) {

        public ToolDescriptor descriptor() {
            return tool.descriptor();
        }
    }
}
