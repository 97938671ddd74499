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
import me.golemcore.agent.domain.exception.ToolFailureException;
import me.golemcore.agent.domain.exception.ToolTimeoutException;
import me.golemcore.agent.domain.loop.RetryPolicy;
import me.golemcore.agent.domain.model.AgentFailure;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.ToolAttempt;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.ToolExecutionContext;
import me.golemcore.agent.domain.model.ToolInvocation;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one validated tool call: timeout per attempt, bounded retries with
 * exponential backoff for retryable failures, and a record of every attempt.
 *
 * <p>
 * Only {@link ErrorKind#TOOL_TIMEOUT} is retried, and only for idempotent
 * tools. A timed-out attempt cannot be stopped reliably, so a non-idempotent
 * tool gets a single attempt and its timeout is final. A failed
 * {@link ToolResult} or an exception thrown by the tool is
 * {@link ErrorKind#TOOL_FAILURE}; a result that violates the declared output
 * schema is {@link ErrorKind#SCHEMA_MISMATCH}. Both end the invocation on the
 * first attempt. Session cancellation aborts the invocation and is rethrown as
 * {@link SessionCancelledException}; nothing of the partial invocation is
 * returned.
 */
@Slf4j
public class ToolInvoker {

    private final Duration defaultTimeout;
    private final RetryPolicy defaultRetryPolicy;
    private final Clock clock;

    public ToolInvoker(AgentProperties.ToolProperties properties, Clock clock) {
        this(properties.getDefaultTimeout(), RetryPolicy.from(properties.getRetry()), clock);
    }

    public ToolInvoker(Duration defaultTimeout, RetryPolicy defaultRetryPolicy, Clock clock) {
        this.defaultTimeout = defaultTimeout;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.clock = clock;
    }

    public ToolInvocation invoke(String sessionId, String turnId, ToolCall call, ToolRegistry.RegisteredTool tool,
            CancellationToken cancellation) {
        ToolDescriptor descriptor = tool.descriptor();
        RetryPolicy policy = retryPolicyFor(descriptor);
        Duration timeout = descriptor.getTimeout() != null ? descriptor.getTimeout() : defaultTimeout;

        ToolInvocation.ToolInvocationBuilder invocation = ToolInvocation.builder()
                .callId(call.getId())
                .toolName(call.getName())
                .arguments(call.getArguments());

        long startedMs = clock.millis();
        AgentFailure failure = null;
        ToolResult result = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                Duration backoff = policy.backoffBefore(attempt);
                log.warn("[Tools] Retrying '{}' (attempt {}/{}) in {}ms after {}", call.getName(), attempt,
                        policy.maxAttempts(), backoff.toMillis(), failure != null ? failure.kind() : null);
                sleepOrCancel(sessionId, backoff, cancellation);
            }
            cancellation.throwIfCancelled(sessionId);

            Instant attemptStart = clock.instant();
            long attemptStartMs = clock.millis();
            ToolExecutionContext context = new ToolExecutionContext(sessionId, turnId, call.getId(), attempt);
            try {
                result = runAttempt(sessionId, context, call, tool, timeout, cancellation);
                failure = null;
                invocation.attempt(new ToolAttempt(attempt, attemptStart, clock.millis() - attemptStartMs, null));
                break;
            } catch (SessionCancelledException e) {
                throw e;
            } catch (AgentException e) {
                failure = AgentFailure.from(e);
                invocation.attempt(new ToolAttempt(attempt, attemptStart, clock.millis() - attemptStartMs,
                        e.getKind()));
                if (e instanceof ToolFailureResult failed) {
                    result = failed.result;
                }
                if (!e.isRetryable()) {
                    break;
                }
                if (!descriptor.isIdempotent()) {
                    log.warn("[Tools] Not retrying non-idempotent '{}' after {}; the timed-out attempt may still run",
                            call.getName(), e.getKind());
                    break;
                }
            }
        }

        if (failure != null) {
            log.warn("[Tools] '{}' failed: {}", call.getName(), failure.describe());
        } else {
            log.debug("[Tools] '{}' completed in {}ms", call.getName(), clock.millis() - startedMs);
        }

        return invocation
                .result(result)
                .failure(failure)
                .latencyMs(clock.millis() - startedMs)
                .build();
    }

    private ToolResult runAttempt(String sessionId, ToolExecutionContext context, ToolCall call,
            ToolRegistry.RegisteredTool tool, Duration timeout, CancellationToken cancellation) {
        CompletableFuture<ToolResult> future;
        try {
            future = tool.component().execute(context, call.getArguments());
        } catch (RuntimeException e) {
            throw new ToolFailureException(call.getName(), safeCauseMessage(e), e);
        }
        if (future == null) {
            throw new ToolFailureException(call.getName(), "returned no result");
        }

        cancellation.register(future);
        try {
            ToolResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new ToolFailureException(call.getName(), "returned no result");
            }
            if (!result.isSuccess()) {
                throw new ToolFailureResult(call.getName(), result);
            }
            validateOutput(tool.descriptor(), result);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolTimeoutException(call.getName(), timeout.toMillis());
        } catch (CancellationException e) {
            if (cancellation.isCancelled()) {
                throw new SessionCancelledException(sessionId);
            }
            throw new ToolFailureException(call.getName(), "cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new SessionCancelledException(sessionId);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                throw new ToolTimeoutException(call.getName(), timeout.toMillis());
            }
            throw new ToolFailureException(call.getName(), safeCauseMessage(cause), cause);
        } finally {
            cancellation.unregister(future);
        }
    }

    private void validateOutput(ToolDescriptor descriptor, ToolResult result) {
        Map<String, Object> schema = descriptor.getOutputSchema();
        if (schema == null || schema.isEmpty()) {
            return;
        }
        Object value = "object".equals(schema.get("type")) ? result.getData() : result.getOutput();
        ToolSchemaValidator.validateOutput(descriptor.getName(), schema, value);
    }

    private RetryPolicy retryPolicyFor(ToolDescriptor descriptor) {
        if (descriptor.getMaxAttempts() != null && descriptor.getMaxAttempts() > 0) {
            return defaultRetryPolicy.withMaxAttempts(descriptor.getMaxAttempts());
        }
        return defaultRetryPolicy;
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

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Tool returned {@code success=false}; keeps the result for the record.
     */
    private static final class ToolFailureResult extends ToolFailureException {

        private static final long serialVersionUID = 1L;

        private final transient ToolResult result;

        private ToolFailureResult(String toolName, ToolResult result) {
            super(toolName, result.getError() != null ? result.getError() : "unknown error");
            this.result = result;
        }
    }
}
