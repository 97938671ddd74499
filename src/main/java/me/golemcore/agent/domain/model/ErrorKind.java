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

/**
 * Machine-readable classification of every failure the orchestrator can
 * observe or surface.
 *
 * <p>
 * This exists to avoid relying on string matching in error messages. Only
 * retryable kinds are retried locally by the orchestrator; every other kind
 * moves the session to {@link SessionStatus#FAILED} once observed.
 */
public enum ErrorKind {

    /**
     * A tool call referenced a name that is not present in the registry.
     */
    UNKNOWN_TOOL(false),

    /**
     * Tool call arguments did not satisfy the tool's input schema, or the tool
     * result did not satisfy its output schema.
     */
    SCHEMA_MISMATCH(false),

    /**
     * A tool invocation did not complete within its timeout.
     */
    TOOL_TIMEOUT(true),

    /**
     * A tool invocation failed during runtime (exception or failed result).
     */
    TOOL_FAILURE(false),

    /**
     * The reasoning engine could not be reached or was temporarily overloaded.
     */
    ENGINE_UNAVAILABLE(true),

    /**
     * The reasoning engine refused the request (malformed prompt, auth, policy).
     */
    ENGINE_REJECTED(false),

    /**
     * The session exhausted its turn, tool invocation or time budget.
     */
    BUDGET_EXCEEDED(false),

    SESSION_NOT_FOUND(false),

    /**
     * The session already reached a terminal status and accepts no more input.
     */
    SESSION_TERMINATED(false),

    /**
     * The session was cancelled by the caller while a run was in flight.
     */
    CANCELLED(false),

    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
