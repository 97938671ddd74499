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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an {@link AgentSession} as driven by the agent loop.
 *
 * <pre>
 * PENDING → REASONING → (TOOL_EXECUTING → REASONING)* → COMPLETED | FAILED
 *                      ↘ AWAITING_INPUT → REASONING
 * </pre>
 *
 * Status only moves forward: terminal statuses never change, and a session
 * never returns to {@link #PENDING}.
 */
public enum SessionStatus {

    PENDING,
    REASONING,
    TOOL_EXECUTING,
    AWAITING_INPUT,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether the session is still open for processing (not terminal).
     */
    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(SessionStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<SessionStatus> allowedTargets() {
        return switch (this) {
        case PENDING -> EnumSet.of(REASONING, FAILED);
        case REASONING -> EnumSet.of(TOOL_EXECUTING, AWAITING_INPUT, COMPLETED, FAILED);
        case TOOL_EXECUTING -> EnumSet.of(REASONING, FAILED);
        case AWAITING_INPUT -> EnumSet.of(REASONING, FAILED);
        case COMPLETED, FAILED -> EnumSet.noneOf(SessionStatus.class);
        };
    }
}
