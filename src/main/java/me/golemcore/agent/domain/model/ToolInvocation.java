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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable record of one tool call within a turn: validated arguments, the
 * final result or error, total latency and every attempt made.
 */
@Value
@Builder
public class ToolInvocation {

    String callId;
    String toolName;
    Map<String, Object> arguments;
    ToolResult result;
    AgentFailure failure;
    long latencyMs;

    @Singular
    List<ToolAttempt> attempts;

    public boolean isSuccess() {
        return failure == null && result != null && result.isSuccess();
    }

    public int getAttemptCount() {
        return attempts.size();
    }

    /**
     * Content folded into memory and the next reasoning call.
     */
    public String toMemoryValue() {
        if (failure != null) {
            return "Error: " + failure.describe();
        }
        if (result == null) {
            return "Error: no result";
        }
        if (result.isSuccess()) {
            return result.getOutput() != null ? result.getOutput() : "";
        }
        return "Error: " + result.getError();
    }
}
