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

import java.time.Instant;
import java.util.List;

/**
 * One reasoning + action cycle of a session. Committed once, never rewritten.
 *
 * <p>
 * {@code memoryDeltas} holds the ordering indexes of the memory entries this
 * turn appended. {@code decision} is null when the turn failed before the
 * reasoning engine answered.
 */
@Value
@Builder
public class Turn {

    String id;
    int number;
    TurnInput input;
    Decision decision;

    @Singular
    List<ToolInvocation> toolInvocations;

    @Singular
    List<Long> memoryDeltas;

    AgentFailure failure;
    Instant startedAt;
    Instant completedAt;

    public static String idFor(String sessionId, int number) {
        return sessionId + "#" + number;
    }

    public boolean isFailed() {
        return failure != null;
    }
}
