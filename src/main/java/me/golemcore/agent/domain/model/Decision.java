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

import java.util.List;
import java.util.Objects;

/**
 * What the reasoning engine decided for one turn. Exactly one of: a final
 * answer, a batch of tool calls, or a request for more caller input.
 */
public sealed interface Decision permits Decision.FinalAnswer, Decision.ToolRequests, Decision.NeedsInput {

    static Decision finalAnswer(String text) {
        return new FinalAnswer(text);
    }

    static Decision toolRequests(List<ToolCall> calls) {
        return new ToolRequests(calls);
    }

    static Decision needsInput(String prompt) {
        return new NeedsInput(prompt);
    }

    record FinalAnswer(String text) implements Decision {
    }

    record ToolRequests(List<ToolCall> calls) implements Decision {

        public ToolRequests {
            Objects.requireNonNull(calls, "calls");
            if (calls.isEmpty()) {
                throw new IllegalArgumentException("ToolRequests needs at least one call");
            }
            calls = List.copyOf(calls);
        }
    }

    record NeedsInput(String prompt) implements Decision {
    }
}
