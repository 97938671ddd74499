package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.exception.EngineRejectedException;
import me.golemcore.agent.domain.exception.EngineUnavailableException;
import me.golemcore.agent.domain.model.Decision;
import me.golemcore.agent.domain.model.ReasoningContext;

/**
 * Port isolating the agent loop from any specific reasoning backend (an LLM
 * provider, a rules engine, a test stub).
 */
public interface ReasoningEnginePort {

    /**
     * Returns the engine identifier used in logs (e.g., "langchain4j", "noop").
     */
    String getEngineId();

    /**
     * Decides the next step for one turn. Called from the loop's worker threads,
     * implementations must be safe for concurrent use across sessions.
     *
     * @param context
     *            bounded memory window, available tools and the turn input
     * @return final answer, tool requests, or a request for more input
     * @throws EngineUnavailableException
     *             on transient failures; the loop retries with backoff
     * @throws EngineRejectedException
     *             when the request can never succeed; the session fails
     */
    Decision decide(ReasoningContext context);
}
