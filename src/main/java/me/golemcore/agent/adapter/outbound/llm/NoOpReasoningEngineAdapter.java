package me.golemcore.agent.adapter.outbound.llm;

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
import me.golemcore.agent.domain.exception.EngineUnavailableException;
import me.golemcore.agent.domain.model.Decision;
import me.golemcore.agent.domain.model.ReasoningContext;
import me.golemcore.agent.port.outbound.ReasoningEnginePort;

/**
 * Placeholder engine wired when no langchain4j {@code ChatModel} bean is
 * available. Every call fails as unavailable, so sessions end in FAILED
 * instead of hanging.
 */
@Slf4j
public class NoOpReasoningEngineAdapter implements ReasoningEnginePort {

    public static final String ENGINE_ID = "none";

    @Override
    public String getEngineId() {
        return ENGINE_ID;
    }

    @Override
    public Decision decide(ReasoningContext context) {
        log.debug("[Engine] No reasoning engine configured, session {}", context.getSessionId());
        throw new EngineUnavailableException("No reasoning engine configured");
    }
}
