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
import lombok.Value;

/**
 * Caller-facing outcome of a session run. Callers only ever observe a final
 * answer, a prompt for more input, or a failure kind with its message;
 * intermediate retries are not surfaced.
 */
@Value
@Builder
public class TurnResult {

    String sessionId;
    SessionStatus status;
    String answer;
    String inputPrompt;
    AgentFailure failure;
    int turnCount;

    public static TurnResult of(AgentSession session) {
        return TurnResult.builder()
                .sessionId(session.getId())
                .status(session.getStatus())
                .answer(session.getAnswer())
                .inputPrompt(session.getInputPrompt())
                .failure(session.getFailure())
                .turnCount(session.getTurns().size())
                .build();
    }

    public boolean isCompleted() {
        return status == SessionStatus.COMPLETED;
    }

    public boolean isFailed() {
        return status == SessionStatus.FAILED;
    }
}
