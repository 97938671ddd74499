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

import me.golemcore.agent.domain.exception.AgentException;

/**
 * Recorded failure: error kind plus a human-readable message. Stored on turns,
 * tool invocations and sessions, and returned to callers in
 * {@link TurnResult}.
 */
public record AgentFailure(ErrorKind kind, String message) {

    public static AgentFailure of(ErrorKind kind, String message) {
        return new AgentFailure(kind, message);
    }

    public static AgentFailure from(AgentException exception) {
        return new AgentFailure(exception.getKind(), exception.getMessage());
    }

    /**
     * Renders the failure the way it is written to memory: "[KIND] message".
     */
    public String describe() {
        if (message == null || message.isBlank()) {
            return "[" + kind + "]";
        }
        return "[" + kind + "] " + message;
    }
}
