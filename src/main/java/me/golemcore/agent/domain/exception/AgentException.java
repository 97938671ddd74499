package me.golemcore.agent.domain.exception;

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

import me.golemcore.agent.domain.model.ErrorKind;

/**
 * Base of the orchestrator's error hierarchy. Every subclass pins one
 * {@link ErrorKind}, so recovery paths switch on the kind instead of on
 * exception messages.
 */
public class AgentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public AgentException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
