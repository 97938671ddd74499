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
 * Terminal reasoning engine failure, e.g. a malformed prompt or an
 * authentication error. Never retried.
 */
public class EngineRejectedException extends AgentException {

    private static final long serialVersionUID = 1L;

    public EngineRejectedException(String message) {
        super(ErrorKind.ENGINE_REJECTED, message);
    }

    public EngineRejectedException(String message, Throwable cause) {
        super(ErrorKind.ENGINE_REJECTED, message, cause);
    }
}
