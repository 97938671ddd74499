package me.golemcore.agent.port.inbound;

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

import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.SessionHandle;
import me.golemcore.agent.domain.model.SessionStatus;
import me.golemcore.agent.domain.model.TurnResult;

/**
 * Call surface served to the API gateway (or any other caller). All methods
 * throw {@link me.golemcore.agent.domain.exception.SessionNotFoundException}
 * for unknown session ids.
 */
public interface AgentSessionPort {

    /**
     * Creates a session and runs it until it completes, fails, or needs more
     * input.
     *
     * @return the new session id
     */
    String startSession(String initialInput);

    /**
     * Same as {@link #startSession(String)} but runs on the session executor.
     * The returned handle carries the session id immediately; cancelling its
     * result future cancels the session.
     */
    SessionHandle startSessionAsync(String initialInput);

    /**
     * Feeds new input into a session that is waiting for it and runs the loop
     * again.
     *
     * @throws me.golemcore.agent.domain.exception.SessionTerminatedException
     *             if the session already completed or failed
     */
    TurnResult continueSession(String sessionId, String input);

    SessionStatus getStatus(String sessionId);

    TurnResult getResult(String sessionId);

    AgentSession getSession(String sessionId);

    /**
     * Signals cancellation. In-flight tool calls and the pending reasoning call
     * are interrupted and the session fails with
     * {@link me.golemcore.agent.domain.model.ErrorKind#CANCELLED}.
     */
    void cancelSession(String sessionId);

    /**
     * Destroys the session and its memory.
     */
    void closeSession(String sessionId);
}
