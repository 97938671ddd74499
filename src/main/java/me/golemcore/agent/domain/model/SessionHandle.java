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

import java.util.concurrent.CompletableFuture;

/**
 * Returned by an asynchronous session start. The session id is available at
 * once; {@code result} completes when the first run stops. Cancelling
 * {@code result} cancels the session itself, exactly like
 * {@code cancelSession(sessionId)}.
 */
public record SessionHandle(String sessionId, CompletableFuture<TurnResult> result) {

    public boolean cancel() {
        return result.cancel(true);
    }
}
