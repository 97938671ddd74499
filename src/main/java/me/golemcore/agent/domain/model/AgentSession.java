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

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One end-to-end agent interaction with a caller. Owned by the agent loop:
 * only the loop appends turns and moves the status, and it does so while
 * holding {@link #getRunLock()}.
 *
 * <p>
 * Turns are append-only and the status only moves forward (see
 * {@link SessionStatus}); once terminal, the session never changes again.
 */
@Getter
public class AgentSession {

    private final String id;
    private final Instant createdAt;
    private final ReentrantLock runLock = new ReentrantLock();
    private final CancellationToken cancellationToken = new CancellationToken();

    private final List<Turn> turns = new ArrayList<>();
    private volatile SessionStatus status = SessionStatus.PENDING;
    private volatile Instant updatedAt;
    private int toolInvocationCount;
    private String answer;
    private String inputPrompt;
    private AgentFailure failure;

    public AgentSession(String id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public synchronized List<Turn> getTurns() {
        return Collections.unmodifiableList(new ArrayList<>(turns));
    }

    public synchronized int nextTurnNumber() {
        return turns.size() + 1;
    }

    public synchronized void appendTurn(Turn turn, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session " + id + " is " + status + ", turns are frozen");
        }
        turns.add(turn);
        toolInvocationCount += turn.getToolInvocations().size();
        updatedAt = now;
    }

    public synchronized void transitionTo(SessionStatus target, Instant now) {
        if (status == target) {
            return;
        }
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Illegal session transition " + status + " -> " + target
                    + " for session " + id);
        }
        status = target;
        updatedAt = now;
    }

    public synchronized void complete(String finalAnswer, Instant now) {
        transitionTo(SessionStatus.COMPLETED, now);
        this.answer = finalAnswer;
        this.inputPrompt = null;
    }

    public synchronized void awaitInput(String prompt, Instant now) {
        transitionTo(SessionStatus.AWAITING_INPUT, now);
        this.inputPrompt = prompt;
    }

    public synchronized void fail(AgentFailure sessionFailure, Instant now) {
        transitionTo(SessionStatus.FAILED, now);
        this.failure = sessionFailure;
        this.inputPrompt = null;
    }

    public synchronized int getToolInvocationCount() {
        return toolInvocationCount;
    }

    public synchronized String getAnswer() {
        return answer;
    }

    public synchronized String getInputPrompt() {
        return inputPrompt;
    }

    public synchronized AgentFailure getFailure() {
        return failure;
    }
}
