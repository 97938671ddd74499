package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the agent, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link LoopProperties} - turn budgets, deadline, context window</li>
 * <li>{@link EngineProperties} - reasoning call timeout and retry policy</li>
 * <li>{@link ToolProperties} - default tool timeout and retry policy</li>
 * <li>{@link MemoryProperties} - memory store selection and location</li>
 * <li>{@link SessionProperties} - session TTL and runner threads</li>
 * </ul>
 *
 * <p>
 * Retry and backoff parameters are configuration surfaces; the defaults are
 * conservative starting points, not tuned values.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private LoopProperties loop = new LoopProperties();
    private EngineProperties engine = new EngineProperties();
    private ToolProperties tools = new ToolProperties();
    private MemoryProperties memory = new MemoryProperties();
    private SessionProperties session = new SessionProperties();

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        /** Max turns a session may record before failing with BUDGET_EXCEEDED. */
        private int maxTurns = 20;

        /** Max tool invocations across the whole session. */
        private int maxToolInvocations = 100;

        /** Wall-clock budget of one run (start or continue). Zero disables it. */
        private Duration deadline = Duration.ofMinutes(10);

        /**
         * If true, the first terminal tool error fails the session. If false, the
         * error is written to memory and folded into the next reasoning call.
         */
        private boolean stopOnToolFailure = true;

        /** Number of newest memory entries passed to the reasoning engine. */
        private int contextWindowEntries = 50;

        /** Token budget for the context window. Zero means entry count only. */
        private int contextTokenBudget = 0;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        /** Total attempts including the first one. */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private double multiplier = 2.0;

        private Duration maxBackoff = Duration.ofSeconds(5);
    }

    // ==================== ENGINE ====================

    @Data
    public static class EngineProperties {
        private Duration timeout = Duration.ofSeconds(60);
        private RetryProperties retry = new RetryProperties();

        /** System prompt sent ahead of the memory window by the langchain4j bridge. */
        private String systemPrompt = "You are an agent. Use the available tools when they help. "
                + "When you cannot continue without more information from the user, "
                + "ask your question and end the message with [needs-input].";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolProperties {
        /** Timeout for tools whose descriptor does not declare one. */
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private RetryProperties retry = new RetryProperties();
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /** "in-memory" or "jsonl". */
        private String store = "in-memory";
        private String basePath = "${user.home}/.golemcore/agent/memory";
    }

    // ==================== SESSION ====================

    @Data
    public static class SessionProperties {
        /** Idle time after which a session is closed. Zero disables expiry. */
        private Duration ttl = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofMinutes(1);

        /** Threads used by startSessionAsync. */
        private int runnerThreads = 4;
    }
}
