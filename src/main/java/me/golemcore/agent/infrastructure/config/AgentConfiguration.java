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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.outbound.llm.Langchain4jReasoningEngineAdapter;
import me.golemcore.agent.adapter.outbound.llm.NoOpReasoningEngineAdapter;
import me.golemcore.agent.adapter.outbound.memory.InMemoryMemoryStore;
import me.golemcore.agent.adapter.outbound.memory.JsonlMemoryStore;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.loop.AgentLoop;
import me.golemcore.agent.domain.loop.ContextWindowBuilder;
import me.golemcore.agent.domain.service.AgentSessionService;
import me.golemcore.agent.domain.service.SessionExpirySweeper;
import me.golemcore.agent.domain.service.SessionRegistry;
import me.golemcore.agent.domain.tool.ToolDispatcher;
import me.golemcore.agent.domain.tool.ToolInvoker;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.port.outbound.MemoryStorePort;
import me.golemcore.agent.port.outbound.ReasoningEnginePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the agent loop: executors, memory store and reasoning engine
 * selection, tool registration, and the session surface.
 */
@Configuration
@Slf4j
public class AgentConfiguration {

    static final String MEMORY_STORE_JSONL = "jsonl";
    static final String MEMORY_STORE_IN_MEMORY = "in-memory";

    /**
     * Runs parallel tool lanes. A lane blocks its thread for the whole lane, so
     * the pool grows with demand instead of queueing lanes behind each other.
     */
    @Bean(name = "agentToolExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentToolExecutor() {
        return Executors.newCachedThreadPool(namedThreads("agent-tool"));
    }

    /**
     * Runs reasoning calls, kept apart from tool lanes so long tools in one
     * session never delay another session's engine call.
     */
    @Bean(name = "agentEngineExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentEngineExecutor() {
        return Executors.newCachedThreadPool(namedThreads("agent-engine"));
    }

    @Bean(name = "agentSessionRunner", destroyMethod = "shutdownNow")
    public ExecutorService agentSessionRunner(AgentProperties properties) {
        int threads = Math.max(1, properties.getSession().getRunnerThreads());
        return Executors.newFixedThreadPool(threads, namedThreads("agent-session"));
    }

    @Bean
    public MemoryStorePort memoryStore(AgentProperties properties, ObjectMapper objectMapper) {
        String store = properties.getMemory().getStore();
        if (MEMORY_STORE_JSONL.equalsIgnoreCase(store)) {
            return new JsonlMemoryStore(properties.getMemory().getBasePath(), objectMapper);
        }
        if (store != null && !MEMORY_STORE_IN_MEMORY.equalsIgnoreCase(store)) {
            log.warn("[Memory] Unknown memory store '{}', falling back to {}", store, MEMORY_STORE_IN_MEMORY);
        }
        return new InMemoryMemoryStore();
    }

    @Bean
    public ReasoningEnginePort reasoningEngine(ObjectProvider<ChatModel> chatModelProvider,
            ObjectMapper objectMapper, AgentProperties properties) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            log.warn("[Engine] No ChatModel bean found, reasoning calls will fail as ENGINE_UNAVAILABLE");
            return new NoOpReasoningEngineAdapter();
        }
        return new Langchain4jReasoningEngineAdapter(chatModel, objectMapper,
                properties.getEngine().getSystemPrompt());
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> toolComponents) {
        ToolRegistry registry = new ToolRegistry();
        for (ToolComponent component : toolComponents) {
            if (component.isEnabled()) {
                registry.register(component);
            } else {
                log.info("[Tools] Skipping disabled tool: {}", component.getToolName());
            }
        }
        return registry;
    }

    @Bean
    public ToolInvoker toolInvoker(AgentProperties properties, Clock clock) {
        return new ToolInvoker(properties.getTools(), clock);
    }

    @Bean
    public ToolDispatcher toolDispatcher(ToolInvoker toolInvoker,
            @Qualifier("agentToolExecutor") ExecutorService agentToolExecutor) {
        return new ToolDispatcher(toolInvoker, agentToolExecutor);
    }

    @Bean
    public ContextWindowBuilder contextWindowBuilder(MemoryStorePort memoryStore, ToolRegistry toolRegistry,
            AgentProperties properties) {
        return new ContextWindowBuilder(memoryStore, toolRegistry,
                properties.getLoop().getContextWindowEntries(), properties.getLoop().getContextTokenBudget());
    }

    @Bean
    public AgentLoop agentLoop(ReasoningEnginePort reasoningEngine, MemoryStorePort memoryStore,
            ToolRegistry toolRegistry, ToolDispatcher toolDispatcher, ContextWindowBuilder contextWindowBuilder,
            @Qualifier("agentEngineExecutor") ExecutorService agentEngineExecutor, AgentProperties properties,
            Clock clock) {
        return new AgentLoop(reasoningEngine, memoryStore, toolRegistry, toolDispatcher, contextWindowBuilder,
                agentEngineExecutor, properties.getEngine(), properties.getLoop(), clock);
    }

    @Bean
    public SessionRegistry sessionRegistry(Clock clock) {
        return new SessionRegistry(clock);
    }

    @Bean
    public AgentSessionService agentSessionService(SessionRegistry sessionRegistry, AgentLoop agentLoop,
            MemoryStorePort memoryStore, @Qualifier("agentSessionRunner") ExecutorService agentSessionRunner) {
        return new AgentSessionService(sessionRegistry, agentLoop, memoryStore, agentSessionRunner);
    }

    @Bean
    public SessionExpirySweeper sessionExpirySweeper(SessionRegistry sessionRegistry,
            AgentSessionService agentSessionService, AgentProperties properties, Clock clock) {
        return new SessionExpirySweeper(sessionRegistry, agentSessionService, properties.getSession(), clock);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
