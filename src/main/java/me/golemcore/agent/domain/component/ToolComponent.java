package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.ToolExecutionContext;
import me.golemcore.agent.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable tool that the reasoning engine can call. Tools expose their
 * descriptor (JSON Schema plus invocation contract) and implement the execution
 * logic. Every {@code ToolComponent} bean is registered in the
 * {@link me.golemcore.agent.domain.tool.ToolRegistry} at startup.
 */
public interface ToolComponent {

    /**
     * Returns the descriptor with the tool name, JSON Schema for input and
     * output, and the idempotency and concurrency contract.
     *
     * @return the tool descriptor
     */
    ToolDescriptor getDescriptor();

    /**
     * Executes the tool. Parameters are validated against the input schema
     * before this is called. The returned future may be cancelled (with
     * interruption) on timeout or session cancellation.
     *
     * @param context
     *            session, turn and attempt the call belongs to
     * @param parameters
     *            the validated arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ToolExecutionContext context, Map<String, Object> parameters);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDescriptor().getName();
    }

    /**
     * Disabled tools are skipped at registration.
     */
    default boolean isEnabled() {
        return true;
    }
}
