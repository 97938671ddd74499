package me.golemcore.agent.domain.tool;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.DuplicateToolException;
import me.golemcore.agent.domain.exception.UnknownToolException;
import me.golemcore.agent.domain.model.ToolDescriptor;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed registry of tool descriptors and their executable components.
 *
 * <p>
 * Tools are registered at startup and looked up concurrently by every running
 * session. Names are unique: registering a taken name fails instead of
 * replacing the existing tool, and resolving a missing name fails instead of
 * falling back to a default.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, RegisteredTool> tools = new ConcurrentHashMap<>();

    public void register(ToolComponent component) {
        register(component.getDescriptor(), component);
    }

    public void register(ToolDescriptor descriptor, ToolComponent component) {
        if (descriptor == null || descriptor.getName() == null || descriptor.getName().isBlank()) {
            throw new IllegalArgumentException("Tool descriptor must have a name");
        }
        RegisteredTool registered = new RegisteredTool(descriptor, component);
        RegisteredTool existing = tools.putIfAbsent(descriptor.getName(), registered);
        if (existing != null) {
            throw new DuplicateToolException(descriptor.getName());
        }
        log.info("[Tools] Registered tool '{}' (idempotent={}, concurrencySafe={})", descriptor.getName(),
                descriptor.isIdempotent(), descriptor.isConcurrencySafe());
    }

    /**
     * @throws UnknownToolException
     *             if no tool with that name is registered
     */
    public RegisteredTool resolve(String name) {
        RegisteredTool tool = name != null ? tools.get(name) : null;
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        return tool;
    }

    /**
     * Resolves the tool and checks the arguments against its input schema.
     *
     * @throws UnknownToolException
     *             if the tool is not registered
     * @throws me.golemcore.agent.domain.exception.SchemaMismatchException
     *             naming the violated field
     */
    public RegisteredTool validate(String name, Map<String, Object> arguments) {
        RegisteredTool tool = resolve(name);
        ToolSchemaValidator.validate(name, tool.descriptor().getInputSchema(), arguments);
        return tool;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<ToolDescriptor> list() {
        return tools.values().stream()
                .map(RegisteredTool::descriptor)
                .sorted(Comparator.comparing(ToolDescriptor::getName))
                .toList();
    }

    public int size() {
        return tools.size();
    }

    /**
     * Descriptor plus executable capability, as stored in the registry.
     */
    public record RegisteredTool(ToolDescriptor descriptor, ToolComponent component) {
    }
}
