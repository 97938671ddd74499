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
 * Thrown when tool call arguments violate the tool input schema, or a tool
 * result violates the declared output schema. Carries the path of the violated
 * field, for example {@code city} or {@code options.limit}; an empty path
 * means the value itself.
 */
public class SchemaMismatchException extends AgentException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final String field;
    private final String reason;

    public SchemaMismatchException(String toolName, String field, String reason) {
        this(toolName, field, reason, "Invalid arguments for tool " + toolName + ": " + describe(field) + " " + reason);
    }

    private SchemaMismatchException(String toolName, String field, String reason, String message) {
        super(ErrorKind.SCHEMA_MISMATCH, message);
        this.toolName = toolName;
        this.field = field;
        this.reason = reason;
    }

    /**
     * Reports a violation found in a tool result rather than in its arguments.
     */
    public static SchemaMismatchException forOutput(String toolName, String field, String reason) {
        return new SchemaMismatchException(toolName, field, reason,
                "Invalid output from tool " + toolName + ": " + describe(field) + " " + reason);
    }

    private static String describe(String field) {
        return field == null || field.isEmpty() ? "value" : "field '" + field + "'";
    }

    public String getToolName() {
        return toolName;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
