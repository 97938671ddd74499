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

import me.golemcore.agent.domain.exception.SchemaMismatchException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates tool arguments and tool results against the JSON Schema subset
 * tools declare: {@code type} (object, string, integer, number, boolean,
 * array), {@code properties}, {@code required}, {@code enum}, {@code items},
 * {@code additionalProperties: false}, {@code minimum}/{@code maximum} and
 * {@code minLength}/{@code maxLength}. Unknown keywords are ignored.
 *
 * <p>
 * Enum options match by value and type: the integer {@code 1} matches
 * {@code 1} or {@code 1.0} but not the string {@code "1"}.
 */
public final class ToolSchemaValidator {

    private static final String KEY_TYPE = "type";
    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";
    private static final String KEY_ENUM = "enum";
    private static final String KEY_ITEMS = "items";
    private static final String KEY_ADDITIONAL_PROPERTIES = "additionalProperties";
    private static final String KEY_MINIMUM = "minimum";
    private static final String KEY_MAXIMUM = "maximum";
    private static final String KEY_MIN_LENGTH = "minLength";
    private static final String KEY_MAX_LENGTH = "maxLength";

    private ToolSchemaValidator() {
    }

    /**
     * @throws SchemaMismatchException
     *             naming the first violated field
     */
    public static void validate(String toolName, Map<String, Object> schema, Map<String, Object> arguments) {
        if (schema == null || schema.isEmpty()) {
            return;
        }
        validateObject(toolName, "", schema, arguments != null ? arguments : Map.of());
    }

    /**
     * Validates a tool result value against the declared output schema. Unlike
     * arguments, the value is not assumed to be an object: the schema
     * {@code type} decides.
     *
     * @throws SchemaMismatchException
     *             reported as an output violation, naming the first violated
     *             field
     */
    public static void validateOutput(String toolName, Map<String, Object> schema, Object value) {
        if (schema == null || schema.isEmpty()) {
            return;
        }
        try {
            if (value == null) {
                throw new SchemaMismatchException(toolName, "", "is missing");
            }
            validateValue(toolName, "", schema, value);
        } catch (SchemaMismatchException e) {
            throw SchemaMismatchException.forOutput(toolName, e.getField(), e.getReason());
        }
    }

    @SuppressWarnings("unchecked")
    private static void validateObject(String toolName, String path, Map<String, Object> schema,
            Map<String, Object> value) {
        Map<String, Object> properties = schema.get(KEY_PROPERTIES) instanceof Map<?, ?> props
                ? (Map<String, Object>) props
                : Map.of();

        Object required = schema.get(KEY_REQUIRED);
        if (required instanceof Collection<?> requiredFields) {
            for (Object field : requiredFields) {
                String name = String.valueOf(field);
                if (value.get(name) == null) {
                    throw new SchemaMismatchException(toolName, join(path, name), "is required");
                }
            }
        }

        boolean closed = Boolean.FALSE.equals(schema.get(KEY_ADDITIONAL_PROPERTIES));
        for (Map.Entry<String, Object> entry : value.entrySet()) {
            String fieldPath = join(path, entry.getKey());
            Object propertySchema = properties.get(entry.getKey());
            if (propertySchema == null) {
                if (closed) {
                    throw new SchemaMismatchException(toolName, fieldPath, "is not allowed");
                }
                continue;
            }
            if (entry.getValue() != null && propertySchema instanceof Map<?, ?> nested) {
                validateValue(toolName, fieldPath, (Map<String, Object>) nested, entry.getValue());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static void validateValue(String toolName, String path, Map<String, Object> schema, Object value) {
        Object enumValues = schema.get(KEY_ENUM);
        if (enumValues instanceof List<?> allowed && !allowed.isEmpty()
                && allowed.stream().noneMatch(option -> sameValue(option, value))) {
            throw new SchemaMismatchException(toolName, path, "must be one of " + allowed);
        }
        checkBounds(toolName, path, schema, value);

        Object type = schema.get(KEY_TYPE);
        if (type == null) {
            return;
        }
        switch (String.valueOf(type)) {
        case "string" -> require(value instanceof String, toolName, path, "string");
        case "integer" -> require(isInteger(value), toolName, path, "integer");
        case "number" -> require(value instanceof Number, toolName, path, "number");
        case "boolean" -> require(value instanceof Boolean, toolName, path, "boolean");
        case "array" -> {
            require(value instanceof List<?>, toolName, path, "array");
            Object items = schema.get(KEY_ITEMS);
            if (items instanceof Map<?, ?> itemSchema) {
                List<?> list = (List<?>) value;
                for (int i = 0; i < list.size(); i++) {
                    if (list.get(i) != null) {
                        validateValue(toolName, path + "[" + i + "]", (Map<String, Object>) itemSchema, list.get(i));
                    }
                }
            }
        }
        case "object" -> {
            require(value instanceof Map<?, ?>, toolName, path, "object");
            validateObject(toolName, path, schema, (Map<String, Object>) value);
        }
        default -> {
            // Unknown types are not enforced
        }
        }
    }

    private static void checkBounds(String toolName, String path, Map<String, Object> schema, Object value) {
        if (value instanceof Number number && isFinite(number)) {
            BigDecimal decimal = toDecimal(number);
            if (schema.get(KEY_MINIMUM) instanceof Number minimum && decimal.compareTo(toDecimal(minimum)) < 0) {
                throw new SchemaMismatchException(toolName, path, "must be >= " + minimum);
            }
            if (schema.get(KEY_MAXIMUM) instanceof Number maximum && decimal.compareTo(toDecimal(maximum)) > 0) {
                throw new SchemaMismatchException(toolName, path, "must be <= " + maximum);
            }
        } else if (value instanceof String text) {
            int length = text.codePointCount(0, text.length());
            if (schema.get(KEY_MIN_LENGTH) instanceof Number minLength && length < minLength.intValue()) {
                throw new SchemaMismatchException(toolName, path, "must be at least " + minLength + " characters");
            }
            if (schema.get(KEY_MAX_LENGTH) instanceof Number maxLength && length > maxLength.intValue()) {
                throw new SchemaMismatchException(toolName, path, "must be at most " + maxLength + " characters");
            }
        }
    }

    private static boolean sameValue(Object option, Object value) {
        if (option instanceof Number left && value instanceof Number right && isFinite(left) && isFinite(right)) {
            return toDecimal(left).compareTo(toDecimal(right)) == 0;
        }
        return Objects.equals(option, value);
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }

    private static boolean isInteger(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            return !Double.isInfinite(number) && number == Math.rint(number);
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private static void require(boolean condition, String toolName, String path, String expectedType) {
        if (!condition) {
            throw new SchemaMismatchException(toolName, path, "must be of type " + expectedType);
        }
    }

    private static String join(String path, String field) {
        return path.isEmpty() ? field : path + "." + field;
    }
}
