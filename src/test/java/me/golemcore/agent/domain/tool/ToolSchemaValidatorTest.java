package me.golemcore.agent.domain.tool;

import me.golemcore.agent.domain.exception.SchemaMismatchException;
import me.golemcore.agent.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolSchemaValidatorTest {

    private static final Map<String, Object> WEATHER_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "city", Map.of("type", "string"),
                    "days", Map.of("type", "integer"),
                    "units", Map.of("type", "string", "enum", List.of("metric", "imperial")),
                    "options", Map.of(
                            "type", "object",
                            "properties", Map.of("limit", Map.of("type", "number"))),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string"))),
            "required", List.of("city"),
            "additionalProperties", false);

    @Test
    void shouldAcceptValidArguments() {
        assertDoesNotThrow(() -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA, Map.of(
                "city", "Berlin",
                "days", 3,
                "units", "metric",
                "options", Map.of("limit", 2.5),
                "tags", List.of("a", "b"))));
    }

    @Test
    void shouldRejectMissingRequiredField() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA, Map.of("days", 1)));

        assertEquals("city", error.getField());
        assertEquals("weather", error.getToolName());
        assertEquals(ErrorKind.SCHEMA_MISMATCH, error.getKind());
        assertTrue(error.getMessage().contains("'city'"));
    }

    @Test
    void shouldTreatNullArgumentsAsEmpty() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA, null));

        assertEquals("city", error.getField());
    }

    @Test
    void shouldRejectWrongType() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA, Map.of("city", 42)));

        assertEquals("city", error.getField());
        assertTrue(error.getMessage().contains("string"));
    }

    @Test
    void shouldAcceptIntegralDoubleAsInteger() {
        assertDoesNotThrow(() -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA,
                Map.of("city", "Oslo", "days", 2.0)));
    }

    @Test
    void shouldRejectFractionalNumberAsInteger() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA, Map.of("city", "Oslo", "days", 2.5)));

        assertEquals("days", error.getField());
    }

    @Test
    void shouldRejectValueOutsideEnum() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA,
                        Map.of("city", "Oslo", "units", "kelvin")));

        assertEquals("units", error.getField());
    }

    @Test
    void shouldNameNestedFieldPath() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA,
                        Map.of("city", "Oslo", "options", Map.of("limit", "ten"))));

        assertEquals("options.limit", error.getField());
    }

    @Test
    void shouldNameArrayItemPath() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA,
                        Map.of("city", "Oslo", "tags", List.of("ok", 7))));

        assertEquals("tags[1]", error.getField());
    }

    @Test
    void shouldRejectUnknownFieldWhenClosed() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("weather", WEATHER_SCHEMA,
                        Map.of("city", "Oslo", "country", "NO")));

        assertEquals("country", error.getField());
    }

    @Test
    void shouldAllowUnknownFieldWhenOpen() {
        Map<String, Object> openSchema = Map.of(
                "type", "object",
                "properties", Map.of("city", Map.of("type", "string")));

        assertDoesNotThrow(() -> ToolSchemaValidator.validate("weather", openSchema,
                Map.of("city", "Oslo", "country", "NO")));
    }

    @Test
    void shouldCompareEnumOptionsByTypedValue() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "level", Map.of("enum", List.of("1", "2")),
                        "size", Map.of("enum", List.of(1, 2))));

        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("levels", schema, Map.of("level", 1)));
        assertEquals("level", error.getField());

        assertDoesNotThrow(() -> ToolSchemaValidator.validate("levels", schema, Map.of("level", "1")));
        assertDoesNotThrow(() -> ToolSchemaValidator.validate("levels", schema, Map.of("size", 2L)));
        assertDoesNotThrow(() -> ToolSchemaValidator.validate("levels", schema, Map.of("size", 2.0)));
        assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("levels", schema, Map.of("size", "2")));
    }

    @Test
    void shouldEnforceNumericBounds() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("days", Map.of("type", "integer", "minimum", 1, "maximum", 14)));

        assertDoesNotThrow(() -> ToolSchemaValidator.validate("forecast", schema, Map.of("days", 14)));
        SchemaMismatchException tooLow = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("forecast", schema, Map.of("days", 0)));
        assertTrue(tooLow.getMessage().contains(">= 1"));
        SchemaMismatchException tooHigh = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("forecast", schema, Map.of("days", 15.0)));
        assertEquals("days", tooHigh.getField());
    }

    @Test
    void shouldEnforceStringLengthBounds() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("code", Map.of("type", "string", "minLength", 2, "maxLength", 3)));

        assertDoesNotThrow(() -> ToolSchemaValidator.validate("country", schema, Map.of("code", "NO")));
        assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("country", schema, Map.of("code", "N")));
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validate("country", schema, Map.of("code", "NORW")));
        assertTrue(error.getMessage().contains("at most 3"));
    }

    @Test
    void shouldReportOutputViolationsAgainstTheResult() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("score", Map.of("type", "number")),
                "required", List.of("score"));

        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validateOutput("rank", schema, Map.of("score", "high")));

        assertEquals("score", error.getField());
        assertEquals(ErrorKind.SCHEMA_MISMATCH, error.getKind());
        assertTrue(error.getMessage().startsWith("Invalid output from tool rank"));
    }

    @Test
    void shouldValidateScalarOutputValue() {
        SchemaMismatchException error = assertThrows(SchemaMismatchException.class,
                () -> ToolSchemaValidator.validateOutput("count", Map.of("type", "integer"), "three"));

        assertEquals("", error.getField());
        assertTrue(error.getMessage().contains("value must be of type integer"));
        assertDoesNotThrow(() -> ToolSchemaValidator.validateOutput("count", Map.of("type", "integer"), 3));
        assertDoesNotThrow(() -> ToolSchemaValidator.validateOutput("count", Map.of(), null));
    }

    @Test
    void shouldSkipValidationWithoutSchema() {
        assertDoesNotThrow(() -> ToolSchemaValidator.validate("any", Map.of(), Map.of("x", 1)));
        assertDoesNotThrow(() -> ToolSchemaValidator.validate("any", null, Map.of("x", 1)));
    }
}
