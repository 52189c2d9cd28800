package com.schemajenerator.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SchemaJeneratorError class.
 */
class SchemaJeneratorErrorTest {

    @Nested
    @DisplayName("Builder Tests")
    class BuilderTests {

        @Test
        @DisplayName("Factory methods should preset the error type")
        void factoryMethodsPresetType() {
            assertEquals(SchemaJeneratorError.ErrorType.VALIDATION, SchemaJeneratorError.validation().build().getErrorType());
            assertEquals(SchemaJeneratorError.ErrorType.PARSING, SchemaJeneratorError.parsing().build().getErrorType());
            assertEquals(SchemaJeneratorError.ErrorType.GENERATION, SchemaJeneratorError.generation().build().getErrorType());
            assertEquals(SchemaJeneratorError.ErrorType.CONFIGURATION, SchemaJeneratorError.configuration().build().getErrorType());
            assertEquals(SchemaJeneratorError.ErrorType.IO, SchemaJeneratorError.io().build().getErrorType());
            assertEquals(SchemaJeneratorError.ErrorType.INTERNAL, SchemaJeneratorError.internal().build().getErrorType());
        }

        @Test
        @DisplayName("Should store the code string, not the enum name")
        void shouldStoreCodeString() {
            SchemaJeneratorError error = SchemaJeneratorError.parsing()
                .errorCode(SchemaJeneratorError.ErrorCode.INVALID_JSON)
                .message("Invalid JSON: unexpected end of input")
                .build();

            assertEquals("PRS_001", error.getErrorCode());
            assertEquals("Invalid JSON: unexpected end of input", error.getMessage());
            assertNull(error.getContext());
        }
    }

    @Nested
    @DisplayName("Error Code Tests")
    class ErrorCodeTests {

        @Test
        @DisplayName("Codes should be unique")
        void codesShouldBeUnique() {
            Set<String> codes = new HashSet<>();
            Arrays.stream(SchemaJeneratorError.ErrorCode.values())
                .forEach(code -> assertTrue(codes.add(code.getCode()), "duplicate " + code.getCode()));
        }
    }

    @Nested
    @DisplayName("Serialization Tests")
    class SerializationTests {

        @Test
        @DisplayName("Should serialize without null fields")
        void shouldSerializeWithoutNullFields() throws Exception {
            SchemaJeneratorError error = SchemaJeneratorError.generation()
                .errorCode(SchemaJeneratorError.ErrorCode.NUMERIC_RANGE_OVERFLOW)
                .message("overflow")
                .context(new SchemaJeneratorError.ErrorContext("derive maximum", null, Map.of("bound", "x")))
                .build();

            JsonNode node = new ObjectMapper().valueToTree(error);

            assertEquals("GENERATION", node.get("errorType").asText());
            assertEquals("GEN_001", node.get("errorCode").asText());
            assertEquals("derive maximum", node.get("context").get("operation").asText());
            assertFalse(node.get("context").has("target"));
            assertEquals("x", node.get("context").get("details").get("bound").asText());
        }
    }
}
