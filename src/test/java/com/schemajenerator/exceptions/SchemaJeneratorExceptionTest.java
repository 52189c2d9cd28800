package com.schemajenerator.exceptions;

import com.schemajenerator.models.SchemaJeneratorError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SchemaJeneratorException class.
 */
class SchemaJeneratorExceptionTest {

    private SchemaJeneratorError error;
    private SchemaJeneratorException exception;

    @BeforeEach
    void setUp() {
        SchemaJeneratorError.ErrorContext context = new SchemaJeneratorError.ErrorContext(
            "read input",
            "data.json",
            Map.of("attempt", 1)
        );

        error = SchemaJeneratorError.resourceNotFound()
            .errorCode(SchemaJeneratorError.ErrorCode.FILE_NOT_FOUND)
            .message("File not found: data.json")
            .context(context)
            .build();
    }

    @Nested
    @DisplayName("Constructor Tests")
    class ConstructorTests {

        @Test
        @DisplayName("Should create exception with error only")
        void shouldCreateExceptionWithErrorOnly() {
            exception = new SchemaJeneratorException(error);

            assertEquals(error, exception.getErr());
            assertEquals("File not found: data.json", exception.getMessage());
            assertNull(exception.getCause());
        }

        @Test
        @DisplayName("Should create exception with error and cause")
        void shouldCreateExceptionWithErrorAndCause() {
            RuntimeException cause = new RuntimeException("Root cause");
            exception = new SchemaJeneratorException(error, cause);

            assertEquals(error, exception.getErr());
            assertEquals(cause, exception.getCause());
        }
    }

    @Nested
    @DisplayName("Getter Tests")
    class GetterTests {

        @BeforeEach
        void setUp() {
            exception = new SchemaJeneratorException(error);
        }

        @Test
        @DisplayName("Should expose type and code")
        void shouldExposeTypeAndCode() {
            assertEquals(SchemaJeneratorError.ErrorType.RESOURCE_NOT_FOUND, exception.getErrorType());
            assertEquals("RNF_001", exception.getErrorCode());
        }

        @Test
        @DisplayName("Should classify the error type")
        void shouldClassifyErrorType() {
            assertTrue(exception.isResourceNotFoundError());
            assertFalse(exception.isValidationError());
            assertFalse(exception.isGenerationError());
        }
    }

    @Nested
    @DisplayName("Factory Method Tests")
    class FactoryMethodTests {

        @Test
        @DisplayName("Should wrap unexpected exceptions as internal errors")
        void shouldWrapUnexpectedException() {
            IllegalStateException cause = new IllegalStateException("boom");
            exception = SchemaJeneratorException.fromException(cause, "generate", "in.json");

            assertEquals(SchemaJeneratorError.ErrorType.INTERNAL, exception.getErrorType());
            assertEquals(SchemaJeneratorError.ErrorCode.UNEXPECTED_ERROR.getCode(), exception.getErrorCode());
            assertEquals("Unexpected error occurred: boom", exception.getMessage());
            assertEquals(cause, exception.getCause());
            assertEquals("IllegalStateException", exception.getErr().getContext().getDetails().get("exceptionType"));
        }
    }

    @Test
    @DisplayName("toString should name type, code and message")
    void toStringNamesTypeCodeAndMessage() {
        exception = new SchemaJeneratorException(error);
        String text = exception.toString();

        assertTrue(text.contains("RESOURCE_NOT_FOUND"));
        assertTrue(text.contains("RNF_001"));
        assertTrue(text.contains("File not found: data.json"));
    }
}
