package com.schemajenerator.exceptions;

import com.schemajenerator.models.SchemaJeneratorError;

import java.util.Map;

/**
 * Checked exception that carries structured error information.
 * This exception wraps a {@link SchemaJeneratorError} object whose message is
 * the user-facing text printed by the command line front end.
 */
public class SchemaJeneratorException extends Exception {

    private final SchemaJeneratorError err;

    /**
     * Creates a new SchemaJeneratorException with structured error information.
     *
     * @param err The detailed error information
     */
    public SchemaJeneratorException(SchemaJeneratorError err) {
        super(err.getMessage());
        this.err = err;
    }

    /**
     * Creates a new SchemaJeneratorException with structured error information
     * and a cause.
     *
     * @param structuredError The detailed error information
     * @param cause           The underlying exception that caused this error
     */
    public SchemaJeneratorException(SchemaJeneratorError structuredError, Throwable cause) {
        super(structuredError.getMessage(), cause);
        this.err = structuredError;
    }

    /**
     * Gets the structured error information.
     *
     * @return The detailed error information
     */
    public SchemaJeneratorError getErr() {
        return err;
    }

    /**
     * Gets the error type from the structured error.
     *
     * @return The error type
     */
    public SchemaJeneratorError.ErrorType getErrorType() {
        return err.getErrorType();
    }

    /**
     * Gets the error code from the structured error.
     *
     * @return The error code string
     */
    public String getErrorCode() {
        return err.getErrorCode();
    }

    public boolean isValidationError() {
        return (err.getErrorType() == SchemaJeneratorError.ErrorType.VALIDATION);
    }

    public boolean isResourceNotFoundError() {
        return (
            err.getErrorType() == SchemaJeneratorError.ErrorType.RESOURCE_NOT_FOUND
        );
    }

    public boolean isGenerationError() {
        return (err.getErrorType() == SchemaJeneratorError.ErrorType.GENERATION);
    }

    /**
     * Creates a SchemaJeneratorException from a regular exception with minimal
     * error information. This is useful for wrapping unexpected exceptions that
     * don't have structured error details.
     *
     * @param cause     The original exception
     * @param operation The operation that was being performed
     * @param target    What the operation was applied to, may be null
     * @return A new SchemaJeneratorException with basic error information
     */
    public static SchemaJeneratorException fromException(
        Throwable cause,
        String operation,
        String target
    ) {
        SchemaJeneratorError error = SchemaJeneratorError.internal()
            .errorCode(SchemaJeneratorError.ErrorCode.UNEXPECTED_ERROR)
            .message("Unexpected error occurred: " + cause.getMessage())
            .context(
                new SchemaJeneratorError.ErrorContext(
                    operation,
                    target,
                    Map.of("exceptionType", cause.getClass().getSimpleName())
                )
            )
            .build();

        return new SchemaJeneratorException(error, cause);
    }

    @Override
    public String toString() {
        return (
            "SchemaJeneratorException{" +
            "errorType=" +
            err.getErrorType() +
            ", errorCode='" +
            err.getErrorCode() +
            '\'' +
            ", message='" +
            getMessage() +
            '\'' +
            '}'
        );
    }
}
