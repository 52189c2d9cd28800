package com.schemajenerator.models;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Structured error information for schema generation and its surrounding
 * command line pipeline.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "errorType", "errorCode", "message", "context" })
public class SchemaJeneratorError {

	private final ErrorType errorType;
	private final String errorCode;
	private final String message;
	private final ErrorContext context;

	/**
	 * Categories of errors.
	 */
	public enum ErrorType {
		/** Invalid arguments or a produced schema rejected by the meta-schema */
		VALIDATION,

		/** Input files that do not exist */
		RESOURCE_NOT_FOUND,

		/** Input text that is not well-formed JSON */
		PARSING,

		/** Failures inside the schema inference itself */
		GENERATION,

		/** Unreadable or malformed configuration files */
		CONFIGURATION,

		/** Read or write failures */
		IO,

		/** Unexpected errors, system failures */
		INTERNAL
	}

	/**
	 * Specific error subcategories for programmatic handling.
	 */
	public enum ErrorCode {
		// Validation errors
		MISSING_INPUT("VAL_001"),
		INVALID_GLOB_PATTERN("VAL_002"),
		META_SCHEMA_VALIDATION_FAILED("VAL_003"),
		INSTANCE_VALIDATION_FAILED("VAL_004"),

		// Resource not found errors
		FILE_NOT_FOUND("RNF_001"),

		// Parsing errors
		INVALID_JSON("PRS_001"),

		// Generation errors
		NUMERIC_RANGE_OVERFLOW("GEN_001"),
		UNSUPPORTED_NODE_TYPE("GEN_002"),

		// Configuration errors
		CONFIGURATION_ERROR("CFG_001"),

		// IO errors
		IO_FAILED("IO_001"),

		// Internal errors
		SERIALIZATION_FAILED("INT_001"),
		UNEXPECTED_ERROR("INT_002");

		private final String code;

		ErrorCode(String code) {
			this.code = code;
		}

		public String getCode() {
			return code;
		}
	}

	/**
	 * Context information about what was being attempted when the error occurred.
	 */
	@JsonInclude(JsonInclude.Include.NON_NULL)
	@JsonPropertyOrder({ "operation", "target", "details" })
	public static class ErrorContext {
		private final String operation;
		private final String target;
		private final Map<String, Object> details;

		public ErrorContext(String operation, String target, Map<String, Object> details) {
			this.operation = operation;
			this.target = target;
			this.details = details;
		}

		@JsonProperty("operation")
		public String getOperation() {
			return operation;
		}

		@JsonProperty("target")
		public String getTarget() {
			return target;
		}

		@JsonProperty("details")
		public Map<String, Object> getDetails() {
			return details;
		}
	}

	public SchemaJeneratorError(ErrorType errorType, String errorCode, String message, ErrorContext context) {
		this.errorType = errorType;
		this.errorCode = errorCode;
		this.message = message;
		this.context = context;
	}

	@JsonProperty("errorType")
	public ErrorType getErrorType() {
		return errorType;
	}

	@JsonProperty("errorCode")
	public String getErrorCode() {
		return errorCode;
	}

	@JsonProperty("message")
	public String getMessage() {
		return message;
	}

	@JsonProperty("context")
	public ErrorContext getContext() {
		return context;
	}

	// Builder class for easy construction
	public static class Builder {
		private ErrorType errorType;
		private ErrorCode errorCode;
		private String message;
		private ErrorContext context;

		public Builder errorType(ErrorType errorType) {
			this.errorType = errorType;
			return this;
		}

		public Builder errorCode(ErrorCode errorCode) {
			this.errorCode = errorCode;
			return this;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder context(ErrorContext context) {
			this.context = context;
			return this;
		}

		public SchemaJeneratorError build() {
			return new SchemaJeneratorError(
					errorType,
					errorCode != null ? errorCode.getCode() : null,
					message,
					context);
		}
	}

	// Static factory methods for common error types
	public static Builder validation() {
		return new Builder().errorType(ErrorType.VALIDATION);
	}

	public static Builder resourceNotFound() {
		return new Builder().errorType(ErrorType.RESOURCE_NOT_FOUND);
	}

	public static Builder parsing() {
		return new Builder().errorType(ErrorType.PARSING);
	}

	public static Builder generation() {
		return new Builder().errorType(ErrorType.GENERATION);
	}

	public static Builder configuration() {
		return new Builder().errorType(ErrorType.CONFIGURATION);
	}

	public static Builder io() {
		return new Builder().errorType(ErrorType.IO);
	}

	public static Builder internal() {
		return new Builder().errorType(ErrorType.INTERNAL);
	}
}
