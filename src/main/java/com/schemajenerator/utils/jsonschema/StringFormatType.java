package com.schemajenerator.utils.jsonschema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Format identifiers the string heuristics can attach to a STRING schema.
 */
public enum StringFormatType {
	@JsonProperty("email")
	EMAIL("email"),
	@JsonProperty("uri")
	URI("uri");

	private final String value;

	StringFormatType(String value) {
		this.value = value;
	}

	@Override
	public String toString() {
		return value;
	}
}
