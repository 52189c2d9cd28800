package com.schemajenerator.utils.jsonschema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The primitive types a JSON Schema 2020-12 {@code "type"} keyword can name.
 *
 * @see <a href="https://json-schema.org/draft/2020-12/json-schema-validation#section-6.1.1">2020-12 type</a>
 */
public enum JsonSchemaType {
  @JsonProperty("string")
  STRING("string"),
  @JsonProperty("number")
  NUMBER("number"),
  @JsonProperty("integer")
  INTEGER("integer"),
  @JsonProperty("boolean")
  BOOLEAN("boolean"),
  @JsonProperty("array")
  ARRAY("array"),
  @JsonProperty("object")
  OBJECT("object"),
  @JsonProperty("null")
  NULL("null");

  private final String value;

  JsonSchemaType(String value) {
    this.value = value;
  }

  /**
   * Returns the string representation of the schema type as expected in the JSON schema.
   *
   * @return The JSON schema type string.
   */
  @Override
  public String toString() {
    return value;
  }
}
