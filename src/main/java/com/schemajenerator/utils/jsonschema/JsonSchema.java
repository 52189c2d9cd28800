package com.schemajenerator.utils.jsonschema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.utils.JsonMapperHolder;

import java.util.Optional;

/**
 * A generated JSON Schema document, built using the
 * {@link com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder}.
 * Provides methods to access the underlying schema node and serialize it to a
 * JSON string.
 */
public final class JsonSchema implements IBuildableSchemaType {

	private final ObjectNode schemaNode;

	/**
	 * Creates an instance by directly using the provided node.
	 *
	 * @param schemaNode The schema node constructed by a builder. A null node
	 *                   yields the empty schema {@code {}}.
	 */
	public JsonSchema(ObjectNode schemaNode) {
		this.schemaNode = schemaNode != null ? schemaNode : JsonMapperHolder.getMapper().createObjectNode();
	}

	/**
	 * Returns the underlying JSON schema {@link ObjectNode}.
	 * This returns the actual node without copying; parents embed the node of
	 * their children as-is.
	 *
	 * @return The underlying schema node.
	 */
	public ObjectNode getNode() {
		return schemaNode;
	}

	/**
	 * A finished schema is its own build result, so it can be passed wherever a
	 * builder is accepted.
	 *
	 * @return this schema
	 */
	@Override
	public JsonSchema build() {
		return this;
	}

	/**
	 * Serializes the JSON schema to a string representation using the provided
	 * {@link ObjectMapper}.
	 *
	 * @param mapper The ObjectMapper to use for serialization. Must not be null.
	 * @return An {@link Optional} containing the JSON string if serialization is
	 *         successful, otherwise {@link Optional#empty()}.
	 */
	public Optional<String> toJsonString(ObjectMapper mapper) {
		if (mapper == null) {
			return Optional.empty();
		}

		try {
			return Optional.of(mapper.writeValueAsString(this.schemaNode));
		} catch (JsonProcessingException e) {
			return Optional.empty();
		}
	}

	/**
	 * Serializes the JSON schema to a compact string using the shared mapper.
	 *
	 * @return An {@link Optional} containing the JSON string if serialization is
	 *         successful, otherwise {@link Optional#empty()}.
	 */
	public Optional<String> toJsonString() {
		return toJsonString(JsonMapperHolder.getMapper());
	}

	@Override
	public String toString() {
		return toJsonString().orElse("JsonSchema{ serialization_error }");
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;
		JsonSchema that = (JsonSchema) o;
		return schemaNode.equals(that.schemaNode);
	}

	@Override
	public int hashCode() {
		return schemaNode.hashCode();
	}
}
