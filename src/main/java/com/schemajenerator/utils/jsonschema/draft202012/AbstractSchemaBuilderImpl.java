package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;

import java.util.Objects;

/**
 * Abstract base class for all typed schema builder implementations.
 * Provides shared implementation logic for the annotation keywords.
 *
 * @param <SELF> The concrete builder type for method chaining
 */
abstract class AbstractSchemaBuilderImpl<SELF> {

    protected final ObjectNode schema;
    protected final ObjectMapper mapper;
    protected final JsonSchemaType type;

    // JSON Schema keyword constants
    protected static final String TYPE = "type";
    protected static final String TITLE = "title";
    protected static final String DESCRIPTION = "description";
    protected static final String EXAMPLES = "examples";

    protected AbstractSchemaBuilderImpl(JsonSchemaType type, ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
        this.schema = mapper.createObjectNode();
        this.type = Objects.requireNonNull(type, "Schema type cannot be null");
        this.schema.put(TYPE, type.toString());
    }

    /**
     * Returns this instance cast to the concrete builder type.
     */
    protected abstract SELF self();

    // ========== Common Metadata Methods ==========

    public SELF title(String title) {
        schema.put(TITLE, Objects.requireNonNull(title, "Title cannot be null"));
        return self();
    }

    public SELF description(String description) {
        schema.put(DESCRIPTION, Objects.requireNonNull(description, "Description cannot be null"));
        return self();
    }

    public SELF examples(JsonNode... values) {
        Objects.requireNonNull(values, "Examples array cannot be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("examples array cannot be empty");
        }

        ArrayNode examplesNode = schema.putArray(EXAMPLES);
        for (JsonNode value : values) {
            Objects.requireNonNull(value, "Example value cannot be null");
            examplesNode.add(value.deepCopy());
        }
        return self();
    }

    public JsonSchema build() {
        return new JsonSchema(schema);
    }
}
