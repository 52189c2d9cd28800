package com.schemajenerator.utils.jsonschema;

/**
 * Base interface for any builder that can produce a JsonSchema.
 */
public interface IBuildableSchemaType {
    /**
     * Builds and returns the final JsonSchema object.
     *
     * @return The constructed JsonSchema
     */
    JsonSchema build();
}
