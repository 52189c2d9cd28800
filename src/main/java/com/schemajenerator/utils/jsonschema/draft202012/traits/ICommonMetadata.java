package com.schemajenerator.utils.jsonschema.draft202012.traits;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Capability interface for the annotation keywords (title, description,
 * examples). Every schema type supports these fields according to the JSON
 * Schema 2020-12 meta-data vocabulary.
 *
 * <p>
 * This interface follows the trait/capability pattern, allowing type-safe
 * method chaining with the concrete builder type.
 * </p>
 *
 * @param <SELF> The concrete builder type for method chaining
 * @see <a href=
 *      "https://json-schema.org/draft/2020-12/json-schema-validation#section-9">2020-12
 *      Meta-Data</a>
 */
public interface ICommonMetadata<SELF> {

    /**
     * Sets the title of the schema.
     *
     * @param title A short description of the schema's purpose
     * @return This builder instance for chaining
     */
    SELF title(String title);

    /**
     * Sets the description of the schema.
     *
     * @param description A longer explanation of the schema's purpose
     * @return This builder instance for chaining
     */
    SELF description(String description);

    /**
     * Sets the {@code examples} array. The nodes are copied, the caller's tree
     * is never embedded.
     *
     * @param values Sample instances, at least one
     * @return This builder instance for chaining
     */
    SELF examples(JsonNode... values);
}
