package com.schemajenerator.utils.jsonschema.draft202012.traits;

import com.schemajenerator.utils.jsonschema.IBuildableSchemaType;
import java.util.List;

/**
 * Capability interface for the {@code oneOf} applicator.
 *
 * @param <SELF> The concrete builder type for method chaining
 * @see <a href=
 *      "https://json-schema.org/draft/2020-12/json-schema-core#section-10.2.1.3">2020-12
 *      oneOf</a>
 */
public interface IComposition<SELF> {

    /**
     * Adds oneOf constraint - instance must validate against EXACTLY ONE of the
     * provided schemas. Order is kept and duplicates are not collapsed.
     *
     * @param schemas Varargs of schemas where exactly one must match
     * @return This builder instance for chaining
     */
    SELF oneOf(IBuildableSchemaType... schemas);

    /**
     * List form of {@link #oneOf(IBuildableSchemaType...)}.
     *
     * @param schemas List of schemas where exactly one must match
     * @return This builder instance for chaining
     */
    SELF oneOf(List<? extends IBuildableSchemaType> schemas);
}
