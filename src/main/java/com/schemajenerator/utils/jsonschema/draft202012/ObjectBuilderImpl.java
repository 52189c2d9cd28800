package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.utils.jsonschema.IBuildableSchemaType;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IObjectSchemaBuilder;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Implementation of IObjectSchemaBuilder for building object-type schemas.
 */
final class ObjectBuilderImpl extends AbstractSchemaBuilderImpl<IObjectSchemaBuilder>
        implements IObjectSchemaBuilder {

    private static final String SCHEMA = "$schema";
    private static final String PROPERTIES = "properties";
    private static final String REQUIRED = "required";
    private static final String MIN_PROPERTIES = "minProperties";
    private static final String ADDITIONAL_PROPERTIES = "additionalProperties";

    private final ObjectNode propertiesNode;
    private ArrayNode requiredNode = null;
    private final Set<String> requiredNames = new HashSet<>();

    ObjectBuilderImpl(ObjectMapper mapper) {
        super(JsonSchemaType.OBJECT, mapper);
        this.propertiesNode = schema.putObject(PROPERTIES);
    }

    @Override
    protected IObjectSchemaBuilder self() {
        return this;
    }

    // Object-specific property methods
    @Override
    public IObjectSchemaBuilder property(String name, ObjectNode propertySchema, boolean required) {
        Objects.requireNonNull(name, "Property name cannot be null");
        Objects.requireNonNull(propertySchema, "Property schema cannot be null");

        propertiesNode.set(name, propertySchema);

        if (required) {
            requiredProperty(name);
        }
        return this;
    }

    @Override
    public IObjectSchemaBuilder property(String name, IBuildableSchemaType propertySchemaBuilder) {
        return property(name, propertySchemaBuilder, false);
    }

    @Override
    public IObjectSchemaBuilder property(String name, IBuildableSchemaType propertySchemaBuilder, boolean required) {
        Objects.requireNonNull(propertySchemaBuilder, "Property schema builder cannot be null");
        return property(name, propertySchemaBuilder.build().getNode(), required);
    }

    /**
     * Appends a name to {@code required}, creating the keyword on first use so
     * that an object without required properties never carries an empty array.
     */
    @Override
    public IObjectSchemaBuilder requiredProperty(String name) {
        Objects.requireNonNull(name, "Required property name cannot be null");

        if (!requiredNames.add(name)) {
            return this;
        }
        if (requiredNode == null) {
            requiredNode = schema.putArray(REQUIRED);
        }
        requiredNode.add(name);
        return this;
    }

    @Override
    public IObjectSchemaBuilder minProperties(int minProperties) {
        if (minProperties < 0) {
            throw new IllegalArgumentException("minProperties cannot be negative: " + minProperties);
        }
        schema.put(MIN_PROPERTIES, minProperties);
        return this;
    }

    // Object-specific keywords
    @Override
    public IObjectSchemaBuilder additionalProperties(boolean allowed) {
        schema.put(ADDITIONAL_PROPERTIES, allowed);
        return this;
    }

    @Override
    public IObjectSchemaBuilder schemaUri(String uri) {
        schema.put(SCHEMA, Objects.requireNonNull(uri, "$schema URI cannot be null"));
        return this;
    }
}
