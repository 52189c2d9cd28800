package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.StringFormatType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IStringSchemaBuilder;

import java.util.Objects;

/**
 * Implementation of IStringSchemaBuilder for building string-type schemas.
 */
final class StringBuilderImpl extends AbstractSchemaBuilderImpl<IStringSchemaBuilder>
        implements IStringSchemaBuilder {

    private static final String MIN_LENGTH = "minLength";
    private static final String MAX_LENGTH = "maxLength";
    private static final String PATTERN = "pattern";
    private static final String FORMAT = "format";

    StringBuilderImpl(ObjectMapper mapper) {
        super(JsonSchemaType.STRING, mapper);
    }

    @Override
    protected IStringSchemaBuilder self() {
        return this;
    }

    @Override
    public IStringSchemaBuilder minLength(int minLength) {
        if (minLength < 0) {
            throw new IllegalArgumentException("minLength cannot be negative: " + minLength);
        }
        schema.put(MIN_LENGTH, minLength);
        return this;
    }

    @Override
    public IStringSchemaBuilder maxLength(int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength cannot be negative: " + maxLength);
        }
        schema.put(MAX_LENGTH, maxLength);
        return this;
    }

    @Override
    public IStringSchemaBuilder pattern(String pattern) {
        schema.put(PATTERN, Objects.requireNonNull(pattern, "Pattern cannot be null"));
        return this;
    }

    @Override
    public IStringSchemaBuilder format(StringFormatType format) {
        schema.put(FORMAT, Objects.requireNonNull(format, "Format cannot be null").toString());
        return this;
    }
}
