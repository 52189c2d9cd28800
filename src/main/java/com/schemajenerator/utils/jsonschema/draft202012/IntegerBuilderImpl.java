package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IIntegerSchemaBuilder;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Implementation of IIntegerSchemaBuilder for building integer-type schemas.
 * Bounds are taken as {@link BigInteger} so that unsigned 64-bit values are
 * written exactly.
 */
final class IntegerBuilderImpl extends AbstractSchemaBuilderImpl<IIntegerSchemaBuilder>
        implements IIntegerSchemaBuilder {

    private static final String MINIMUM = "minimum";
    private static final String MAXIMUM = "maximum";
    private static final String MULTIPLE_OF = "multipleOf";

    IntegerBuilderImpl(ObjectMapper mapper) {
        super(JsonSchemaType.INTEGER, mapper);
    }

    @Override
    protected IIntegerSchemaBuilder self() {
        return this;
    }

    @Override
    public IIntegerSchemaBuilder minimum(BigInteger minimum) {
        Objects.requireNonNull(minimum, "Minimum cannot be null");
        return minimum.bitLength() < Long.SIZE ? minimum(minimum.longValue()) : putBig(MINIMUM, minimum);
    }

    @Override
    public IIntegerSchemaBuilder maximum(BigInteger maximum) {
        Objects.requireNonNull(maximum, "Maximum cannot be null");
        return maximum.bitLength() < Long.SIZE ? maximum(maximum.longValue()) : putBig(MAXIMUM, maximum);
    }

    @Override
    public IIntegerSchemaBuilder minimum(long minimum) {
        schema.put(MINIMUM, minimum);
        return this;
    }

    @Override
    public IIntegerSchemaBuilder maximum(long maximum) {
        schema.put(MAXIMUM, maximum);
        return this;
    }

    // Only for values outside the long range, such as large unsigned 64-bit bounds
    private IIntegerSchemaBuilder putBig(String keyword, BigInteger value) {
        schema.put(keyword, value);
        return this;
    }

    @Override
    public IIntegerSchemaBuilder multipleOf(long multipleOf) {
        if (multipleOf <= 0) {
            throw new IllegalArgumentException("multipleOf must be greater than 0, got: " + multipleOf);
        }
        schema.put(MULTIPLE_OF, multipleOf);
        return this;
    }
}
