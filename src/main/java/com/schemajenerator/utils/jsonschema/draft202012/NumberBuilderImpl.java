package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.INumberSchemaBuilder;

/** Implementation of INumberSchemaBuilder for building number-type schemas. */
final class NumberBuilderImpl extends AbstractSchemaBuilderImpl<INumberSchemaBuilder>
    implements INumberSchemaBuilder {

  private static final String MINIMUM = "minimum";
  private static final String MAXIMUM = "maximum";

  NumberBuilderImpl(ObjectMapper mapper) {
    super(JsonSchemaType.NUMBER, mapper);
  }

  @Override
  protected INumberSchemaBuilder self() {
    return this;
  }

  @Override
  public INumberSchemaBuilder minimum(double minimum) {
    requireFinite(minimum, "Minimum");
    schema.put(MINIMUM, minimum);
    return this;
  }

  @Override
  public INumberSchemaBuilder maximum(double maximum) {
    requireFinite(maximum, "Maximum");
    schema.put(MAXIMUM, maximum);
    return this;
  }

  // JSON has no literal for NaN or the infinities
  private static void requireFinite(double value, String keyword) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(keyword + " must be finite, got: " + value);
    }
  }
}
