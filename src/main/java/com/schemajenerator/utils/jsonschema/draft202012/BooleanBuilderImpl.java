package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IBooleanSchemaBuilder;

/** Implementation of IBooleanSchemaBuilder for building boolean-type schemas. */
final class BooleanBuilderImpl extends AbstractSchemaBuilderImpl<IBooleanSchemaBuilder>
    implements IBooleanSchemaBuilder {

  BooleanBuilderImpl(ObjectMapper mapper) {
    super(JsonSchemaType.BOOLEAN, mapper);
  }

  @Override
  protected IBooleanSchemaBuilder self() {
    return this;
  }
}
