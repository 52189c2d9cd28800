package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.INullSchemaBuilder;

/** Implementation of INullSchemaBuilder for building null-type schemas. */
final class NullBuilderImpl extends AbstractSchemaBuilderImpl<INullSchemaBuilder>
    implements INullSchemaBuilder {

  NullBuilderImpl(ObjectMapper mapper) {
    super(JsonSchemaType.NULL, mapper);
  }

  @Override
  protected INullSchemaBuilder self() {
    return this;
  }
}
