package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IBooleanSchemaBuilder;

final class BooleanSchemaGenerator {

  static final String TITLE = "Generated Boolean Schema";
  static final String DESCRIPTION = "Boolean value from JSON data";

  JsonSchema generate(JsonNode value, TierPolicy policy) {
    IBooleanSchemaBuilder builder = SchemaBuilder.bool();
    if (policy.examples()) {
      builder.examples(value);
    }
    if (policy.metadata()) {
      builder.title(TITLE).description(DESCRIPTION);
    }
    return builder.build();
  }
}
