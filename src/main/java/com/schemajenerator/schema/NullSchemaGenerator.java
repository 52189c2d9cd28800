package com.schemajenerator.schema;

import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;

/** Always {@code {"type":"null"}}, whatever the tier. */
final class NullSchemaGenerator {

  JsonSchema generate() {
    return SchemaBuilder.nul().build();
  }
}
