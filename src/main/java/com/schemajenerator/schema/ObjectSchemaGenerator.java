package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IObjectSchemaBuilder;

import java.util.Iterator;
import java.util.Map;

/**
 * Object schemas: one property per input key, in input order.
 */
final class ObjectSchemaGenerator {

  static final String TITLE = "Generated Object Schema";
  static final String DESCRIPTION = "Auto-generated schema from JSON data";

  private final SchemaGenerator dispatcher;

  ObjectSchemaGenerator(SchemaGenerator dispatcher) {
    this.dispatcher = dispatcher;
  }

  JsonSchema generate(JsonNode object, TierPolicy policy) throws SchemaJeneratorException {
    IObjectSchemaBuilder builder = SchemaBuilder.object();

    if (policy.declareDialect()) {
      builder.schemaUri(SchemaBuilder.DRAFT_2020_12);
    }

    Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonSchema propertySchema = dispatcher.generate(field.getValue(), policy);
      builder.property(field.getKey(), propertySchema, isRequired(field.getValue(), policy));
    }

    if (policy.additionalProperties() != null) {
      builder.additionalProperties(policy.additionalProperties());
    }
    // Applied even to an empty input object
    if (policy.minProperties() != null) {
      builder.minProperties(policy.minProperties());
    }
    if (policy.metadata()) {
      builder.title(TITLE).description(DESCRIPTION);
    }
    return builder.build();
  }

  private static boolean isRequired(JsonNode value, TierPolicy policy) {
    return switch (policy.requiredProperties()) {
      case NONE -> false;
      case NON_NULL -> !value.isNull();
      case ALL -> true;
    };
  }
}
