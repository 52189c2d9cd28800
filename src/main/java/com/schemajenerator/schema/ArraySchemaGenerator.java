package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IArraySchemaBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Array schemas. A homogeneous array is described by the schema of its first
 * element; a heterogeneous one by a {@code oneOf} with one entry per element.
 */
final class ArraySchemaGenerator {

  static final String TITLE = "Generated Array Schema";
  static final String DESCRIPTION = "Auto-generated array schema from JSON data";

  private final SchemaGenerator dispatcher;

  ArraySchemaGenerator(SchemaGenerator dispatcher) {
    this.dispatcher = dispatcher;
  }

  JsonSchema generate(JsonNode array, TierPolicy policy) throws SchemaJeneratorException {
    IArraySchemaBuilder builder = SchemaBuilder.array();

    // Same at every tier
    if (array.isEmpty()) {
      return builder.anyItems().build();
    }

    if (SchemaHeuristics.isHomogeneous(array)) {
      builder.items(dispatcher.generate(array.get(0), policy));
    } else {
      List<JsonSchema> elementSchemas = new ArrayList<>(array.size());
      for (JsonNode element : array) {
        elementSchemas.add(dispatcher.generate(element, policy));
      }
      builder.items(SchemaBuilder.oneOf(elementSchemas));
    }

    if (policy.minItems() != null) {
      builder.minItems(policy.minItems());
    }
    if (policy.maxItemsFactor() != null) {
      builder.maxItems(SchemaLimits.scaled(policy.maxItemsFactor(), array.size(), "maxItems"));
    }
    // Not derived from the data: duplicates in the sample do not switch it off
    if (policy.uniqueItems()) {
      builder.uniqueItems(true);
    }
    if (policy.metadata()) {
      builder.title(TITLE).description(DESCRIPTION);
    }
    return builder.build();
  }
}
