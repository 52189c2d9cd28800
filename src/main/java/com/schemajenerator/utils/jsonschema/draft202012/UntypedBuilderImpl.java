package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.utils.jsonschema.IBuildableSchemaType;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IUntypedSchemaBuilder;
import java.util.List;
import java.util.Objects;

/**
 * Builder for schemas WITHOUT a base type constraint. Used for the {@code items} of a
 * heterogeneous array, where the accepted types are given solely by {@code oneOf}.
 *
 * <pre>{@code
 * // Schema that accepts either an integer OR a string
 * JsonSchema schema = SchemaBuilder.oneOf(
 *         SchemaBuilder.integer(),
 *         SchemaBuilder.string()).build();
 * }</pre>
 */
final class UntypedBuilderImpl implements IUntypedSchemaBuilder {

  private static final String ONE_OF = "oneOf";

  private final ObjectNode schema;

  UntypedBuilderImpl(ObjectMapper mapper) {
    Objects.requireNonNull(mapper, "ObjectMapper cannot be null");
    this.schema = mapper.createObjectNode();
    // Intentionally NO "type" field
  }

  @Override
  public JsonSchema build() {
    return new JsonSchema(schema);
  }

  @Override
  public UntypedBuilderImpl oneOf(IBuildableSchemaType... schemas) {
    Objects.requireNonNull(schemas, "oneOf schemas array cannot be null");
    if (schemas.length == 0) {
      throw new IllegalArgumentException("oneOf array cannot be empty");
    }

    ArrayNode oneOfNode = schema.putArray(ONE_OF);
    for (IBuildableSchemaType schemaBuilder : schemas) {
      Objects.requireNonNull(schemaBuilder, "Schema in oneOf array cannot be null");
      oneOfNode.add(schemaBuilder.build().getNode());
    }
    return this;
  }

  @Override
  public UntypedBuilderImpl oneOf(List<? extends IBuildableSchemaType> schemas) {
    Objects.requireNonNull(schemas, "oneOf schemas list cannot be null");
    if (schemas.isEmpty()) {
      throw new IllegalArgumentException("oneOf list cannot be empty");
    }
    return oneOf(schemas.toArray(new IBuildableSchemaType[0]));
  }
}
