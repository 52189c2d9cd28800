package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.utils.jsonschema.JsonSchema;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers a JSON Schema document from a parsed JSON value.
 *
 * <p>The single entry point is {@link #generate(JsonNode, SchemaOutputTier)}: it
 * routes by value kind to a per-kind generator, the composite generators recurse
 * back through the dispatcher for their children, and child schemas are
 * assembled bottom-up into their parent.
 *
 * <p>Instances hold no mutable state and never modify the input tree, so one
 * generator may be shared between threads. Recursion depth equals the nesting
 * depth of the input; there is no guard against stack exhaustion.
 */
public final class SchemaGenerator {

  private static final Logger log = LoggerFactory.getLogger(SchemaGenerator.class);

  private final ObjectSchemaGenerator objects = new ObjectSchemaGenerator(this);
  private final ArraySchemaGenerator arrays = new ArraySchemaGenerator(this);
  private final StringSchemaGenerator strings = new StringSchemaGenerator();
  private final NumberSchemaGenerator numbers = new NumberSchemaGenerator();
  private final BooleanSchemaGenerator booleans = new BooleanSchemaGenerator();
  private final NullSchemaGenerator nulls = new NullSchemaGenerator();

  /**
   * Shorthand for {@code new SchemaGenerator().generate(value, tier)}.
   */
  public static JsonSchema generateSchema(JsonNode value, SchemaOutputTier tier)
      throws SchemaJeneratorException {
    return new SchemaGenerator().generate(value, tier);
  }

  /**
   * Generates a fresh schema document for {@code value}.
   *
   * @param value a parsed JSON tree, read but never modified
   * @param tier strictness of the generated schema
   * @return the schema document
   * @throws SchemaJeneratorException if a numeric bound leaves the 64-bit
   *     integer range or the tree contains a node kind JSON text cannot produce
   */
  public JsonSchema generate(JsonNode value, SchemaOutputTier tier)
      throws SchemaJeneratorException {
    Objects.requireNonNull(value, "JSON value cannot be null");
    Objects.requireNonNull(tier, "Schema tier cannot be null");

    log.debug("Generating {} schema for a {} value", tier, value.getNodeType());
    return generate(value, tier.policy());
  }

  JsonSchema generate(JsonNode value, TierPolicy policy) throws SchemaJeneratorException {
    return switch (JsonKind.of(value)) {
      case OBJECT -> objects.generate(value, policy);
      case ARRAY -> arrays.generate(value, policy);
      case STRING -> strings.generate(value.textValue(), policy);
      case NUMBER -> numbers.generate(value, policy);
      case BOOLEAN -> booleans.generate(value, policy);
      case NULL -> nulls.generate();
    };
  }
}
