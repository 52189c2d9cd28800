package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IIntegerSchemaBuilder;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.INumberSchemaBuilder;

import java.math.BigInteger;

/**
 * Integer and number schemas.
 *
 * <p>A value is an {@code "integer"} when it is integral and fits a signed or
 * an unsigned 64-bit integer; anything else is a {@code "number"} and uses
 * double arithmetic. Integer bounds are computed exactly and must stay inside
 * {@code [-2^63, 2^64 - 1]}; double bounds must stay finite. Leaving that
 * range raises {@code NUMERIC_RANGE_OVERFLOW} rather than wrapping.
 */
final class NumberSchemaGenerator {

  static final String INTEGER_TITLE = "Generated Integer Schema";
  static final String NUMBER_TITLE = "Generated Number Schema";

  /** Distance of {@code minimum}/{@code maximum} from the sample value. */
  static final long BOUND_WINDOW = 1000;

  static final BigInteger SIGNED_64_MIN = BigInteger.valueOf(Long.MIN_VALUE);
  static final BigInteger UNSIGNED_64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

  JsonSchema generate(JsonNode node, TierPolicy policy) throws SchemaJeneratorException {
    if (isInteger(node)) {
      return integerSchema(node, policy);
    }
    return numberSchema(node, policy);
  }

  static boolean isInteger(JsonNode node) {
    if (!node.isIntegralNumber()) {
      return false;
    }
    if (node.canConvertToLong()) {
      return true;
    }
    BigInteger value = node.bigIntegerValue();
    return value.signum() > 0 && value.compareTo(UNSIGNED_64_MAX) <= 0;
  }

  private JsonSchema integerSchema(JsonNode node, TierPolicy policy)
      throws SchemaJeneratorException {
    IIntegerSchemaBuilder builder = SchemaBuilder.integer();
    BigInteger value = node.bigIntegerValue();

    switch (policy.numericBounds()) {
      case NONE -> {}
      case LITERAL_MINIMUM -> builder.minimum(value);
      case WINDOW -> {
        BigInteger window = BigInteger.valueOf(BOUND_WINDOW);
        builder.minimum(checkedInteger(value.subtract(window), value, "minimum"));
        builder.maximum(checkedInteger(value.add(window), value, "maximum"));
      }
    }
    if (policy.examples()) {
      builder.examples(node);
    }
    if (policy.integerMultipleOf()) {
      builder.multipleOf(1);
    }
    if (policy.metadata()) {
      builder.title(INTEGER_TITLE);
    }
    return builder.build();
  }

  private JsonSchema numberSchema(JsonNode node, TierPolicy policy)
      throws SchemaJeneratorException {
    INumberSchemaBuilder builder = SchemaBuilder.number();
    double value = node.doubleValue();

    switch (policy.numericBounds()) {
      case NONE -> {}
      case LITERAL_MINIMUM -> builder.minimum(checkedDouble(value, node, "minimum"));
      case WINDOW -> {
        builder.minimum(checkedDouble(value - BOUND_WINDOW, node, "minimum"));
        builder.maximum(checkedDouble(value + BOUND_WINDOW, node, "maximum"));
      }
    }
    if (policy.examples()) {
      builder.examples(node);
    }
    if (policy.metadata()) {
      builder.title(NUMBER_TITLE);
    }
    return builder.build();
  }

  private static BigInteger checkedInteger(BigInteger bound, BigInteger value, String keyword)
      throws SchemaJeneratorException {
    if (bound.compareTo(SIGNED_64_MIN) < 0 || bound.compareTo(UNSIGNED_64_MAX) > 0) {
      throw SchemaLimits.overflow(keyword, value.toString(), bound.toString());
    }
    return bound;
  }

  // Integral values far outside the 64-bit range convert to an infinite double
  private static double checkedDouble(double bound, JsonNode value, String keyword)
      throws SchemaJeneratorException {
    if (!Double.isFinite(bound)) {
      throw SchemaLimits.overflow(keyword, value.asText(), String.valueOf(bound));
    }
    return bound;
  }
}
