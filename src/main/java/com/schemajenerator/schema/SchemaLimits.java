package com.schemajenerator.schema;

import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;

import java.util.Map;

/** Checked arithmetic for derived keyword values. */
final class SchemaLimits {

  private SchemaLimits() {
    // Prevent instantiation
  }

  /**
   * {@code factor * size} for a length or count keyword such as {@code maxItems}.
   *
   * @throws SchemaJeneratorException if the product does not fit an {@code int}
   */
  static int scaled(int factor, int size, String keyword) throws SchemaJeneratorException {
    try {
      return Math.multiplyExact(factor, size);
    } catch (ArithmeticException e) {
      throw overflow(keyword, Integer.toString(size), factor + " * " + size);
    }
  }

  static SchemaJeneratorException overflow(String keyword, String value, String bound) {
    return new SchemaJeneratorException(
        SchemaJeneratorError.generation()
            .errorCode(SchemaJeneratorError.ErrorCode.NUMERIC_RANGE_OVERFLOW)
            .message(
                "Numeric range overflow: "
                    + keyword
                    + " derived from "
                    + value
                    + " is not representable")
            .context(
                new SchemaJeneratorError.ErrorContext(
                    "derive " + keyword, value, Map.of("bound", bound)))
            .build());
  }
}
