package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.utils.jsonschema.StringFormatType;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Pure predicates used by the array and string generators.
 */
public final class SchemaHeuristics {

  /** Pattern attached to strings made only of ASCII digits, dashes and spaces. */
  public static final String DIGITS_DASHES_SPACES_PATTERN = "^[\\d\\-\\s]+$";

  private SchemaHeuristics() {
    // Prevent instantiation
  }

  /**
   * Collects the top-level kinds of the elements of an array node. Nested
   * structure is not looked at.
   */
  public static Set<JsonKind> itemKinds(JsonNode array) throws SchemaJeneratorException {
    Set<JsonKind> kinds = EnumSet.noneOf(JsonKind.class);
    for (JsonNode element : array) {
      kinds.add(JsonKind.of(element));
    }
    return kinds;
  }

  /**
   * An array is homogeneous when all its elements share one kind tag. Two
   * objects with different keys still count as homogeneous.
   */
  public static boolean isHomogeneous(JsonNode array) throws SchemaJeneratorException {
    return itemKinds(array).size() <= 1;
  }

  /**
   * Guesses a string format. Email wins over uri: the email test only looks for
   * an {@code @} and a {@code .} anywhere in the text.
   */
  public static Optional<StringFormatType> detectFormat(String value) {
    if (value.indexOf('@') >= 0 && value.indexOf('.') >= 0) {
      return Optional.of(StringFormatType.EMAIL);
    }
    if (value.startsWith("http")) {
      return Optional.of(StringFormatType.URI);
    }
    return Optional.empty();
  }

  /**
   * Returns {@link #DIGITS_DASHES_SPACES_PATTERN} when every character is an
   * ASCII digit, {@code -} or a space. Vacuously true for the empty string.
   */
  public static Optional<String> detectPattern(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean allowed = (c >= '0' && c <= '9') || c == '-' || c == ' ';
      if (!allowed) {
        return Optional.empty();
      }
    }
    return Optional.of(DIGITS_DASHES_SPACES_PATTERN);
  }
}
