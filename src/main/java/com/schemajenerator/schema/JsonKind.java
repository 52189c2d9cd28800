package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;

import java.util.Map;

/**
 * The closed set of JSON value kinds the generators dispatch on.
 */
public enum JsonKind {
  OBJECT("object"),
  ARRAY("array"),
  STRING("string"),
  NUMBER("number"),
  BOOLEAN("boolean"),
  NULL("null");

  private final String tag;

  JsonKind(String tag) {
    this.tag = tag;
  }

  /** The kind tag used by the array homogeneity test. */
  public String tag() {
    return tag;
  }

  /**
   * Classifies a node of a parsed tree.
   *
   * @param node the node to classify
   * @return its kind
   * @throws SchemaJeneratorException for binary, POJO and missing nodes, which a
   *     parsed JSON document never contains
   */
  public static JsonKind of(JsonNode node) throws SchemaJeneratorException {
    return switch (node.getNodeType()) {
      case OBJECT -> OBJECT;
      case ARRAY -> ARRAY;
      case STRING -> STRING;
      case NUMBER -> NUMBER;
      case BOOLEAN -> BOOLEAN;
      case NULL -> NULL;
      default -> throw unsupported(node);
    };
  }

  private static SchemaJeneratorException unsupported(JsonNode node) {
    return new SchemaJeneratorException(
        SchemaJeneratorError.generation()
            .errorCode(SchemaJeneratorError.ErrorCode.UNSUPPORTED_NODE_TYPE)
            .message("Unsupported JSON node type: " + node.getNodeType())
            .context(
                new SchemaJeneratorError.ErrorContext(
                    "classify node",
                    node.getClass().getSimpleName(),
                    Map.of("nodeType", String.valueOf(node.getNodeType()))))
            .build());
  }

  @Override
  public String toString() {
    return tag;
  }
}
