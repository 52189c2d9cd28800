package com.schemajenerator.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Singleton holder for shared ObjectMapper instance. Provides a consistently configured
 * ObjectMapper for reading input documents and writing generated schemas.
 */
public final class JsonMapperHolder {

  private static final ObjectMapper INSTANCE = createMapper();

  private JsonMapperHolder() {
    // Prevent instantiation
  }

  private static ObjectMapper createMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(SerializationFeature.INDENT_OUTPUT, false);
    // A document is exactly one JSON value
    mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    return mapper;
  }

  /** Gets the shared ObjectMapper instance. */
  public static ObjectMapper getMapper() {
    return INSTANCE;
  }

  /**
   * Parses JSON text into a tree.
   *
   * @param content The JSON text
   * @return The parsed tree
   * @throws JsonProcessingException If the text is not well-formed JSON or has content after the
   *     first value
   */
  public static JsonNode readTree(String content) throws JsonProcessingException {
    return INSTANCE.readTree(content);
  }

  /**
   * Serializes an object to a compact JSON string.
   *
   * @param obj The object to serialize
   * @return The JSON string
   * @throws JsonProcessingException If serialization fails
   */
  public static String toJson(Object obj) throws JsonProcessingException {
    return INSTANCE.writeValueAsString(obj);
  }

  /**
   * Serializes an object to JSON, indented when {@code pretty} is set.
   *
   * @param obj The object to serialize
   * @param pretty Whether to pretty print
   * @return The JSON string
   * @throws JsonProcessingException If serialization fails
   */
  public static String toJson(Object obj, boolean pretty) throws JsonProcessingException {
    if (pretty) {
      return INSTANCE.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
    }
    return toJson(obj);
  }
}
