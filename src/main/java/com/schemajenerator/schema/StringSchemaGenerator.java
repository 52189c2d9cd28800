package com.schemajenerator.schema;

import com.fasterxml.jackson.databind.node.TextNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.StringFormatType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IStringSchemaBuilder;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * String schemas. Lengths are measured in UTF-8 bytes.
 */
final class StringSchemaGenerator {

  static final String TITLE = "Generated String Schema";

  JsonSchema generate(String value, TierPolicy policy) throws SchemaJeneratorException {
    IStringSchemaBuilder builder = SchemaBuilder.string();

    if (policy.minLength()) {
      builder.minLength(0);
    }
    if (policy.maxLengthFactor() != null) {
      builder.maxLength(
          SchemaLimits.scaled(
              policy.maxLengthFactor(), value.getBytes(StandardCharsets.UTF_8).length, "maxLength"));
    }
    if (!value.isEmpty()) {
      if (policy.examples()) {
        builder.examples(TextNode.valueOf(value));
      }
      if (policy.sniffStringFormat()) {
        applyFormatOrPattern(builder, value);
      }
    }
    if (policy.metadata()) {
      builder.title(TITLE);
    }
    return builder.build();
  }

  // format and pattern are mutually exclusive, format is tried first
  private static void applyFormatOrPattern(IStringSchemaBuilder builder, String value) {
    Optional<StringFormatType> format = SchemaHeuristics.detectFormat(value);
    if (format.isPresent()) {
      builder.format(format.get());
      return;
    }
    SchemaHeuristics.detectPattern(value).ifPresent(builder::pattern);
  }
}
