package com.schemajenerator.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks generated documents against the JSON Schema 2020-12 meta-schema using the
 * NetworkNT JSON Schema Validator. The meta-schema ships with the validator and is
 * loaded from the classpath, so no network access is needed.
 *
 * <p>Schema generation never depends on this class; the command line front end
 * runs it only when asked to.
 */
public final class MetaSchemaValidator {

  private static final Logger log = LoggerFactory.getLogger(MetaSchemaValidator.class);

  private final JsonSchemaFactory factory;
  private final com.networknt.schema.JsonSchema metaSchema;

  /**
   * Compiles the 2020-12 meta-schema.
   *
   * @throws SchemaJeneratorException if the meta-schema cannot be loaded
   */
  public MetaSchemaValidator() throws SchemaJeneratorException {
    this.factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    try {
      this.metaSchema = factory.getSchema(SchemaLocation.of(SchemaBuilder.DRAFT_2020_12));
    } catch (RuntimeException e) {
      throw new SchemaJeneratorException(
          SchemaJeneratorError.validation()
              .errorCode(SchemaJeneratorError.ErrorCode.META_SCHEMA_VALIDATION_FAILED)
              .message("Failed to compile meta-schema: " + e.getMessage())
              .context(
                  new SchemaJeneratorError.ErrorContext(
                      "compile meta-schema", SchemaBuilder.DRAFT_2020_12, null))
              .build(),
          e);
    }
  }

  /**
   * Validates a generated schema document against the meta-schema.
   *
   * @param schema the generated document
   * @throws SchemaJeneratorException listing every violation when the document is
   *     not a valid 2020-12 schema
   */
  public void validate(JsonSchema schema) throws SchemaJeneratorException {
    Set<ValidationMessage> errors = metaSchema.validate(schema.getNode());
    if (!errors.isEmpty()) {
      throw failure(
          SchemaJeneratorError.ErrorCode.META_SCHEMA_VALIDATION_FAILED,
          "Schema validation failed: ",
          errors);
    }
    log.debug("Generated schema conforms to {}", SchemaBuilder.DRAFT_2020_12);
  }

  /**
   * Validates one JSON instance against a generated schema. Used to check that a
   * document is accepted by the schema inferred from it.
   *
   * @param instance the JSON value to check
   * @param schema the schema to check it against
   * @throws SchemaJeneratorException listing every violation when the instance
   *     does not conform
   */
  public void validateInstance(JsonNode instance, JsonSchema schema)
      throws SchemaJeneratorException {
    com.networknt.schema.JsonSchema compiled;
    try {
      compiled = factory.getSchema(schema.getNode());
    } catch (RuntimeException e) {
      throw SchemaJeneratorException.fromException(e, "compile schema", null);
    }
    Set<ValidationMessage> errors = compiled.validate(instance);
    if (!errors.isEmpty()) {
      throw failure(
          SchemaJeneratorError.ErrorCode.INSTANCE_VALIDATION_FAILED,
          "JSON validation failed: ",
          errors);
    }
  }

  private static SchemaJeneratorException failure(
      SchemaJeneratorError.ErrorCode code, String prefix, Set<ValidationMessage> errors) {
    String messages =
        errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining(", "));
    return new SchemaJeneratorException(
        SchemaJeneratorError.validation()
            .errorCode(code)
            .message(prefix + messages)
            .context(
                new SchemaJeneratorError.ErrorContext(
                    "validate", null, Map.of("violations", errors.size())))
            .build());
  }
}
