package com.schemajenerator.validation;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import com.schemajenerator.schema.SchemaGenerator;
import com.schemajenerator.schema.SchemaOutputTier;
import com.schemajenerator.utils.jsonschema.JsonSchema;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Validation tests using the NetworkNT JSON Schema Validator: generated documents must be valid
 * 2020-12 schemas, and the schema inferred from a document should accept that document.
 */
class MetaSchemaValidatorTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final String SAMPLE =
      "{\"id\":7,\"name\":\"John\",\"email\":\"john@example.com\",\"site\":\"https://example.com\","
          + "\"phone\":\"555-1234\",\"score\":9.5,\"active\":true,\"manager\":null,"
          + "\"tags\":[\"a\",\"b\"],\"mixed\":[1,\"x\",false],\"empty\":[],"
          + "\"address\":{\"city\":\"Springfield\",\"zip\":\"12345\"}}";

  private static MetaSchemaValidator validator;

  @BeforeAll
  static void setUp() throws Exception {
    validator = new MetaSchemaValidator();
  }

  @Nested
  @DisplayName("Meta-schema")
  class MetaSchemaTests {

    @ParameterizedTest
    @EnumSource(SchemaOutputTier.class)
    @DisplayName("Generated schemas are valid 2020-12 documents at every tier")
    void generatedSchemaIsValid(SchemaOutputTier tier) throws Exception {
      JsonSchema schema = SchemaGenerator.generateSchema(MAPPER.readTree(SAMPLE), tier);
      assertDoesNotThrow(() -> validator.validate(schema));
    }

    @Test
    @DisplayName("Malformed keywords are reported")
    void malformedSchemaRejected() {
      ObjectNode node = MAPPER.createObjectNode();
      node.put("type", "text");
      node.put("minLength", -1);

      SchemaJeneratorException e =
          assertThrows(SchemaJeneratorException.class, () -> validator.validate(new JsonSchema(node)));
      assertTrue(e.isValidationError());
      assertEquals(
          SchemaJeneratorError.ErrorCode.META_SCHEMA_VALIDATION_FAILED.getCode(), e.getErrorCode());
      assertTrue(e.getMessage().startsWith("Schema validation failed: "));
    }
  }

  @Nested
  @DisplayName("Instances")
  class InstanceTests {

    @ParameterizedTest
    @EnumSource(SchemaOutputTier.class)
    @DisplayName("The source document conforms to its own schema")
    void sourceConforms(SchemaOutputTier tier) throws Exception {
      JsonNode sample = MAPPER.readTree(SAMPLE);
      JsonSchema schema = SchemaGenerator.generateSchema(sample, tier);
      assertDoesNotThrow(() -> validator.validateInstance(sample, schema));
    }

    @Test
    @DisplayName("Comprehensive schema rejects unknown keys")
    void closedObjectRejectsExtraKey() throws Exception {
      JsonSchema schema =
          SchemaGenerator.generateSchema(MAPPER.readTree("{\"a\":1}"), SchemaOutputTier.COMPREHENSIVE);

      SchemaJeneratorException e =
          assertThrows(
              SchemaJeneratorException.class,
              () -> validator.validateInstance(MAPPER.readTree("{\"a\":1,\"b\":2}"), schema));
      assertEquals(
          SchemaJeneratorError.ErrorCode.INSTANCE_VALIDATION_FAILED.getCode(), e.getErrorCode());
    }

    @Test
    @DisplayName("Expert uniqueItems rejects a sample that has duplicates")
    void expertRejectsDuplicateSample() throws Exception {
      JsonNode sample = MAPPER.readTree("[1,1]");
      JsonSchema schema = SchemaGenerator.generateSchema(sample, SchemaOutputTier.EXPERT);

      assertThrows(SchemaJeneratorException.class, () -> validator.validateInstance(sample, schema));
    }
  }
}
