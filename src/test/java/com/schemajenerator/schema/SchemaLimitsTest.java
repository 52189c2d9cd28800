package com.schemajenerator.schema;

import static org.junit.jupiter.api.Assertions.*;

import com.schemajenerator.exceptions.SchemaJeneratorException;
import com.schemajenerator.models.SchemaJeneratorError;
import org.junit.jupiter.api.Test;

class SchemaLimitsTest {

  @Test
  void scaledMultipliesWithinRange() throws Exception {
    assertEquals(10, SchemaLimits.scaled(2, 5, "maxItems"));
    assertEquals(0, SchemaLimits.scaled(2, 0, "maxLength"));
  }

  @Test
  void scaledAtIntBoundaryIsExact() throws Exception {
    assertEquals(Integer.MAX_VALUE - 1, SchemaLimits.scaled(2, Integer.MAX_VALUE / 2, "maxItems"));
  }

  @Test
  void scaledPastIntRangeIsReportedAsOverflow() {
    SchemaJeneratorException e =
        assertThrows(
            SchemaJeneratorException.class,
            () -> SchemaLimits.scaled(2, Integer.MAX_VALUE / 2 + 1, "maxLength"));

    assertEquals(SchemaJeneratorError.ErrorCode.NUMERIC_RANGE_OVERFLOW.getCode(), e.getErrorCode());
    assertTrue(e.getMessage().contains("maxLength"));
    assertTrue(e.getMessage().contains(Integer.toString(Integer.MAX_VALUE / 2 + 1)));
  }

  @Test
  void overflowNamesKeywordAndValue() {
    SchemaJeneratorException e = SchemaLimits.overflow("maximum", "9223372036854775807", "x");

    assertEquals("GEN_001", e.getErrorCode());
    assertTrue(
        e.getMessage()
            .contains("maximum derived from 9223372036854775807 is not representable"));
  }
}
