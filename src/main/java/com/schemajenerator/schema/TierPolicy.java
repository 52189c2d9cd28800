package com.schemajenerator.schema;

/**
 * The per-tier rule table consulted by the generators. Strictness is data
 * here, the generators hold no tier-specific branches.
 *
 * <p>Nullable components mean "keyword not emitted".
 *
 * @param requiredProperties which object keys are listed in {@code required}
 * @param additionalProperties value of {@code additionalProperties}, or null
 * @param minProperties value of {@code minProperties}, or null
 * @param declareDialect whether object schemas carry {@code $schema}
 * @param minItems value of {@code minItems} for non-empty arrays, or null
 * @param maxItemsFactor {@code maxItems} is this factor times the array length, or null
 * @param uniqueItems whether non-empty arrays carry {@code uniqueItems: true}
 * @param minLength whether strings carry {@code minLength: 0}
 * @param maxLengthFactor {@code maxLength} is this factor times the UTF-8 length, or null
 * @param examples whether scalars carry their literal value in {@code examples}
 * @param sniffStringFormat whether strings get a detected {@code format} or {@code pattern}
 * @param numericBounds how {@code minimum} and {@code maximum} are derived
 * @param integerMultipleOf whether integers carry {@code multipleOf: 1}
 * @param metadata whether {@code title} and {@code description} are emitted
 */
public record TierPolicy(
    RequiredProperties requiredProperties,
    Boolean additionalProperties,
    Integer minProperties,
    boolean declareDialect,
    Integer minItems,
    Integer maxItemsFactor,
    boolean uniqueItems,
    boolean minLength,
    Integer maxLengthFactor,
    boolean examples,
    boolean sniffStringFormat,
    NumericBounds numericBounds,
    boolean integerMultipleOf,
    boolean metadata) {

  /** Which keys of an object end up in {@code required}. */
  public enum RequiredProperties {
    NONE,
    /** Keys whose value is not JSON null */
    NON_NULL,
    ALL
  }

  /** How numeric bounds are derived from the sample value. */
  public enum NumericBounds {
    NONE,
    /** {@code minimum} is the value itself */
    LITERAL_MINIMUM,
    /** {@code minimum}/{@code maximum} are the value -/+ a fixed window */
    WINDOW
  }

  public static final TierPolicy BASIC =
      new TierPolicy(
          RequiredProperties.NONE,
          null,
          null,
          false,
          null,
          null,
          false,
          false,
          null,
          false,
          false,
          NumericBounds.NONE,
          false,
          false);

  public static final TierPolicy STANDARD =
      new TierPolicy(
          RequiredProperties.NON_NULL,
          true,
          null,
          false,
          0,
          null,
          false,
          true,
          null,
          false,
          false,
          NumericBounds.LITERAL_MINIMUM,
          false,
          false);

  public static final TierPolicy COMPREHENSIVE =
      new TierPolicy(
          RequiredProperties.ALL,
          false,
          1,
          true,
          1,
          2,
          false,
          true,
          2,
          true,
          false,
          NumericBounds.WINDOW,
          false,
          false);

  public static final TierPolicy EXPERT =
      new TierPolicy(
          RequiredProperties.ALL,
          false,
          1,
          true,
          1,
          2,
          true,
          true,
          2,
          true,
          true,
          NumericBounds.WINDOW,
          true,
          true);
}
