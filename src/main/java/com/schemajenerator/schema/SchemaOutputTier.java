package com.schemajenerator.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Strictness and metadata density of generated schemas, in increasing order.
 * Each tier looks up its rules in {@link TierPolicy}.
 */
public enum SchemaOutputTier {
  BASIC,
  STANDARD,
  COMPREHENSIVE,
  EXPERT;

  /** The user-facing spelling, as accepted on the command line and in config files. */
  @JsonValue
  public String cliName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Rules applied by every generator at this tier. */
  public TierPolicy policy() {
    return switch (this) {
      case BASIC -> TierPolicy.BASIC;
      case STANDARD -> TierPolicy.STANDARD;
      case COMPREHENSIVE -> TierPolicy.COMPREHENSIVE;
      case EXPERT -> TierPolicy.EXPERT;
    };
  }

  /**
   * Maps a user-facing tier name to the enum, ignoring case.
   *
   * @param value one of {@code basic|standard|comprehensive|expert}
   * @return the matching tier
   * @throws IllegalArgumentException if the name is not a known tier
   */
  @JsonCreator
  public static SchemaOutputTier fromString(String value) {
    if (value != null) {
      for (SchemaOutputTier tier : values()) {
        if (tier.name().equalsIgnoreCase(value.trim())) {
          return tier;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unknown schema tier '" + value + "', expected one of: " + names());
  }

  private static String names() {
    return Arrays.stream(values()).map(SchemaOutputTier::cliName).collect(Collectors.joining(", "));
  }

  @Override
  public String toString() {
    return cliName();
  }
}
