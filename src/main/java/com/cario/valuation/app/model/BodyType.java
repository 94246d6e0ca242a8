package com.cario.valuation.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Resale body classes; each carries its own dealer margin and refurbishment cost. */
public enum BodyType {
  HATCHBACK("Hatchback"),
  SEDAN("Sedan"),
  SUV("SUV"),
  LUXURY("Luxury");

  private final String label;

  BodyType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /**
   * Maps an RC or request body-type label to a resale body class. Two-wheelers are priced with the
   * hatchback economics; anything unrecognised falls back to {@link #HATCHBACK}.
   */
  @JsonCreator
  public static BodyType fromLabel(String raw) {
    if (raw == null || raw.isBlank()) return HATCHBACK;
    String s = raw.trim().toUpperCase(Locale.ROOT);
    switch (s) {
      case "SEDAN":
        return SEDAN;
      case "SUV":
      case "MUV":
        return SUV;
      case "LUXURY":
      case "COUPE":
      case "CONVERTIBLE":
        return LUXURY;
      default:
        return HATCHBACK;
    }
  }
}
