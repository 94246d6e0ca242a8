package com.cario.valuation.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Fuel categories recognised by the valuation rules. */
public enum FuelType {
  PETROL("Petrol"),
  DIESEL("Diesel"),
  CNG("CNG"),
  ELECTRIC("Electric");

  private final String label;

  FuelType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /**
   * Maps a free-form fuel description (RC record or request body) onto a fuel type.
   *
   * <p>Hybrid and dual-fuel descriptions resolve to the alternative fuel first: {@code
   * "PETROL/CNG"} is CNG, {@code "ELECTRIC(BOV)"} is Electric.
   *
   * @param raw fuel description, case-insensitive
   * @return the matching fuel type, or {@code null} when the description is not recognised
   */
  @JsonCreator
  public static FuelType fromLabel(String raw) {
    if (raw == null || raw.isBlank()) return null;
    String s = raw.trim().toUpperCase(Locale.ROOT);
    if (s.contains("ELECTRIC") || s.equals("EV") || s.contains("BATTERY") || s.contains("BOV")) {
      return ELECTRIC;
    }
    if (s.contains("CNG") || s.contains("LPG")) return CNG;
    if (s.contains("DIESEL")) return DIESEL;
    if (s.contains("PETROL") || s.contains("GASOLINE")) return PETROL;
    return null;
  }
}
