package com.cario.valuation.app.model;

import java.util.Locale;

/** Insurance vehicle class used to pick the IDV depreciation grid. */
public enum VehicleClass {
  TWO_WHEELER("2W"),
  FOUR_WHEELER("4W");

  private final String code;

  VehicleClass(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }

  /** Scooters, motorcycles and mopeds are two-wheelers; every other category is a four-wheeler. */
  public static VehicleClass fromCategory(String category) {
    if (category == null) return FOUR_WHEELER;
    String s = category.toUpperCase(Locale.ROOT);
    if (s.contains("SCOOTER")
        || s.contains("MOTORCYCLE")
        || s.contains("M-CYCLE")
        || s.contains("MOPED")
        || s.contains("2W")) {
      return TWO_WHEELER;
    }
    return FOUR_WHEELER;
  }

  public static VehicleClass fromCode(String code) {
    if (code != null && code.trim().equalsIgnoreCase("2W")) return TWO_WHEELER;
    return FOUR_WHEELER;
  }
}
