package com.cario.valuation.app.model;

import java.util.Locale;
import lombok.Value;

/** Exact-match cache key: normalized make, base model, manufacturing year and city. */
@Value
public class CacheKey {

  private static final String SEPARATOR = "#";

  String make;
  String baseModel;
  String year;
  String city;

  public static CacheKey of(String make, String baseModel, String year, String city) {
    return new CacheKey(upper(make), upper(baseModel), upper(year), upper(city));
  }

  /** Single-string form used as the DynamoDB partition key. */
  public String asString() {
    return String.join(SEPARATOR, make, baseModel, year, city);
  }

  @Override
  public String toString() {
    return asString();
  }

  private static String upper(String s) {
    return s == null ? "" : s.trim().toUpperCase(Locale.ROOT);
  }
}
