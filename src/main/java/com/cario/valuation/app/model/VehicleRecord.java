package com.cario.valuation.app.model;

import java.time.YearMonth;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized vehicle snapshot consumed by every valuation pipeline.
 *
 * <ul>
 *   <li>{@code make} – manufacturer with corporate suffixes removed (e.g. {@code MARUTI SUZUKI})
 *   <li>{@code baseModel} – first token of the model, uppercased; the cache equivalence class
 *   <li>{@code fullModel}/{@code variant} – display only
 *   <li>{@code manufacturingDate} – month of manufacture; the only source of vehicle age
 *   <li>{@code registrationCode} – RTO prefix, used by regional rules only
 *   <li>{@code city} – uppercased registration city
 *   <li>{@code odometer} – actual reading in km, or {@code null} to use the estimate
 * </ul>
 *
 * <p>Instances are produced by {@code VehicleNormalizer}; downstream code assumes the fields above
 * are already validated.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VehicleRecord {

  private String registrationNumber;

  private String make;

  private String baseModel;

  private String fullModel;

  private String variant;

  private FuelType fuelType;

  private YearMonth manufacturingDate;

  private String registrationCode;

  private String city;

  private BodyType bodyType;

  private VehicleClass vehicleClass;

  private String color;

  @Builder.Default private int ownerCount = 1;

  private Integer odometer;

  /** Four-digit manufacturing year, as used in the cache key. */
  public String getManufacturingYear() {
    return manufacturingDate == null ? null : String.valueOf(manufacturingDate.getYear());
  }

  public CacheKey cacheKey() {
    return CacheKey.of(make, baseModel, getManufacturingYear(), city);
  }
}
