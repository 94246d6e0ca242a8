package com.cario.valuation.app.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted IDV computation: the monetary outputs together with the externally sourced prices
 * that produced them.
 *
 * <p>Rows are insert-only. Several rows may exist for one key; readers take the newest one inside
 * the validity window.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheRecord {

  private CacheKey key;

  private Instant createdAt;

  /** Registration number of the request that produced this row. */
  private String rcNumber;

  private String fullModel;

  private String vehicleType;

  private String fuelType;

  private Integer ownerCount;

  private double calculatedIdv;

  private String validationStatus;

  private double confidenceScore;

  private Double differencePercent;

  private double depreciationPercent;

  private double onRoadPrice;

  private Double marketMedianEstimate;

  private String variantGuess;

  private Double confidenceHint;

  private String priceSource;
}
