package com.cario.valuation.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of the resale or IDV pipeline.
 *
 * <p>Resale results carry {@code fairMarketRetailValue} and {@code dealerPurchasePrice}; IDV
 * results carry {@code calculatedIdv}, {@code validationStatus} and {@code confidenceScore}.
 * {@code metadata} exposes every intermediate quantity for audit.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValuationResult {

  private String vehicleMake;

  private String vehicleModel;

  private String baseModel;

  private String variant;

  private String manufacturingYear;

  private String vehicleType;

  private String fuelType;

  private String city;

  private Integer ownerCount;

  /** Age at the time the result was returned, e.g. {@code "5 years 2 months"}. */
  private String vehicleAge;

  /** Actual odometer when supplied, otherwise the age-based estimate. */
  private Integer estimatedOdometer;

  private Double fairMarketRetailValue;

  private Double dealerPurchasePrice;

  private Double calculatedIdv;

  private String validationStatus;

  private Double confidenceScore;

  private Double differencePercent;

  @Builder.Default private Map<String, Object> metadata = new LinkedHashMap<>();
}
