package com.cario.valuation.app.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/** Caller-supplied vehicle plus the prices the resale pipeline needs. */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ResaleRequest extends VehicleInput {

  /** Today's ex-showroom price of the equivalent new vehicle, INR. */
  @NotNull @Positive private Double currentExShowroom;

  private Double marketListingsMean;

  @Min(0)
  private Integer marketListingsCount;

  public MarketListing marketListing() {
    if (marketListingsMean == null) return null;
    return new MarketListing(marketListingsMean, marketListingsCount);
  }
}
