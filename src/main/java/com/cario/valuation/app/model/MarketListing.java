package com.cario.valuation.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Observed used-market asking prices for comparable vehicles. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketListing {

  /** Mean asking price across the listings. */
  private Double meanPrice;

  /** Number of listings behind the mean, when known. */
  private Integer listingCount;

  public boolean isPresent() {
    return meanPrice != null && meanPrice > 0;
  }
}
