package com.cario.valuation.app.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Untrusted price suggestions from the price-discovery collaborator. The on-road price feeds
 * depreciation; the market median is only ever used to validate the computed IDV.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceDiscovery {

  /** On-road price for the manufacturing year, in INR. */
  private double onRoadPrice;

  /** Current used-market median, or {@code null} when none was found. */
  private Double marketMedianEstimate;

  private String variantGuess;

  /** Collaborator's self-reported confidence (0..100). Reported, never scored. */
  private Double confidenceHint;

  /** Model that produced the suggestion. */
  private String source;
}
