package com.cario.valuation.app.engine;

import com.cario.valuation.app.model.MarketListing;
import com.cario.valuation.app.model.VehicleAge;
import lombok.Value;

/**
 * Blends the adjusted book value with observed market listings, then takes off the negotiation
 * gap.
 */
public class ValuationConvergence {

  public static final double RELIABLE_MARKET_WEIGHT = 0.7;
  public static final double DEFAULT_MARKET_WEIGHT = 0.5;
  public static final double NEGOTIATION_GAP = 0.07;

  static final int RELIABLE_LISTING_COUNT = 3;
  static final int RELIABLE_MAX_AGE_MONTHS = 60;

  /** Outcome of convergence. {@code marketWeight} is zero when no listing was supplied. */
  @Value
  public static class Outcome {
    double marketWeight;
    double blendedValue;
    double fairMarketRetailValue;
  }

  public Outcome converge(double bookValue, MarketListing listing, VehicleAge age) {
    double weight = 0;
    double blended = bookValue;
    if (listing != null && listing.isPresent()) {
      weight = isReliable(listing, age) ? RELIABLE_MARKET_WEIGHT : DEFAULT_MARKET_WEIGHT;
      blended = listing.getMeanPrice() * weight + bookValue * (1 - weight);
    }
    return new Outcome(weight, blended, blended * (1 - NEGOTIATION_GAP));
  }

  /**
   * With a listing count, three or more listings make the sample reliable. Without one, the mean is
   * trusted for vehicles younger than five years, whose listings are more homogeneous.
   */
  static boolean isReliable(MarketListing listing, VehicleAge age) {
    if (listing.getListingCount() != null) {
      return listing.getListingCount() >= RELIABLE_LISTING_COUNT;
    }
    return age.getTotalMonths() < RELIABLE_MAX_AGE_MONTHS;
  }
}
