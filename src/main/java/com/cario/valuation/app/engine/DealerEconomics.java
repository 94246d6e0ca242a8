package com.cario.valuation.app.engine;

import com.cario.valuation.app.model.BodyType;
import java.util.EnumMap;
import java.util.Map;
import lombok.Value;

/** Dealer margin, refurbishment cost and the owner-count penalty. */
public class DealerEconomics {

  /** Margin fraction and flat refurbishment cost (INR) for one body class. */
  @Value
  public static class Terms {
    double margin;
    double refurbCost;
  }

  private static final Map<BodyType, Terms> TERMS = new EnumMap<>(BodyType.class);

  static {
    TERMS.put(BodyType.HATCHBACK, new Terms(0.10, 8_000));
    TERMS.put(BodyType.SEDAN, new Terms(0.12, 15_000));
    TERMS.put(BodyType.SUV, new Terms(0.12, 15_000));
    TERMS.put(BodyType.LUXURY, new Terms(0.15, 25_000));
  }

  public Terms termsFor(BodyType bodyType) {
    return TERMS.get(bodyType == null ? BodyType.HATCHBACK : bodyType);
  }

  /** Retail value less margin and refurbishment, never below zero. */
  public double dealerPurchasePrice(double fairMarketRetailValue, BodyType bodyType) {
    Terms terms = termsFor(bodyType);
    return Math.max(0, fairMarketRetailValue * (1 - terms.getMargin()) - terms.getRefurbCost());
  }

  /** 0% for a first owner, then 4% per additional owner up to 12% from the fourth owner on. */
  public static double ownerPenalty(int ownerCount) {
    if (ownerCount <= 1) return 0;
    return Math.min(ownerCount - 1, 3) * 0.04;
  }
}
