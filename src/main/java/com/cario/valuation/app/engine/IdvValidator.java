package com.cario.valuation.app.engine;

import lombok.Value;

/**
 * Checks a computed IDV against the market median and scores confidence.
 *
 * <p>A breach of the 20% band is a normal outcome ({@link #MANUAL_REVIEW}), not an error.
 */
public class IdvValidator {

  public static final String WITHIN_RANGE = "Within Acceptable Range";
  public static final String MANUAL_REVIEW = "Manual Review Required";
  public static final String NO_MARKET_DATA = "No Market Data";

  static final double MAX_DIFFERENCE_PERCENT = 20;
  static final double BASE_CONFIDENCE = 85;
  static final double NO_MEDIAN_CONFIDENCE = 75;
  static final double FAILED_VALIDATION_PENALTY = 20;

  /** {@code differencePercent} is null when no median was available. */
  @Value
  public static class Verdict {
    String status;
    Double differencePercent;
    double confidenceScore;
  }

  public Verdict validate(double calculatedIdv, Double marketMedian) {
    if (marketMedian == null || marketMedian <= 0) {
      return new Verdict(NO_MARKET_DATA, null, clamp(NO_MEDIAN_CONFIDENCE));
    }
    double difference = Math.abs(calculatedIdv - marketMedian) / marketMedian * 100;
    boolean failed = difference > MAX_DIFFERENCE_PERCENT;
    double score = BASE_CONFIDENCE - (failed ? FAILED_VALIDATION_PENALTY : 0);
    return new Verdict(failed ? MANUAL_REVIEW : WITHIN_RANGE, difference, clamp(score));
  }

  static double clamp(double score) {
    return Math.max(0, Math.min(100, score));
  }
}
