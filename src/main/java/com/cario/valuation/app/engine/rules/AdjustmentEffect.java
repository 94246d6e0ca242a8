package com.cario.valuation.app.engine.rules;

/** What a matching rule does to the running value. */
@FunctionalInterface
public interface AdjustmentEffect {

  double apply(double value, ValuationContext context);

  /** Multiplies the running value by {@code 1 + percent}; {@code -0.25} is a 25% penalty. */
  static AdjustmentEffect percent(double percent) {
    return (value, ctx) -> value * (1 + percent);
  }

  /** Adds a signed absolute amount to the running value. */
  static AdjustmentEffect absolute(double delta) {
    return (value, ctx) -> value + delta;
  }

  /** Discards the running value and substitutes a fraction of the reference price. */
  static AdjustmentEffect fractionOfReference(double fraction) {
    return (value, ctx) -> ctx.getReferencePrice() * fraction;
  }
}
