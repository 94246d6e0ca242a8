package com.cario.valuation.app.engine.rules;

import java.util.Objects;
import java.util.function.Predicate;
import lombok.Getter;

/** A named condition paired with the effect applied when it holds. */
@Getter
public final class AdjustmentRule {

  private final String name;
  private final Predicate<ValuationContext> condition;
  private final AdjustmentEffect effect;

  private AdjustmentRule(
      String name, Predicate<ValuationContext> condition, AdjustmentEffect effect) {
    this.name = Objects.requireNonNull(name, "name");
    this.condition = Objects.requireNonNull(condition, "condition");
    this.effect = Objects.requireNonNull(effect, "effect");
  }

  public static AdjustmentRule of(
      String name, Predicate<ValuationContext> condition, AdjustmentEffect effect) {
    return new AdjustmentRule(name, condition, effect);
  }

  public boolean matches(ValuationContext context) {
    return condition.test(context);
  }

  @Override
  public String toString() {
    return name;
  }
}
