package com.cario.valuation.app.engine.rules;

import java.util.List;
import lombok.Value;

/** Result of running a {@link RuleChain}: the adjusted value and the rules that fired. */
@Value
public class RuleOutcome {

  double initialValue;

  double value;

  List<String> appliedRules;

  /** Overall multiplier from initial to final value; 1.0 when the initial value is zero. */
  public double factor() {
    return initialValue == 0 ? 1.0 : value / initialValue;
  }
}
