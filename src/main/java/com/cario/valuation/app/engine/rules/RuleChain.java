package com.cario.valuation.app.engine.rules;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;

/**
 * Ordered list of adjustment rules. Every rule is tested against the same context; matching rules
 * are applied one after another to the running value, in declaration order.
 */
@Log4j2
public final class RuleChain {

  private final String name;
  private final List<AdjustmentRule> rules;

  public RuleChain(String name, List<AdjustmentRule> rules) {
    this.name = name;
    this.rules = List.copyOf(rules);
  }

  public RuleOutcome apply(double initialValue, ValuationContext context) {
    double value = initialValue;
    List<String> applied = new ArrayList<>();
    for (AdjustmentRule rule : rules) {
      if (rule.matches(context)) {
        double next = rule.getEffect().apply(value, context);
        log.debug("rules.apply chain={} rule={} before={} after={}", name, rule, value, next);
        value = next;
        applied.add(rule.getName());
      }
    }
    return new RuleOutcome(initialValue, value, List.copyOf(applied));
  }
}
