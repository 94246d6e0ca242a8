package com.cario.valuation.app.engine;

import com.cario.valuation.app.engine.rules.AdjustmentEffect;
import com.cario.valuation.app.engine.rules.AdjustmentRule;
import com.cario.valuation.app.engine.rules.RuleChain;
import com.cario.valuation.app.engine.rules.RuleOutcome;
import com.cario.valuation.app.engine.rules.ValuationContext;
import com.cario.valuation.app.model.VehicleRecord;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle and desirability penalties on the resale book value, compounded in order:
 *
 * <ol>
 *   <li>discontinued model, −15%
 *   <li>newer generation on sale and vehicle older than 3 years, −10%
 *   <li>known colour outside white/silver/grey/black, −2%
 * </ol>
 */
public class MarketIntelligence {

  public static final String DISCONTINUED = "discontinued-model";
  public static final String NEW_GENERATION = "new-generation-launched";
  public static final String NON_PREFERRED_COLOR = "non-preferred-color";

  static final Set<String> PREFERRED_COLORS = Set.of("WHITE", "SILVER", "GREY", "GRAY", "BLACK");

  private static final int NEW_GENERATION_MIN_AGE_MONTHS = 36;

  private final RuleChain chain;

  public MarketIntelligence(ModelCatalog catalog) {
    this.chain =
        new RuleChain(
            "market-intelligence",
            List.of(
                AdjustmentRule.of(
                    DISCONTINUED,
                    ctx -> catalog.isDiscontinued(ctx.getVehicle().getFullModel()),
                    AdjustmentEffect.percent(-0.15)),
                AdjustmentRule.of(
                    NEW_GENERATION,
                    ctx ->
                        catalog.hasNewGeneration(ctx.getVehicle().getFullModel())
                            && ctx.getAge().getTotalMonths() > NEW_GENERATION_MIN_AGE_MONTHS,
                    AdjustmentEffect.percent(-0.10)),
                AdjustmentRule.of(
                    NON_PREFERRED_COLOR,
                    ctx -> isNonPreferredColor(ctx.getVehicle()),
                    AdjustmentEffect.percent(-0.02))));
  }

  public RuleOutcome apply(double bookValue, ValuationContext context) {
    return chain.apply(bookValue, context);
  }

  /** An unknown colour is not penalised. */
  private static boolean isNonPreferredColor(VehicleRecord vehicle) {
    String color = vehicle.getColor();
    if (color == null || color.isBlank()) return false;
    return !PREFERRED_COLORS.contains(color.trim().toUpperCase(Locale.ROOT));
  }
}
