package com.cario.valuation.app.engine;

import com.cario.valuation.app.engine.rules.AdjustmentEffect;
import com.cario.valuation.app.engine.rules.AdjustmentRule;
import com.cario.valuation.app.engine.rules.RuleChain;
import com.cario.valuation.app.engine.rules.RuleOutcome;
import com.cario.valuation.app.engine.rules.ValuationContext;
import com.cario.valuation.app.model.FuelType;
import com.cario.valuation.app.model.VehicleRecord;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Location- and fuel-conditioned adjustments, evaluated independently and compounded in order:
 *
 * <ol>
 *   <li>NCR diesel past 9.5 years: scrap value, 2% of the reference price
 *   <li>NCR diesel from 8 to 9.5 years: −25%
 *   <li>South India RTO (KA, TS, TN, KL, AP): +12%
 *   <li>Coastal city (Mumbai, Chennai, Kolkata) from 5 years: −4%
 * </ol>
 */
public class RegionalAdjustment {

  public static final String NCR_DIESEL_SCRAP = "ncr-diesel-scrap";
  public static final String NCR_DIESEL_BAN = "ncr-diesel-ban";
  public static final String SOUTH_INDIA_PREMIUM = "south-india-premium";
  public static final String COASTAL_CORROSION = "coastal-corrosion";

  /** Delhi plus the Gurugram, Faridabad, Noida and Ghaziabad RTOs. */
  static final List<String> NCR_RTO_PREFIXES =
      List.of("DL", "HR26", "HR29", "HR51", "HR55", "HR72", "HR87", "UP14", "UP16");

  static final List<String> SOUTH_RTO_PREFIXES = List.of("KA", "TS", "TN", "KL", "AP");

  static final Set<String> COASTAL_CITIES = Set.of("MUMBAI", "CHENNAI", "KOLKATA");

  private static final Pattern NON_LETTERS = Pattern.compile("[^A-Z]+");

  private static final int DIESEL_BAN_FROM_MONTHS = 96;
  private static final int DIESEL_SCRAP_AFTER_MONTHS = 114;
  private static final int CORROSION_FROM_MONTHS = 60;

  private final RuleChain chain =
      new RuleChain(
          "regional",
          List.of(
              AdjustmentRule.of(
                  NCR_DIESEL_SCRAP,
                  ctx ->
                      isNcrDiesel(ctx) && ctx.getAge().getTotalMonths() > DIESEL_SCRAP_AFTER_MONTHS,
                  AdjustmentEffect.fractionOfReference(0.02)),
              AdjustmentRule.of(
                  NCR_DIESEL_BAN,
                  ctx -> {
                    int months = ctx.getAge().getTotalMonths();
                    return isNcrDiesel(ctx)
                        && months >= DIESEL_BAN_FROM_MONTHS
                        && months <= DIESEL_SCRAP_AFTER_MONTHS;
                  },
                  AdjustmentEffect.percent(-0.25)),
              AdjustmentRule.of(
                  SOUTH_INDIA_PREMIUM,
                  ctx -> startsWithAny(ctx.getVehicle().getRegistrationCode(), SOUTH_RTO_PREFIXES),
                  AdjustmentEffect.percent(0.12)),
              AdjustmentRule.of(
                  COASTAL_CORROSION,
                  ctx ->
                      isCoastal(ctx.getVehicle())
                          && ctx.getAge().getTotalMonths() >= CORROSION_FROM_MONTHS,
                  AdjustmentEffect.percent(-0.04))));

  public RuleOutcome apply(double value, ValuationContext context) {
    return chain.apply(value, context);
  }

  static boolean isNcrDiesel(ValuationContext ctx) {
    VehicleRecord v = ctx.getVehicle();
    return v.getFuelType() == FuelType.DIESEL
        && startsWithAny(v.getRegistrationCode(), NCR_RTO_PREFIXES);
  }

  /** Any word of the city naming a coastal city, so {@code MUMBAI (CENTRAL)} counts. */
  static boolean isCoastal(VehicleRecord v) {
    if (v.getCity() == null) return false;
    for (String token : NON_LETTERS.split(v.getCity().toUpperCase(Locale.ROOT))) {
      if (COASTAL_CITIES.contains(token)) return true;
    }
    return false;
  }

  private static boolean startsWithAny(String code, List<String> prefixes) {
    if (code == null) return false;
    String upper = code.toUpperCase(Locale.ROOT);
    for (String prefix : prefixes) {
      if (upper.startsWith(prefix)) return true;
    }
    return false;
  }
}
