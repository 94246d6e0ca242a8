package com.cario.valuation.app.engine;

import static com.cario.valuation.app.util.Money.percent;
import static com.cario.valuation.app.util.Money.round2;

import com.cario.valuation.app.engine.rules.RuleOutcome;
import com.cario.valuation.app.engine.rules.ValuationContext;
import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.MarketListing;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.model.VehicleAge;
import com.cario.valuation.app.model.VehicleRecord;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;

/**
 * Resale pipeline: depreciation grid, market intelligence, regional rules, owner penalty,
 * convergence with market listings and dealer economics.
 *
 * <p>Pure and deterministic for a fixed record, price, listing and date.
 */
@Log4j2
public class ResaleValuationEngine {

  static final double HIGH_USAGE_KM_PER_YEAR = 15_000;
  static final double LOW_USAGE_KM_PER_YEAR = 6_000;
  static final double HIGH_USAGE_PENALTY = 0.05;
  static final double LOW_USAGE_BONUS = -0.03;
  static final double MAX_DEPRECIATION = 0.75;

  private final MarketIntelligence marketIntelligence;
  private final RegionalAdjustment regionalAdjustment;
  private final ValuationConvergence convergence;
  private final DealerEconomics dealerEconomics;
  private final double annualPriceDecay;

  public ResaleValuationEngine(
      MarketIntelligence marketIntelligence,
      RegionalAdjustment regionalAdjustment,
      ValuationConvergence convergence,
      DealerEconomics dealerEconomics,
      double annualPriceDecay) {
    this.marketIntelligence = marketIntelligence;
    this.regionalAdjustment = regionalAdjustment;
    this.convergence = convergence;
    this.dealerEconomics = dealerEconomics;
    this.annualPriceDecay = annualPriceDecay;
  }

  /**
   * Values a vehicle for resale.
   *
   * @param vehicle normalized record
   * @param currentExShowroom today's ex-showroom price of the equivalent new vehicle, INR
   * @param listing observed market listings, may be {@code null}
   * @param today valuation date
   */
  public ValuationResult value(
      VehicleRecord vehicle, double currentExShowroom, MarketListing listing, LocalDate today) {
    if (currentExShowroom <= 0) {
      throw new ValidationException("current_ex_showroom must be positive");
    }

    VehicleAge age = VehicleAge.between(vehicle.getManufacturingDate(), today);
    boolean odometerEstimated = vehicle.getOdometer() == null;
    int odometer = odometerEstimated ? age.estimatedOdometer() : vehicle.getOdometer();

    double gridPercent = DepreciationGrids.resalePercent(age.getTotalMonths());
    double mileageAdjustment = mileageAdjustment(odometer, age);
    double depreciation = Math.max(0, Math.min(gridPercent + mileageAdjustment, MAX_DEPRECIATION));

    double historical =
        Math.max(0, currentExShowroom * (1 - annualPriceDecay * age.getFractionalYears()));
    double bookValue = historical * (1 - depreciation);

    ValuationContext ctx = new ValuationContext(vehicle, age, historical);
    RuleOutcome market = marketIntelligence.apply(bookValue, ctx);
    RuleOutcome regional = regionalAdjustment.apply(market.getValue(), ctx);

    double ownerPenalty = DealerEconomics.ownerPenalty(vehicle.getOwnerCount());
    double adjustedBook = regional.getValue() * (1 - ownerPenalty);

    ValuationConvergence.Outcome converged = convergence.converge(adjustedBook, listing, age);
    double fairMarket = converged.getFairMarketRetailValue();
    DealerEconomics.Terms terms = dealerEconomics.termsFor(vehicle.getBodyType());
    double dealerPrice = dealerEconomics.dealerPurchasePrice(fairMarket, vehicle.getBodyType());

    log.info(
        "valuation.resale make={} baseModel={} ageMonths={} depreciation={} market={}"
            + " regional={} fmv={}",
        vehicle.getMake(),
        vehicle.getBaseModel(),
        age.getTotalMonths(),
        depreciation,
        market.getAppliedRules(),
        regional.getAppliedRules(),
        round2(fairMarket));

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("vehicle_age_years", round2(age.getFractionalYears()));
    metadata.put("vehicle_age_months", age.getTotalMonths());
    metadata.put("estimated_odometer", odometer);
    metadata.put("odometer_estimated", odometerEstimated);
    metadata.put("base_depreciation_percent", percent(gridPercent));
    metadata.put("mileage_adjustment_percent", percent(mileageAdjustment));
    metadata.put("depreciation_percent", percent(depreciation));
    metadata.put("historical_reference_price", round2(historical));
    metadata.put("book_value", round2(bookValue));
    metadata.put("market_intelligence_factor", round2(market.factor()));
    metadata.put("market_intelligence_rules", market.getAppliedRules());
    metadata.put("regional_adjustment_factor", round2(regional.factor()));
    metadata.put("regional_rules", regional.getAppliedRules());
    metadata.put("owner_penalty_percent", percent(ownerPenalty));
    metadata.put("adjusted_book_value", round2(adjustedBook));
    if (listing != null && listing.isPresent()) {
      metadata.put("market_listings_mean", round2(listing.getMeanPrice()));
    }
    metadata.put("market_weight", converged.getMarketWeight());
    metadata.put("blended_value", round2(converged.getBlendedValue()));
    metadata.put("negotiation_gap_percent", percent(ValuationConvergence.NEGOTIATION_GAP));
    metadata.put("dealer_margin_percent", percent(terms.getMargin()));
    metadata.put("refurb_cost", terms.getRefurbCost());

    return ValuationResult.builder()
        .vehicleMake(vehicle.getMake())
        .vehicleModel(vehicle.getFullModel())
        .baseModel(vehicle.getBaseModel())
        .variant(vehicle.getVariant())
        .manufacturingYear(vehicle.getManufacturingYear())
        .fuelType(vehicle.getFuelType() == null ? null : vehicle.getFuelType().getLabel())
        .city(vehicle.getCity())
        .ownerCount(vehicle.getOwnerCount())
        .vehicleAge(age.label())
        .estimatedOdometer(odometer)
        .fairMarketRetailValue(round2(fairMarket))
        .dealerPurchasePrice(round2(dealerPrice))
        .metadata(metadata)
        .build();
  }

  /**
   * Depreciation shift for unusual running: more than 15,000 km a year adds five points, less than
   * 6,000 removes three.
   */
  static double mileageAdjustment(int odometer, VehicleAge age) {
    if (age.getTotalMonths() == 0) return 0;
    double perYear = odometer / age.getFractionalYears();
    if (perYear > HIGH_USAGE_KM_PER_YEAR) return HIGH_USAGE_PENALTY;
    if (perYear < LOW_USAGE_KM_PER_YEAR) return LOW_USAGE_BONUS;
    return 0;
  }
}
