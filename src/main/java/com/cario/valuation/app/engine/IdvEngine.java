package com.cario.valuation.app.engine;

import static com.cario.valuation.app.util.Money.percent;
import static com.cario.valuation.app.util.Money.round2;

import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.FuelType;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.model.VehicleAge;
import com.cario.valuation.app.model.VehicleClass;
import com.cario.valuation.app.model.VehicleRecord;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;

/**
 * IDV pipeline: class-specific depreciation grid, EV component split, owner penalty, then
 * validation against the market median.
 */
@Log4j2
public class IdvEngine {

  /** Share of an EV's price treated as battery, charger and electronics. */
  static final double EV_ACCESSORY_SHARE = 0.15;

  static final double EV_ACCESSORY_EXTRA_DEPRECIATION = 0.10;
  static final double EV_ACCESSORY_MAX_DEPRECIATION = 0.80;

  private final IdvValidator validator;

  public IdvEngine(IdvValidator validator) {
    this.validator = validator;
  }

  /**
   * Computes the insured declared value.
   *
   * @param vehicle normalized record
   * @param onRoadPrice on-road price for the manufacturing year, INR
   * @param marketMedian current used-market median, may be {@code null}
   * @param today valuation date
   */
  public ValuationResult calculate(
      VehicleRecord vehicle, double onRoadPrice, Double marketMedian, LocalDate today) {
    if (onRoadPrice <= 0) {
      throw new ValidationException("original_on_road_price must be positive");
    }

    VehicleAge age = VehicleAge.between(vehicle.getManufacturingDate(), today);
    VehicleClass vehicleClass =
        vehicle.getVehicleClass() == null ? VehicleClass.FOUR_WHEELER : vehicle.getVehicleClass();
    double depreciation = DepreciationGrids.idvPercent(vehicleClass, age.getTotalMonths());

    Map<String, Object> metadata = new LinkedHashMap<>();
    double idv;
    if (vehicle.getFuelType() == FuelType.ELECTRIC) {
      double accessoryDepreciation =
          Math.min(depreciation + EV_ACCESSORY_EXTRA_DEPRECIATION, EV_ACCESSORY_MAX_DEPRECIATION);
      double baseIdv = onRoadPrice * (1 - EV_ACCESSORY_SHARE) * (1 - depreciation);
      double accessoryIdv = onRoadPrice * EV_ACCESSORY_SHARE * (1 - accessoryDepreciation);
      idv = baseIdv + accessoryIdv;
      metadata.put("ev_base_idv", round2(baseIdv));
      metadata.put("ev_accessory_idv", round2(accessoryIdv));
      metadata.put("ev_accessory_depreciation_percent", percent(accessoryDepreciation));
    } else {
      idv = onRoadPrice * (1 - depreciation);
    }

    double ownerPenalty = DealerEconomics.ownerPenalty(vehicle.getOwnerCount());
    idv = idv * (1 - ownerPenalty);

    IdvValidator.Verdict verdict = validator.validate(idv, marketMedian);
    int odometer = vehicle.getOdometer() == null ? age.estimatedOdometer() : vehicle.getOdometer();

    log.info(
        "valuation.idv make={} baseModel={} class={} ageMonths={} depreciation={} idv={} status={}",
        vehicle.getMake(),
        vehicle.getBaseModel(),
        vehicleClass.getCode(),
        age.getTotalMonths(),
        depreciation,
        round2(idv),
        verdict.getStatus());

    metadata.put("vehicle_age_months", age.getTotalMonths());
    metadata.put("depreciation_percent", percent(depreciation));
    metadata.put("owner_penalty_percent", percent(ownerPenalty));
    metadata.put("original_on_road_price", round2(onRoadPrice));
    if (marketMedian != null && marketMedian > 0) {
      metadata.put("market_median_estimate", round2(marketMedian));
    }

    return ValuationResult.builder()
        .vehicleMake(vehicle.getMake())
        .vehicleModel(vehicle.getFullModel())
        .baseModel(vehicle.getBaseModel())
        .variant(vehicle.getVariant())
        .manufacturingYear(vehicle.getManufacturingYear())
        .vehicleType(vehicleClass.getCode())
        .fuelType(vehicle.getFuelType() == null ? null : vehicle.getFuelType().getLabel())
        .city(vehicle.getCity())
        .ownerCount(vehicle.getOwnerCount())
        .vehicleAge(age.label())
        .estimatedOdometer(odometer)
        .calculatedIdv(round2(idv))
        .validationStatus(verdict.getStatus())
        .confidenceScore(round2(verdict.getConfidenceScore()))
        .differencePercent(round2(verdict.getDifferencePercent()))
        .metadata(metadata)
        .build();
  }
}
