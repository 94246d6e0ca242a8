package com.cario.valuation.app.service;

import static com.cario.valuation.app.util.Money.round2;

import com.cario.valuation.app.engine.IdvEngine;
import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import com.cario.valuation.app.model.IdvRequest;
import com.cario.valuation.app.model.PriceDiscovery;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.model.VehicleAge;
import com.cario.valuation.app.model.VehicleRecord;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.log4j.Log4j2;

/**
 * IDV orchestration. An RC request is served from the cache when a live row exists for its key;
 * otherwise prices are discovered, the IDV computed, and a new row written.
 */
@Log4j2
@RequiredArgsConstructor
public class IdvService {

  private final RcLookupClient rcLookup;
  private final VehicleNormalizer normalizer;
  private final PriceDiscoveryClient priceDiscovery;
  private final IdvEngine engine;
  private final ValuationCacheService cache;
  private final Clock clock;

  /** Result plus where it came from. */
  @Value
  public static class Outcome {
    ValuationResult result;
    boolean cached;

    public String getSource() {
      return cached ? "database" : "api";
    }
  }

  /**
   * IDV for a registration number.
   *
   * @param skipCache bypass the cache read; the fresh result is still written
   */
  public Outcome valueByRc(String rcNumber, boolean skipCache) {
    VehicleRecord vehicle = normalizer.fromRc(rcLookup.lookup(rcNumber));
    CacheKey key = vehicle.cacheKey();
    LocalDate today = LocalDate.now(clock);

    if (!skipCache) {
      Optional<CacheRecord> hit = cache.lookup(key);
      if (hit.isPresent()) {
        log.info("idv.cache.hit key={} createdAt={}", key, hit.get().getCreatedAt());
        return new Outcome(fromCache(hit.get(), vehicle, today), true);
      }
      log.info("idv.cache.miss key={}", key);
    } else {
      log.info("idv.cache.skip key={}", key);
    }

    PriceDiscovery prices = priceDiscovery.discover(vehicle);
    ValuationResult result =
        engine.calculate(vehicle, prices.getOnRoadPrice(), prices.getMarketMedianEstimate(), today);
    Map<String, Object> metadata = result.getMetadata();
    metadata.put("rc_number", vehicle.getRegistrationNumber());
    if (prices.getVariantGuess() != null) metadata.put("variant_guess", prices.getVariantGuess());
    if (prices.getConfidenceHint() != null) {
      metadata.put("confidence_hint", prices.getConfidenceHint());
    }
    if (prices.getSource() != null) metadata.put("price_source", prices.getSource());

    cache.save(toRecord(key, vehicle, result, prices));
    return new Outcome(result, false);
  }

  /** IDV from caller-supplied attributes and prices; never touches the cache or collaborators. */
  public ValuationResult calculate(IdvRequest request) {
    VehicleRecord vehicle = normalizer.fromInput(request);
    double onRoad = request.getOriginalOnRoadPrice() == null ? 0 : request.getOriginalOnRoadPrice();
    LocalDate today = LocalDate.now(clock);
    return engine.calculate(vehicle, onRoad, request.getMarketMedianEstimate(), today);
  }

  /**
   * IDV for a registration number with caller-supplied prices. The vehicle comes from the RC
   * lookup; price discovery and the cache are not used.
   */
  public ValuationResult calculateForRc(
      String rcNumber, double originalOnRoadPrice, Double marketMedianEstimate) {
    VehicleRecord vehicle = normalizer.fromRc(rcLookup.lookup(rcNumber));
    ValuationResult result =
        engine.calculate(vehicle, originalOnRoadPrice, marketMedianEstimate, LocalDate.now(clock));
    result.getMetadata().put("rc_number", vehicle.getRegistrationNumber());
    log.info(
        "idv.rc.manualPrice rc={} onRoad={} idv={}",
        vehicle.getRegistrationNumber(),
        originalOnRoadPrice,
        result.getCalculatedIdv());
    return result;
  }

  /**
   * Rebuilds a response from a cached row. Monetary figures come back exactly as stored; age and
   * odometer are recomputed for the requesting vehicle.
   */
  static ValuationResult fromCache(CacheRecord row, VehicleRecord vehicle, LocalDate today) {
    VehicleAge age = VehicleAge.between(vehicle.getManufacturingDate(), today);
    int odometer = vehicle.getOdometer() == null ? age.estimatedOdometer() : vehicle.getOdometer();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("vehicle_age_months", age.getTotalMonths());
    metadata.put("depreciation_percent", row.getDepreciationPercent());
    metadata.put("original_on_road_price", row.getOnRoadPrice());
    if (row.getMarketMedianEstimate() != null) {
      metadata.put("market_median_estimate", row.getMarketMedianEstimate());
    }
    if (row.getVariantGuess() != null) metadata.put("variant_guess", row.getVariantGuess());
    if (row.getConfidenceHint() != null) metadata.put("confidence_hint", row.getConfidenceHint());
    if (row.getPriceSource() != null) metadata.put("price_source", row.getPriceSource());
    metadata.put("rc_number", vehicle.getRegistrationNumber());
    metadata.put("cached_rc_number", row.getRcNumber());
    metadata.put("cached_owner_count", row.getOwnerCount());
    metadata.put("cache_created_at", String.valueOf(row.getCreatedAt()));

    return ValuationResult.builder()
        .vehicleMake(vehicle.getMake())
        .vehicleModel(row.getFullModel() == null ? vehicle.getFullModel() : row.getFullModel())
        .baseModel(vehicle.getBaseModel())
        .variant(vehicle.getVariant())
        .manufacturingYear(vehicle.getManufacturingYear())
        .vehicleType(row.getVehicleType())
        .fuelType(row.getFuelType())
        .city(vehicle.getCity())
        .ownerCount(vehicle.getOwnerCount())
        .vehicleAge(age.label())
        .estimatedOdometer(odometer)
        .calculatedIdv(row.getCalculatedIdv())
        .validationStatus(row.getValidationStatus())
        .confidenceScore(row.getConfidenceScore())
        .differencePercent(row.getDifferencePercent())
        .metadata(metadata)
        .build();
  }

  static CacheRecord toRecord(
      CacheKey key, VehicleRecord vehicle, ValuationResult result, PriceDiscovery prices) {
    Object depreciation = result.getMetadata().get("depreciation_percent");
    return CacheRecord.builder()
        .key(key)
        .rcNumber(vehicle.getRegistrationNumber())
        .fullModel(vehicle.getFullModel())
        .vehicleType(result.getVehicleType())
        .fuelType(result.getFuelType())
        .ownerCount(vehicle.getOwnerCount())
        .calculatedIdv(result.getCalculatedIdv())
        .validationStatus(result.getValidationStatus())
        .confidenceScore(result.getConfidenceScore())
        .differencePercent(result.getDifferencePercent())
        .depreciationPercent(depreciation instanceof Number n ? n.doubleValue() : 0)
        .onRoadPrice(round2(prices.getOnRoadPrice()))
        .marketMedianEstimate(round2(prices.getMarketMedianEstimate()))
        .variantGuess(prices.getVariantGuess())
        .confidenceHint(prices.getConfidenceHint())
        .priceSource(prices.getSource())
        .build();
  }
}
