package com.cario.valuation.app.service;

import com.cario.valuation.app.engine.ResaleValuationEngine;
import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.exception.ValuationException;
import com.cario.valuation.app.model.BatchEntry;
import com.cario.valuation.app.model.MarketListing;
import com.cario.valuation.app.model.RawVehicleAttributes;
import com.cario.valuation.app.model.ResaleRequest;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.model.VehicleRecord;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/** Resale valuation for caller-supplied vehicles, RC lookups and batches. */
@Log4j2
@RequiredArgsConstructor
public class ValuationService {

  private final VehicleNormalizer normalizer;
  private final RcLookupClient rcLookup;
  private final ResaleValuationEngine engine;
  private final Clock clock;

  public ValuationResult valueManual(ResaleRequest request) {
    VehicleRecord vehicle = normalizer.fromInput(request);
    return engine.value(
        vehicle, exShowroom(request.getCurrentExShowroom()), request.marketListing(), today());
  }

  public ValuationResult valueByRc(
      String rcNumber, Double currentExShowroom, MarketListing listing) {
    double exShowroom = exShowroom(currentExShowroom);
    RawVehicleAttributes raw = rcLookup.lookup(rcNumber);
    VehicleRecord vehicle = normalizer.fromRc(raw);
    ValuationResult result = engine.value(vehicle, exShowroom, listing, today());
    result.getMetadata().put("rc_number", vehicle.getRegistrationNumber());
    if (raw.getRegistrationDate() != null) {
      result.getMetadata().put("registration_date", raw.getRegistrationDate());
    }
    return result;
  }

  /** Values each entry on its own; one bad entry never fails the others. */
  public List<BatchEntry> valueBatch(List<ResaleRequest> requests) {
    if (requests == null || requests.isEmpty()) {
      throw new ValidationException("vehicles must not be empty");
    }
    List<BatchEntry> out = new ArrayList<>(requests.size());
    for (int i = 0; i < requests.size(); i++) {
      try {
        ResaleRequest request = requests.get(i);
        if (request == null) throw new ValidationException("vehicle details are empty");
        out.add(BatchEntry.ok(i, valueManual(request)));
      } catch (ValuationException e) {
        out.add(BatchEntry.failed(i, e.getMessage()));
      } catch (RuntimeException e) {
        log.error("valuation.batch entry failed index={}", i, e);
        out.add(BatchEntry.failed(i, "Internal error"));
      }
    }
    long failed = out.stream().filter(e -> !e.isSuccess()).count();
    log.info("valuation.batch size={} failed={}", out.size(), failed);
    return out;
  }

  private static double exShowroom(Double value) {
    if (value == null || value <= 0) {
      throw new ValidationException("current_ex_showroom must be positive");
    }
    return value;
  }

  private LocalDate today() {
    return LocalDate.now(clock);
  }
}
