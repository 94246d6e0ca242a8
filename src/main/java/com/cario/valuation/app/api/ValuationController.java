package com.cario.valuation.app.api;

import com.cario.valuation.app.model.BatchEntry;
import com.cario.valuation.app.model.MarketListing;
import com.cario.valuation.app.model.ResaleRequest;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.service.ValuationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequestMapping("/api/v1/valuation")
@RequiredArgsConstructor
public class ValuationController {

  private final ValuationService valuationService;

  // ------------------------------------------------------------
  // /api/v1/valuation/manual
  // ------------------------------------------------------------
  @PostMapping(
      path = "/manual",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationResult>> manual(
      @RequestBody @Valid ResaleRequest req) {
    log.info(
        "valuation.manual make={} model={} mfg={} city={}",
        req.getMake(),
        req.getModel(),
        req.getManufacturingDate(),
        req.getCity());
    return ResponseEntity.ok(ApiResponse.ok(valuationService.valueManual(req)));
  }

  // ------------------------------------------------------------
  // /api/v1/valuation/rc
  // ------------------------------------------------------------
  @PostMapping(
      path = "/rc",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationResult>> byRc(
      @RequestBody @Valid RcValuationRequest req) {
    log.info("valuation.rc rc={} exShowroom={}", req.getRcNumber(), req.getCurrentExShowroom());
    MarketListing listing =
        req.getMarketListingsMean() == null
            ? null
            : new MarketListing(req.getMarketListingsMean(), req.getMarketListingsCount());
    ValuationResult result =
        valuationService.valueByRc(req.getRcNumber(), req.getCurrentExShowroom(), listing);
    return ResponseEntity.ok(ApiResponse.ok(result));
  }

  // ------------------------------------------------------------
  // /api/v1/valuation/batch
  // ------------------------------------------------------------
  @PostMapping(
      path = "/batch",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<List<BatchEntry>>> batch(
      @RequestBody @Valid BatchRequest req) {
    log.info("valuation.batch size={}", req.getVehicles().size());
    return ResponseEntity.ok(ApiResponse.ok(valuationService.valueBatch(req.getVehicles())));
  }

  // ============================================================
  // Request DTOs
  // ============================================================

  @Data
  public static class RcValuationRequest {
    @NotBlank private String rcNumber;

    @NotNull @Positive private Double currentExShowroom;

    private Double marketListingsMean;

    @Min(0)
    private Integer marketListingsCount;
  }

  /** Entries are validated one by one inside the batch, not up front. */
  @Data
  public static class BatchRequest {
    @NotEmpty private List<ResaleRequest> vehicles;
  }
}
