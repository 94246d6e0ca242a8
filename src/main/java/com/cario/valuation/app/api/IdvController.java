package com.cario.valuation.app.api;

import com.cario.valuation.app.model.IdvRequest;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.service.IdvService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
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
@RequestMapping("/api/v1/idv")
@RequiredArgsConstructor
public class IdvController {

  private final IdvService idvService;

  // ------------------------------------------------------------
  // /api/v1/idv/gemini
  // ------------------------------------------------------------
  @PostMapping(
      path = "/gemini",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationResult>> byRc(
      @RequestBody @Valid IdvRcRequest req,
      @RequestParam(name = "skip_cache", defaultValue = "false") boolean skipCache) {
    log.info("idv.rc rc={} skipCache={}", req.getRcNumber(), skipCache);
    IdvService.Outcome outcome = idvService.valueByRc(req.getRcNumber(), skipCache);
    ApiResponse<ValuationResult> body =
        ApiResponse.<ValuationResult>builder()
            .data(outcome.getResult())
            .source(outcome.getSource())
            .cached(outcome.isCached())
            .build();
    return ResponseEntity.ok(body);
  }

  // ------------------------------------------------------------
  // /api/v1/idv/rc
  // ------------------------------------------------------------
  @PostMapping(
      path = "/rc",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationResult>> byRcWithPrices(
      @RequestBody @Valid IdvRcPriceRequest req) {
    log.info("idv.rc.manualPrice rc={} onRoad={}", req.getRcNumber(), req.getOriginalOnRoadPrice());
    ValuationResult result =
        idvService.calculateForRc(
            req.getRcNumber(), req.getOriginalOnRoadPrice(), req.getMarketMedianEstimate());
    return ResponseEntity.ok(ApiResponse.ok(result));
  }

  // ------------------------------------------------------------
  // /api/v1/idv/calculate
  // ------------------------------------------------------------
  @PostMapping(
      path = "/calculate",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationResult>> calculate(
      @RequestBody @Valid IdvRequest req) {
    log.info(
        "idv.calculate make={} model={} mfg={} onRoad={}",
        req.getMake(),
        req.getModel(),
        req.getManufacturingDate(),
        req.getOriginalOnRoadPrice());
    return ResponseEntity.ok(ApiResponse.ok(idvService.calculate(req)));
  }

  @Data
  public static class IdvRcRequest {
    @NotBlank private String rcNumber;
  }

  @Data
  public static class IdvRcPriceRequest {
    @NotBlank private String rcNumber;

    @NotNull @Positive private Double originalOnRoadPrice;

    private Double marketMedianEstimate;
  }
}
