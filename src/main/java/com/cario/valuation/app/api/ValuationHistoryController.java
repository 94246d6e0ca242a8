package com.cario.valuation.app.api;

import com.cario.valuation.app.model.ValuationHistory;
import com.cario.valuation.app.service.ValuationHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Stored IDV computations, by registration number or most recent first. */
@Log4j2
@RestController
@RequestMapping("/api/v1/valuations")
@RequiredArgsConstructor
public class ValuationHistoryController {

  private final ValuationHistoryService historyService;

  // ------------------------------------------------------------
  // /api/v1/valuations/recent
  // ------------------------------------------------------------
  @GetMapping(path = "/recent", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationHistory>> recent(
      @RequestParam(name = "limit", defaultValue = "10") int limit) {
    log.info("valuations.recent limit={}", limit);
    return ResponseEntity.ok(ApiResponse.ok(historyService.recent(limit)));
  }

  // ------------------------------------------------------------
  // /api/v1/valuations/{rc_number}
  // ------------------------------------------------------------
  @GetMapping(path = "/{rcNumber}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<ValuationHistory>> byRcNumber(
      @PathVariable("rcNumber") String rcNumber) {
    log.info("valuations.history rc={}", rcNumber);
    return ResponseEntity.ok(ApiResponse.ok(historyService.history(rcNumber)));
  }
}
