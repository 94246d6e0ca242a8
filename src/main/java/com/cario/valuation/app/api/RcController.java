package com.cario.valuation.app.api;

import com.cario.valuation.app.model.RawVehicleAttributes;
import com.cario.valuation.app.service.RcLookupClient;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/** Registry lookup without valuation. */
@Log4j2
@Validated
@RestController
@RequestMapping("/api/v1/rc")
@RequiredArgsConstructor
public class RcController {

  private final RcLookupClient rcLookupClient;

  @PostMapping(
      path = "/details",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ApiResponse<RawVehicleAttributes>> details(
      @RequestBody @Valid RcDetailsRequest req) {
    log.info("rc.details rc={}", req.getRcNumber());
    return ResponseEntity.ok(ApiResponse.ok(rcLookupClient.lookup(req.getRcNumber())));
  }

  @Data
  public static class RcDetailsRequest {
    @NotBlank private String rcNumber;
  }
}
