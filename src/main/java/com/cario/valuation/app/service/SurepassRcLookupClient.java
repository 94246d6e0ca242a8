package com.cario.valuation.app.service;

import com.cario.valuation.app.exception.CollaboratorException;
import com.cario.valuation.app.exception.MissingCredentialException;
import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.RawVehicleAttributes;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * RC lookup against a Surepass-style registry API: {@code POST {"id_number": rc, "enrich": true}}
 * with a bearer token, answered by {@code {"success": bool, "data": {...}, "message": ...}}.
 */
@Log4j2
public class SurepassRcLookupClient implements RcLookupClient {

  static final String FAILURE_MESSAGE = "Vehicle record lookup failed";

  private final WebClient webClient;
  private final String baseUrl;
  private final String apiToken;
  private final Duration timeout;
  private final ObjectMapper mapper =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public SurepassRcLookupClient(
      WebClient.Builder builder, String baseUrl, String apiToken, Duration timeout) {
    this.webClient = builder.build();
    this.baseUrl = baseUrl;
    this.apiToken = apiToken;
    this.timeout = timeout;
  }

  @Override
  public RawVehicleAttributes lookup(String rcNumber) {
    if (rcNumber == null || rcNumber.isBlank()) {
      throw new ValidationException("rc_number is required");
    }
    if (apiToken == null || apiToken.isBlank()) {
      throw new MissingCredentialException("RC lookup API token is not configured");
    }
    String rc = rcNumber.trim().toUpperCase(Locale.ROOT);

    Map<String, Object> response;
    try {
      response =
          webClient
              .post()
              .uri(baseUrl)
              .header("Authorization", "Bearer " + apiToken)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(Map.of("id_number", rc, "enrich", true))
              .retrieve()
              .bodyToMono(new ParameterizedTypeReference<Map<String, Object>>() {})
              .block(timeout);
    } catch (RuntimeException e) {
      log.error("rclookup.call failed rc={}", rc, e);
      throw new CollaboratorException(FAILURE_MESSAGE, e);
    }

    if (response == null || !Boolean.TRUE.equals(response.get("success"))) {
      log.warn(
          "rclookup.rejected rc={} message={}",
          rc,
          response == null ? null : response.get("message"));
      throw new CollaboratorException(FAILURE_MESSAGE);
    }
    if (!(response.get("data") instanceof Map<?, ?> data)) {
      log.warn("rclookup.nodata rc={}", rc);
      throw new CollaboratorException(FAILURE_MESSAGE);
    }

    RawVehicleAttributes attrs = mapper.convertValue(data, RawVehicleAttributes.class);
    if (attrs.getRcNumber() == null || attrs.getRcNumber().isBlank()) attrs.setRcNumber(rc);
    log.info(
        "rclookup.done rc={} maker={} model={}",
        rc,
        attrs.getMakerDescription(),
        attrs.getMakerModel());
    return attrs;
  }
}
