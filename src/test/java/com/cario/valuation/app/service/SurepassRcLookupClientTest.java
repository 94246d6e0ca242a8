package com.cario.valuation.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.cario.valuation.app.exception.CollaboratorException;
import com.cario.valuation.app.exception.MissingCredentialException;
import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.RawVehicleAttributes;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class SurepassRcLookupClientTest {

  private static final String URL = "https://rc.example.test/api/v1/rc/rc-full";

  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  private SurepassRcLookupClient client(HttpStatus status, String body, String token) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header("Content-Type", "application/json")
                          .body(body)
                          .build());
                });
    return new SurepassRcLookupClient(builder, URL, token, Duration.ofSeconds(2));
  }

  @Test
  void successfulLookupMapsProviderFields() {
    String body =
        "{\"success\":true,\"data\":{\"rc_number\":\"KA01AB1234\","
            + "\"maker_description\":\"MARUTI SUZUKI INDIA LTD\",\"maker_model\":\"SWIFT VXI\","
            + "\"manufacturing_date_formatted\":\"2020-01\",\"fuel_type\":\"PETROL\","
            + "\"registered_at\":\"BANGALORE, Karnataka\",\"owner_number\":\"1\","
            + "\"insurance_company\":\"ignored\"}}";

    RawVehicleAttributes raw = client(HttpStatus.OK, body, "secret").lookup(" ka01ab1234 ");

    assertEquals("KA01AB1234", raw.getRcNumber());
    assertEquals("SWIFT VXI", raw.getMakerModel());
    assertEquals("2020-01", raw.getManufacturingDate());
    assertEquals("BANGALORE, Karnataka", raw.getRegisteredAt());
    assertEquals(HttpMethod.POST, lastRequest.get().method());
    assertEquals(URL, lastRequest.get().url().toString());
    assertEquals("Bearer secret", lastRequest.get().headers().getFirst("Authorization"));
  }

  @Test
  void missingRcNumberInPayloadIsFilledFromRequest() {
    String body = "{\"success\":true,\"data\":{\"maker_model\":\"CITY ZX\"}}";
    RawVehicleAttributes raw = client(HttpStatus.OK, body, "secret").lookup("mh02cd0001");
    assertEquals("MH02CD0001", raw.getRcNumber());
  }

  @Test
  void providerRejectionIsACollaboratorFailure() {
    String body = "{\"success\":false,\"message\":\"Invalid RC\"}";
    CollaboratorException e =
        assertThrows(
            CollaboratorException.class,
            () -> client(HttpStatus.OK, body, "secret").lookup("KA01AB1234"));
    assertEquals("Vehicle record lookup failed", e.getMessage());
  }

  @Test
  void missingDataIsACollaboratorFailure() {
    String body = "{\"success\":true,\"data\":\"none\"}";
    assertThrows(
        CollaboratorException.class,
        () -> client(HttpStatus.OK, body, "secret").lookup("KA01AB1234"));
  }

  @Test
  void httpErrorIsACollaboratorFailure() {
    assertThrows(
        CollaboratorException.class,
        () -> client(HttpStatus.BAD_GATEWAY, "{}", "secret").lookup("KA01AB1234"));
  }

  @Test
  void missingTokenFailsBeforeAnyCall() {
    assertThrows(
        MissingCredentialException.class,
        () -> client(HttpStatus.OK, "{}", " ").lookup("KA01AB1234"));
    assertEquals(null, lastRequest.get());
  }

  @Test
  void blankRcNumberIsInvalid() {
    assertThrows(
        ValidationException.class, () -> client(HttpStatus.OK, "{}", "secret").lookup(" "));
  }
}
