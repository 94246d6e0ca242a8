package com.cario.valuation.app.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cario.valuation.app.exception.CollaboratorException;
import com.cario.valuation.app.exception.MissingCredentialException;
import com.cario.valuation.app.model.IdvRequest;
import com.cario.valuation.app.model.ValuationResult;
import com.cario.valuation.app.service.IdvService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@WebMvcTest(controllers = IdvController.class)
class IdvControllerTest {

  private static final String RC_BODY = "{\"rc_number\":\"KA01AB1234\"}";

  @Autowired private MockMvc mvc;

  @MockBean private IdvService idvService;

  private ResultActions postJson(String path, String body) throws Exception {
    return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
  }

  private static ValuationResult idv() {
    return ValuationResult.builder()
        .vehicleMake("MARUTI SUZUKI")
        .vehicleType("4W")
        .calculatedIdv(337_500.0)
        .validationStatus("Within Acceptable Range")
        .confidenceScore(85.0)
        .differencePercent(19.64)
        .build();
  }

  @Test
  void freshComputationIsReportedAsApi() throws Exception {
    when(idvService.valueByRc("KA01AB1234", false))
        .thenReturn(new IdvService.Outcome(idv(), false));

    postJson("/api/v1/idv/gemini", RC_BODY)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.source").value("api"))
        .andExpect(jsonPath("$.cached").value(false))
        .andExpect(jsonPath("$.data.calculated_idv").value(337_500.0))
        .andExpect(jsonPath("$.data.vehicle_type").value("4W"))
        .andExpect(jsonPath("$.data.validation_status").value("Within Acceptable Range"));
  }

  @Test
  void cacheHitIsReportedAsDatabase() throws Exception {
    when(idvService.valueByRc("KA01AB1234", false)).thenReturn(new IdvService.Outcome(idv(), true));

    postJson("/api/v1/idv/gemini", RC_BODY)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.source").value("database"))
        .andExpect(jsonPath("$.cached").value(true));
  }

  @Test
  void skipCacheFlagIsPassedThrough() throws Exception {
    when(idvService.valueByRc("KA01AB1234", true)).thenReturn(new IdvService.Outcome(idv(), false));

    postJson("/api/v1/idv/gemini?skip_cache=true", RC_BODY).andExpect(status().isOk());

    verify(idvService).valueByRc("KA01AB1234", true);
  }

  @Test
  void blankRcNumberIsRejected() throws Exception {
    postJson("/api/v1/idv/gemini", "{\"rc_number\":\" \"}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field_errors[0].field").value("rc_number"));
    verifyNoInteractions(idvService);
  }

  @Test
  void missingCredentialIsUnauthorized() throws Exception {
    when(idvService.valueByRc("KA01AB1234", false))
        .thenThrow(new MissingCredentialException("RC lookup API token is not configured"));

    postJson("/api/v1/idv/gemini", RC_BODY)
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("RC lookup API token is not configured"));
  }

  @Test
  void priceDiscoveryFailureIsAServerError() throws Exception {
    when(idvService.valueByRc("KA01AB1234", false))
        .thenThrow(new CollaboratorException("Price discovery failed"));

    postJson("/api/v1/idv/gemini", RC_BODY)
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Price discovery failed"));
  }

  @Test
  void unexpectedFailureHidesDetails() throws Exception {
    when(idvService.valueByRc("KA01AB1234", false))
        .thenThrow(new IllegalStateException("connection pool exhausted"));

    postJson("/api/v1/idv/gemini", RC_BODY)
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Internal error"));
  }

  @Test
  void manualCalculation() throws Exception {
    when(idvService.calculate(any(IdvRequest.class))).thenReturn(idv());
    String body =
        "{\"make\":\"Maruti Suzuki\",\"model\":\"Swift\",\"fuel_type\":\"Petrol\","
            + "\"manufacturing_date\":\"2020-01\",\"rto_code\":\"KA01\",\"city\":\"Bangalore\","
            + "\"vehicle_type\":\"4W\",\"original_on_road_price\":750000}";

    postJson("/api/v1/idv/calculate", body)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.calculated_idv").value(337_500.0))
        .andExpect(jsonPath("$.source").doesNotExist());
  }

  @Test
  void manualCalculationNeedsOnRoadPrice() throws Exception {
    String body =
        "{\"make\":\"Maruti Suzuki\",\"model\":\"Swift\",\"fuel_type\":\"Petrol\","
            + "\"manufacturing_date\":\"2020-01\",\"rto_code\":\"KA01\",\"city\":\"Bangalore\"}";

    postJson("/api/v1/idv/calculate", body)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field_errors[0].field").value("original_on_road_price"));
    verifyNoInteractions(idvService);
  }

  @Test
  void rcWithSuppliedPrices() throws Exception {
    when(idvService.calculateForRc("DL08AB1234", 66_000.0, 42_000.0)).thenReturn(idv());
    String body =
        "{\"rc_number\":\"DL08AB1234\",\"original_on_road_price\":66000,"
            + "\"market_median_estimate\":42000}";

    postJson("/api/v1/idv/rc", body)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.calculated_idv").value(337_500.0))
        .andExpect(jsonPath("$.source").doesNotExist());
  }

  @Test
  void rcWithSuppliedPricesNeedsOnRoadPrice() throws Exception {
    postJson("/api/v1/idv/rc", RC_BODY)
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field_errors[0].field").value("original_on_road_price"));
    verifyNoInteractions(idvService);
  }
}
