package com.cario.valuation.app.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cario.valuation.app.exception.CollaboratorException;
import com.cario.valuation.app.exception.MissingCredentialException;
import com.cario.valuation.app.model.RawVehicleAttributes;
import com.cario.valuation.app.service.RcLookupClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@WebMvcTest(controllers = RcController.class)
class RcControllerTest {

  private static final String RC_BODY = "{\"rc_number\":\"MH46CV4464\"}";

  @Autowired private MockMvc mvc;

  @MockBean private RcLookupClient rcLookupClient;

  private ResultActions postJson(String body) throws Exception {
    return mvc.perform(
        post("/api/v1/rc/details").contentType(MediaType.APPLICATION_JSON).content(body));
  }

  @Test
  void returnsRegistryRecordWithoutValuation() throws Exception {
    when(rcLookupClient.lookup("MH46CV4464"))
        .thenReturn(
            RawVehicleAttributes.builder()
                .rcNumber("MH46CV4464")
                .makerDescription("HYUNDAI MOTOR INDIA LTD")
                .makerModel("CRETA 1.6 SX")
                .manufacturingDate("2018-06")
                .ownerNumber("2")
                .build());

    postJson(RC_BODY)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.rc_number").value("MH46CV4464"))
        .andExpect(jsonPath("$.data.maker_model").value("CRETA 1.6 SX"))
        .andExpect(jsonPath("$.data.manufacturing_date_formatted").value("2018-06"))
        .andExpect(jsonPath("$.data.fuel_type").doesNotExist());
  }

  @Test
  void missingRcNumberIsRejected() throws Exception {
    postJson("{}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.field_errors[0].field").value("rc_number"));
    verifyNoInteractions(rcLookupClient);
  }

  @Test
  void missingTokenIsUnauthorized() throws Exception {
    when(rcLookupClient.lookup("MH46CV4464"))
        .thenThrow(new MissingCredentialException("RC lookup API token is not configured"));

    postJson(RC_BODY).andExpect(status().isUnauthorized());
  }

  @Test
  void lookupFailureIsAServerError() throws Exception {
    when(rcLookupClient.lookup("MH46CV4464"))
        .thenThrow(new CollaboratorException("Vehicle record lookup failed"));

    postJson(RC_BODY)
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Vehicle record lookup failed"));
  }
}
