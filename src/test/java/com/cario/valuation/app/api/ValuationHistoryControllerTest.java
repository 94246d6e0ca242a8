package com.cario.valuation.app.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import com.cario.valuation.app.model.ValuationHistory;
import com.cario.valuation.app.service.ValuationHistoryService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = ValuationHistoryController.class)
class ValuationHistoryControllerTest {

  @Autowired private MockMvc mvc;

  @MockBean private ValuationHistoryService historyService;

  private static CacheRecord row() {
    return CacheRecord.builder()
        .key(CacheKey.of("HYUNDAI", "CRETA", "2021", "PUNE"))
        .createdAt(Instant.parse("2025-01-15T06:30:00Z"))
        .rcNumber("MH12AB0001")
        .calculatedIdv(812_345.67)
        .validationStatus("Within Acceptable Range")
        .build();
  }

  @Test
  void historyForRegistration() throws Exception {
    when(historyService.history("MH12AB0001"))
        .thenReturn(ValuationHistory.of("MH12AB0001", List.of(row())));

    mvc.perform(get("/api/v1/valuations/MH12AB0001"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.rc_number").value("MH12AB0001"))
        .andExpect(jsonPath("$.data.count").value(1))
        .andExpect(jsonPath("$.data.valuations[0].calculated_idv").value(812_345.67))
        .andExpect(jsonPath("$.data.valuations[0].key.base_model").value("CRETA"));
  }

  @Test
  void recentIsNotTreatedAsARegistrationNumber() throws Exception {
    when(historyService.recent(10)).thenReturn(ValuationHistory.of(null, List.of(row())));

    mvc.perform(get("/api/v1/valuations/recent"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.count").value(1))
        .andExpect(jsonPath("$.data.rc_number").doesNotExist());
    verify(historyService).recent(10);
  }

  @Test
  void recentPassesTheLimit() throws Exception {
    when(historyService.recent(3)).thenReturn(ValuationHistory.of(null, List.of()));

    mvc.perform(get("/api/v1/valuations/recent").param("limit", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.count").value(0));
  }

  @Test
  void nonNumericLimitIsMalformed() throws Exception {
    mvc.perform(get("/api/v1/valuations/recent").param("limit", "ten"))
        .andExpect(status().isBadRequest());
    verifyNoInteractions(historyService);
  }

  @Test
  void rejectedLimitIsABadRequest() throws Exception {
    when(historyService.recent(0)).thenThrow(new ValidationException("limit must be at least 1"));

    mvc.perform(get("/api/v1/valuations/recent").param("limit", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("limit must be at least 1"));
  }
}
