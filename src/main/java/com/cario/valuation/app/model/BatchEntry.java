package com.cario.valuation.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-vehicle outcome of a batch valuation. Exactly one of {@code data} or {@code error}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchEntry {

  private int index;
  private boolean success;
  private ValuationResult data;
  private String error;

  public static BatchEntry ok(int index, ValuationResult data) {
    return new BatchEntry(index, true, data, null);
  }

  public static BatchEntry failed(int index, String error) {
    return new BatchEntry(index, false, null, error);
  }
}
