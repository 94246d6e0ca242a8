package com.cario.valuation.app.model;

import java.util.List;
import lombok.Value;

/** Stored IDV rows for a history read; {@code rcNumber} is null for the recent-rows listing. */
@Value
public class ValuationHistory {

  String rcNumber;

  int count;

  List<CacheRecord> valuations;

  public static ValuationHistory of(String rcNumber, List<CacheRecord> valuations) {
    return new ValuationHistory(rcNumber, valuations.size(), List.copyOf(valuations));
  }
}
