package com.cario.valuation.app.service;

import com.cario.valuation.app.exception.ValidationException;
import com.cario.valuation.app.model.CacheRecord;
import com.cario.valuation.app.model.ValuationHistory;
import com.cario.valuation.app.repository.ValuationCacheStore;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Read side of the stored IDV rows. Unlike the cache lookup, a store failure here is reported to
 * the caller.
 */
@Log4j2
@RequiredArgsConstructor
public class ValuationHistoryService {

  public static final int DEFAULT_RECENT_LIMIT = 10;
  public static final int MAX_RECENT_LIMIT = 100;

  private final ValuationCacheStore store;

  /** Every stored row for the registration number, newest first. */
  public ValuationHistory history(String rcNumber) {
    if (rcNumber == null || rcNumber.isBlank()) {
      throw new ValidationException("rc_number is required");
    }
    String rc = rcNumber.trim().toUpperCase(Locale.ROOT);
    List<CacheRecord> rows = store.findByRcNumber(rc);
    log.info("history.rc rc={} rows={}", rc, rows.size());
    return ValuationHistory.of(rc, rows);
  }

  /** The newest rows across all vehicles; {@code limit} is capped at {@value #MAX_RECENT_LIMIT}. */
  public ValuationHistory recent(int limit) {
    if (limit < 1) throw new ValidationException("limit must be at least 1");
    List<CacheRecord> rows = store.findRecent(Math.min(limit, MAX_RECENT_LIMIT));
    log.info("history.recent limit={} rows={}", limit, rows.size());
    return ValuationHistory.of(null, rows);
  }
}
