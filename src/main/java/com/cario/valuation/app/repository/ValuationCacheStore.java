package com.cario.valuation.app.repository;

import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import java.util.List;
import java.util.Optional;

/**
 * Exact-match store of prior IDV computations.
 *
 * <p>Implementations must make every row visible atomically and must treat {@link #put} as a pure
 * insert: concurrent puts for one key each add a row and never overwrite one another. Rows older
 * than the validity window are logically absent whether or not they have been physically removed.
 */
public interface ValuationCacheStore {

  /**
   * Newest row for the key created inside the validity window.
   *
   * @param key normalized make, base model, year and city
   * @return the row, or empty when none is live
   */
  Optional<CacheRecord> get(CacheKey key);

  /** Inserts a new row; {@code record.createdAt} is assigned by the store when null. */
  void put(CacheRecord record);

  /**
   * Every row held for a registration number, newest first. Rows past the validity window are
   * included until they are physically removed.
   *
   * @param rcNumber normalized registration number
   */
  List<CacheRecord> findByRcNumber(String rcNumber);

  /** The newest rows across all keys, newest first, at most {@code limit} of them. */
  List<CacheRecord> findRecent(int limit);

  /**
   * Physically removes rows that have left the validity window.
   *
   * @return number of rows removed
   */
  int purgeExpired();
}
