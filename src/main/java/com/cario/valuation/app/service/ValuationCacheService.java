package com.cario.valuation.app.service;

import com.cario.valuation.app.model.CacheKey;
import com.cario.valuation.app.model.CacheRecord;
import com.cario.valuation.app.repository.ValuationCacheStore;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

/**
 * Front for the cache store that never lets a store failure fail a valuation: a broken read is a
 * miss, a broken write is skipped.
 */
@Log4j2
@RequiredArgsConstructor
public class ValuationCacheService {

  private final ValuationCacheStore store;

  public Optional<CacheRecord> lookup(CacheKey key) {
    try {
      Optional<CacheRecord> hit = store.get(key);
      log.debug("cache.get key={} hit={}", key, hit.isPresent());
      return hit;
    } catch (RuntimeException e) {
      log.warn("cache.get failed key={} reason={}", key, e.toString());
      return Optional.empty();
    }
  }

  public void save(CacheRecord record) {
    try {
      store.put(record);
      log.info("cache.put key={} idv={}", record.getKey(), record.getCalculatedIdv());
    } catch (RuntimeException e) {
      log.warn("cache.put failed key={} reason={}", record.getKey(), e.toString());
    }
  }

  /** Removes expired rows; returns the number removed, or 0 when the store failed. */
  public int purgeExpired() {
    try {
      return store.purgeExpired();
    } catch (RuntimeException e) {
      log.warn("cache.purge failed reason={}", e.toString());
      return 0;
    }
  }
}
