package com.cario.valuation.app.scheduler;

import com.cario.valuation.app.service.ValuationCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Physically drops cache rows past the validity window. Reads already ignore them, so this only
 * bounds storage.
 */
@Log4j2
@RequiredArgsConstructor
public class CachePurgeScheduler {

  private final ValuationCacheService cache;

  @Scheduled(cron = "${valuation.cache.purge.cron:0 0 3 * * *}")
  public void purge() {
    log.info("scheduler.purge.start");
    int removed = cache.purgeExpired();
    log.info("scheduler.purge.finish removed={}", removed);
  }
}
