package com.cario.valuation.app.config;

import com.cario.valuation.app.scheduler.CachePurgeScheduler;
import com.cario.valuation.app.service.ValuationCacheService;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("valuation-scheduler-");

    // Log any uncaught exception thrown by @Scheduled methods
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));

    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);

    RejectedExecutionHandler reh = new ThreadPoolExecutor.CallerRunsPolicy();
    scheduler.setRejectedExecutionHandler(reh);

    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "valuation.cache.purge",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public CachePurgeScheduler cachePurgeScheduler(ValuationCacheService cache) {
    return new CachePurgeScheduler(cache);
  }
}
