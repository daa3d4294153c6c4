package com.vitals.analytics.config;

import com.vitals.analytics.engine.AnalyticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AnalyticsConfig {

  private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AnalyticsEngine analyticsEngine(@Value("${vitals.analytics.window-size:50}") int windowSize,
                                         @Value("${vitals.analytics.z-threshold:2.0}") double zThreshold,
                                         Clock clock) {
    log.info("Analytics engine: window={} z-threshold={}", windowSize, zThreshold);
    return new AnalyticsEngine(windowSize, zThreshold, clock);
  }

  /**
   * Bounded pool for engine ingestion. A full queue pushes the work back onto the submitting
   * request thread instead of dropping the sample; after shutdown submissions are rejected.
   */
  @Bean
  public ThreadPoolTaskExecutor ingestExecutor(@Value("${vitals.ingest.core-pool-size:4}") int corePoolSize,
                                               @Value("${vitals.ingest.max-pool-size:8}") int maxPoolSize,
                                               @Value("${vitals.ingest.queue-capacity:1000}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("ingest-");
    executor.setRejectedExecutionHandler(new CallerRunsUnlessShutdownPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(5);
    return executor;
  }
}
