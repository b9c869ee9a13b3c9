package com.flamingo.ai.eventassistant.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for fan-out calls into the catalog, plus scheduling for housekeeping sweeps. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /** Sized to the catalog connection budget; used to resolve candidate details in parallel. */
  @Bean(name = "catalogLookupExecutor")
  public Executor catalogLookupExecutor(
      @Value("${catalog.lookup.pool-size:8}") int poolSize,
      @Value("${catalog.lookup.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("catalog-lookup-");
    executor.initialize();
    return executor;
  }
}
