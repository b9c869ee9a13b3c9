package com.flamingo.ai.eventassistant.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring plus the clock that pipeline stages read "now" from. */
@Configuration
public class MetricsConfig {

  /** Enables {@code @Timed} on the pipeline stages. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags(
      @Value("${spring.application.name:event-assistant}") String application) {
    return registry -> registry.config().commonTags("application", application);
  }

  /** Source of "today" for resolving relative dates in queries. */
  @Bean
  public Clock clock(AssistantConfig assistantConfig) {
    return Clock.system(ZoneId.of(assistantConfig.getTimeZone()));
  }
}
