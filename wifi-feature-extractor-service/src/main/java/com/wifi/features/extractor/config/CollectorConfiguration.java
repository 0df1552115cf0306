package com.wifi.features.extractor.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.wifi.features.extractor.scheduler.Sleeper;

/**
 * Infrastructure beans for the collection loop. The clock and sleeper are beans so that tests can
 * drive cycles without real time passing.
 */
@Configuration
public class CollectorConfiguration {

  @Bean
  public Clock collectorClock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper collectorSleeper() {
    return Sleeper.threadSleeper();
  }
}
