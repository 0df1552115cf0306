// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/scheduler/Sleeper.java
package com.wifi.features.extractor.scheduler;

import java.time.Duration;

/** Pauses the polling thread between cycles. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  static Sleeper threadSleeper() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
