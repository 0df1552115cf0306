// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/scheduler/SchedulerState.java
package com.wifi.features.extractor.scheduler;

/** Lifecycle states of the {@link PollingScheduler}. */
public enum SchedulerState {
  IDLE,
  RUNNING_CYCLE,
  STOPPED
}
