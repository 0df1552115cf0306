// wifi-feature-extractor-service/src/main/java/com/wifi/features/extractor/scheduler/PollingScheduler.java
package com.wifi.features.extractor.scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.wifi.features.extractor.config.properties.PollingConfigurationProperties;
import com.wifi.features.extractor.dto.CycleResult;
import com.wifi.features.extractor.service.CollectionCycleService;

/**
 * Drives collection cycles on a dedicated thread, sleeping a fixed interval after every cycle.
 *
 * <p>The interval is measured from the end of one cycle to the start of the next, so cycles never
 * overlap. A cycle that fails, or throws unexpectedly, is logged and the loop carries on.
 *
 * <p><strong>Lifecycle:</strong>
 *
 * <ol>
 *   <li>{@link #start()} runs once the application is ready, if polling is enabled
 *   <li>{@link #stop()} lets an in-flight cycle finish and wakes a sleeping loop
 *   <li>{@link #awaitTermination(Duration)} waits for the loop thread to exit
 * </ol>
 */
@Component
public class PollingScheduler {

  private static final Logger logger = LoggerFactory.getLogger(PollingScheduler.class);
  static final String THREAD_NAME = "feature-poller";

  private final CollectionCycleService cycleService;
  private final PollingConfigurationProperties pollingConfig;
  private final Sleeper sleeper;
  private final Duration interval;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile SchedulerState state = SchedulerState.IDLE;
  private volatile Thread pollerThread;

  public PollingScheduler(
      CollectionCycleService cycleService,
      PollingConfigurationProperties pollingConfig,
      Sleeper sleeper) {
    if (cycleService == null) {
      throw new IllegalArgumentException("CollectionCycleService cannot be null");
    }
    if (pollingConfig == null) {
      throw new IllegalArgumentException("PollingConfigurationProperties cannot be null");
    }
    if (sleeper == null) {
      throw new IllegalArgumentException("Sleeper cannot be null");
    }
    this.cycleService = cycleService;
    this.pollingConfig = pollingConfig;
    this.sleeper = sleeper;
    this.interval = Duration.ofSeconds(pollingConfig.intervalSeconds());
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (!pollingConfig.enabled()) {
      logger.info("Polling is disabled, no collection cycles will run");
      return;
    }
    start();
  }

  /** Starts the polling thread. Calling it on a running scheduler has no effect. */
  public void start() {
    if (state == SchedulerState.STOPPED) {
      throw new IllegalStateException("Scheduler has been stopped and cannot be restarted");
    }
    if (running.compareAndSet(false, true)) {
      logger.info("Starting polling loop with interval {}s", interval.toSeconds());
      Thread thread = new Thread(this::runLoop, THREAD_NAME);
      pollerThread = thread;
      thread.start();
    }
  }

  /** Asks the loop to exit after the current cycle. */
  public void stop() {
    if (running.compareAndSet(true, false)) {
      logger.info("Stopping polling loop");
      Thread thread = pollerThread;
      if (thread != null && state == SchedulerState.IDLE) {
        thread.interrupt();
      }
    } else if (pollerThread == null) {
      state = SchedulerState.STOPPED;
    }
  }

  /**
   * Waits for the loop thread to exit, interrupting it if the timeout passes.
   *
   * @param timeout maximum time to wait
   * @return true if the loop exited within the timeout
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    Thread thread = pollerThread;
    if (thread == null) {
      return true;
    }
    thread.join(timeout.toMillis());
    if (thread.isAlive()) {
      logger.warn("Polling loop still busy after {}ms, interrupting", timeout.toMillis());
      thread.interrupt();
      return false;
    }
    return true;
  }

  public SchedulerState getState() {
    return state;
  }

  public boolean isRunning() {
    return running.get();
  }

  void runLoop() {
    try {
      while (running.get()) {
        state = SchedulerState.RUNNING_CYCLE;
        try {
          CycleResult result = cycleService.runCycle();
          logger.debug(
              "Cycle {} finished with {} in {}ms",
              result.cycleId(),
              result.status(),
              result.duration().toMillis());
        } catch (RuntimeException e) {
          logger.error("Unexpected error in collection cycle", e);
        }
        state = SchedulerState.IDLE;

        if (!running.get()) {
          break;
        }
        try {
          sleeper.sleep(interval);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.info("Polling loop interrupted");
          break;
        }
      }
    } finally {
      running.set(false);
      state = SchedulerState.STOPPED;
      logger.info("Polling loop stopped");
    }
  }
}
