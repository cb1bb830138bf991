package com.rhythm360.monitor.session;

import com.rhythm360.monitor.assessment.AssessmentReport;
import com.rhythm360.monitor.ingest.ActivityMode;
import com.rhythm360.monitor.ingest.Sample;
import com.rhythm360.monitor.ingest.SampleValidator;
import com.rhythm360.monitor.notify.Notification;
import com.rhythm360.monitor.sensor.SensorGateway;
import com.rhythm360.monitor.sensor.SensorSubscription;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One monitoring session per device start. A single-threaded executor with a bounded queue owns
 * the buffers and alert state; sensor callbacks only validate and enqueue, and the periodic
 * evaluation is posted into the same executor. A full queue drops the sample.
 */
public class MonitoringSession {
  private static final Logger log = LoggerFactory.getLogger(MonitoringSession.class);

  private final String deviceId;
  private final MonitoringOptions options;
  private final Clock clock;
  private final SessionState state;
  private final ThreadPoolExecutor executor;
  private final ScheduledExecutorService scheduler;
  private final AtomicLong dropped = new AtomicLong();

  private volatile SensorSubscription subscription;
  private volatile AssessmentReport latestReport;
  private volatile boolean active;

  public MonitoringSession(String deviceId, MonitoringOptions options,
      Consumer<Notification> notifier, Clock clock) {
    this.deviceId = deviceId;
    this.options = options;
    this.clock = clock;
    this.state = new SessionState(deviceId, options, notifier);
    this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(options.queueCapacity()), threadFactory("monitor-" + deviceId));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(
        threadFactory("monitor-timer-" + deviceId));
  }

  /**
   * Subscribes to the sensor and starts the periodic evaluation. If the subscription fails the
   * session's threads are released and the failure propagates.
   */
  public synchronized void start(SensorGateway sensors) {
    if (active) return;
    try {
      subscription = sensors.subscribe(deviceId, this::offer);
    } catch (RuntimeException ex) {
      shutdownExecutors();
      throw ex;
    }
    long periodMillis = options.analysisPeriod().toMillis();
    scheduler.scheduleAtFixedRate(this::postPeriodic, periodMillis, periodMillis,
        TimeUnit.MILLISECONDS);
    active = true;
    log.info("Monitoring session started for device {} (ring={}, window={}, period={})",
        deviceId, options.ringCapacity(), options.windowCapacity(), options.analysisPeriod());
  }

  /** Validates and enqueues; returns false when the sample was rejected or dropped. */
  public boolean offer(double value, Instant timestamp, ActivityMode mode) {
    Sample sample = new Sample(value, timestamp, mode == null ? ActivityMode.RESTING : mode);
    if (!SampleValidator.isValid(sample)) {
      log.debug("Discarding out-of-range sample {} for device {}", value, deviceId);
      return false;
    }
    try {
      executor.execute(() -> state.accept(sample, clock.instant()));
      return true;
    } catch (RejectedExecutionException ex) {
      long total = dropped.incrementAndGet();
      log.warn("Sample queue full or closed for device {}, dropped {} so far", deviceId, total);
      return false;
    }
  }

  void postPeriodic() {
    try {
      executor.execute(this::runPeriodic);
    } catch (RejectedExecutionException ex) {
      log.debug("Skipping periodic evaluation for device {}: executor unavailable", deviceId);
    }
  }

  private void runPeriodic() {
    state.evaluatePeriodic(clock.instant()).ifPresent(e -> {
      if (e.critical()) {
        log.warn("Periodic risk score {} for device {} (mean={}, sd={}, pnn50={})",
            e.score(), deviceId, e.features().mean(), e.features().stdDev(), e.features().pnn50());
      } else {
        log.debug("Periodic risk score {} for device {}", e.score(), deviceId);
      }
    });
  }

  /** Copy of the buffered heart rates, taken on the session thread. */
  public CompletableFuture<double[]> heartRates() {
    return CompletableFuture.supplyAsync(state::heartRates, executor);
  }

  public CompletableFuture<SessionView> view() {
    return CompletableFuture.supplyAsync(
        () -> state.view(deviceId, active, dropped.get(), latestReport), executor);
  }

  public void publish(AssessmentReport report) {
    latestReport = report;
  }

  public AssessmentReport latestReport() {
    return latestReport;
  }

  /** Cancels the subscription and timer, then releases both buffers. Safe to call twice. */
  public synchronized void stop() {
    if (!active) return;
    active = false;
    SensorSubscription sub = subscription;
    subscription = null;
    if (sub != null) {
      sub.close();
    }
    shutdownExecutors();
    state.clear();
    latestReport = null;
    log.info("Monitoring session stopped for device {} ({} samples dropped)", deviceId,
        dropped.get());
  }

  private void shutdownExecutors() {
    scheduler.shutdownNow();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  public boolean isActive() {
    return active;
  }

  public String deviceId() {
    return deviceId;
  }

  private static ThreadFactory threadFactory(String name) {
    return r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    };
  }
}
