package com.rhythm360.monitor.session;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.rhythm360.monitor.assessment.AssessmentReport;
import com.rhythm360.monitor.assessment.AssessmentService;
import com.rhythm360.monitor.ingest.ActivityMode;
import com.rhythm360.monitor.notify.NotificationDispatcher;
import com.rhythm360.monitor.notify.NotificationGateway;
import com.rhythm360.monitor.sensor.PushSensorGateway;
import com.rhythm360.monitor.support.Fixtures;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MonitoringServiceTest {

  private final Clock clock = Clock.systemUTC();
  private final AssessmentService assessments = mock(AssessmentService.class);
  private final NotificationDispatcher dispatcher =
      new NotificationDispatcher(mock(NotificationGateway.class));
  private MonitoringService service;

  private MonitoringService service(boolean sensorEnabled) {
    return new MonitoringService(new PushSensorGateway(sensorEnabled, clock), dispatcher,
        assessments, clock, 200, 300, 190, Duration.ofSeconds(60), Duration.ofSeconds(300), 64);
  }

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.stopAll();
    }
  }

  @Test
  void startIsIdempotent() {
    service = service(true);
    MonitoringSession first = service.start("watch-1");
    MonitoringSession second = service.start("watch-1");
    assertSame(first, second);
    assertEquals(Set.of("watch-1"), service.activeDevices());
  }

  @Test
  void stopIsIdempotentAndEndsTheSession() {
    service = service(true);
    MonitoringSession session = service.start("watch-1");
    assertTrue(service.stop("watch-1"));
    assertFalse(service.stop("watch-1"));
    assertFalse(session.isActive());
    assertThrows(SessionNotFoundException.class, () -> service.session("watch-1"));
  }

  @Test
  void restartAfterStopCreatesFreshSession() {
    service = service(true);
    MonitoringSession first = service.start("watch-1");
    first.offer(75, Instant.now(), ActivityMode.RESTING);
    service.stop("watch-1");

    MonitoringSession second = service.start("watch-1");
    assertNotSame(first, second);
    assertEquals(0, service.snapshot("watch-1").join().bufferSize());
  }

  @Test
  void disabledSensorIsAConfigurationError() {
    service = service(false);
    var ex = assertThrows(MonitoringConfigurationException.class, () -> service.start("watch-1"));
    assertEquals("watch-1", ex.deviceId());
    assertTrue(service.activeDevices().isEmpty());
  }

  @Test
  void customOptionsOverrideDefaults() {
    service = service(true);
    var options = service.defaults().withEstimatedMaxHr(170);
    service.start("watch-1", options);
    service.session("watch-1").offer(140, Instant.now(), ActivityMode.EXERCISE);
    assertEquals("Peak", service.snapshot("watch-1").join().zone().displayName());
  }

  @Test
  void evaluateNowScoresTheBufferAndPublishesTheReport() {
    service = service(true);
    MonitoringSession session = service.start("watch-1");
    for (int i = 0; i < 10; i++) {
      session.offer(70 + i, Instant.now(), ActivityMode.RESTING);
    }
    var snapshot = Fixtures.restingSnapshot();
    var report = new AssessmentReport("watch-1",
        Fixtures.assessment(snapshot, Instant.now()), snapshot, List.of(), true);
    when(assessments.assess(eq("watch-1"), any())).thenReturn(
        CompletableFuture.completedFuture(report));

    assertSame(report, service.evaluateNow("watch-1").join());
    assertSame(report, session.latestReport());
    verify(assessments).assess(eq("watch-1"),
        argThat((double[] values) -> values.length == 10 && values[0] == 70.0));
  }

  @Test
  void unknownDeviceIsNotFound() {
    service = service(true);
    assertThrows(SessionNotFoundException.class, () -> service.evaluateNow("nope"));
  }
}
