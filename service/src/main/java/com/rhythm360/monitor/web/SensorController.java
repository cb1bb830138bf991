package com.rhythm360.monitor.web;

import com.rhythm360.monitor.ingest.ActivityMode;
import com.rhythm360.monitor.sensor.PushSensorGateway;
import com.rhythm360.monitor.sensor.SensorAggregates;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sensors")
@Validated
@Tag(name = "Sensors")
public class SensorController {

  private final PushSensorGateway gateway;
  private final Clock clock;

  public SensorController(PushSensorGateway gateway, Clock clock) {
    this.gateway = gateway;
    this.clock = clock;
  }

  @PostMapping("/{deviceId}/samples")
  @ResponseStatus(HttpStatus.ACCEPTED)
  @Operation(summary = "Push a heart-rate sample",
      description = "Delivered to the device's running session, if any. Out-of-range values are "
          + "accepted here and discarded by the session.")
  public Map<String, Object> sample(
      @PathVariable @Pattern(regexp = DeviceIds.REGEX) String deviceId,
      @RequestBody @Valid SamplePayload payload) {
    Instant timestamp = payload.timestamp() != null ? payload.timestamp() : clock.instant();
    ActivityMode mode = payload.mode() != null ? payload.mode() : ActivityMode.RESTING;
    int delivered = gateway.publishSample(deviceId, payload.value(), timestamp, mode);
    return Map.of("deviceId", deviceId, "delivered", delivered);
  }

  @PutMapping("/{deviceId}/aggregates")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  @Operation(summary = "Update ancillary aggregates",
      description = "Respiratory rate, activity energy, sleep ratio and HRV. Null fields keep "
          + "their previous reading.")
  public void aggregates(
      @PathVariable @Pattern(regexp = DeviceIds.REGEX) String deviceId,
      @RequestBody @Valid SensorAggregates aggregates) {
    gateway.updateAggregates(deviceId, aggregates);
  }
}
