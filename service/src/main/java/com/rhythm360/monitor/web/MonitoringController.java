package com.rhythm360.monitor.web;

import com.rhythm360.monitor.assessment.AssessmentReport;
import com.rhythm360.monitor.session.MonitoringOptions;
import com.rhythm360.monitor.session.MonitoringService;
import com.rhythm360.monitor.session.SessionView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.util.Map;
import org.springframework.http.ProblemDetail;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sessions")
@Validated
@Tag(name = "Sessions")
public class MonitoringController {

  private final MonitoringService monitoring;

  public MonitoringController(MonitoringService monitoring) {
    this.monitoring = monitoring;
  }

  @PostMapping("/{deviceId}/start")
  @Operation(summary = "Start monitoring",
      description = "Subscribes to the device's heart-rate stream. Starting a running session is "
          + "a no-op that returns its current state.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Session state",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = SessionView.class))),
      @ApiResponse(responseCode = "503", description = "Sensor unavailable",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SessionView start(
      @PathVariable @Pattern(regexp = DeviceIds.REGEX)
      @Parameter(description = "Device identifier", example = "watch-01") String deviceId,
      @RequestBody(required = false) @Valid StartSessionRequest request) {
    MonitoringOptions options = monitoring.defaults();
    if (request != null && request.estimatedMaxHr() != null) {
      options = options.withEstimatedMaxHr(request.estimatedMaxHr());
    }
    return monitoring.start(deviceId, options).view().join();
  }

  @PostMapping("/{deviceId}/stop")
  @Operation(summary = "Stop monitoring",
      description = "Cancels the subscription and timer and releases the buffers. Idempotent.")
  public Map<String, Object> stop(
      @PathVariable @Pattern(regexp = DeviceIds.REGEX) String deviceId) {
    boolean stopped = monitoring.stop(deviceId);
    return Map.of("deviceId", deviceId, "stopped", stopped);
  }

  @GetMapping("/{deviceId}")
  @Operation(summary = "Current session state",
      description = "Latest value, zone, alert status, buffer sizes and the latest assessment.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Session state"),
      @ApiResponse(responseCode = "404", description = "No running session",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public SessionView get(@PathVariable @Pattern(regexp = DeviceIds.REGEX) String deviceId) {
    return monitoring.snapshot(deviceId).join();
  }

  @PostMapping("/{deviceId}/assessments")
  @Operation(summary = "Run an assessment now",
      description = "Scores the buffered heart rates with the four-model ensemble and the "
          + "critical pre-check, then persists and caches the result.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Assessment report"),
      @ApiResponse(responseCode = "404", description = "No running session",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "No heart-rate samples buffered yet",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public AssessmentReport assess(
      @PathVariable @Pattern(regexp = DeviceIds.REGEX) String deviceId) {
    return monitoring.evaluateNow(deviceId).join();
  }
}
