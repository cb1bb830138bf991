package com.rhythm360.monitor.web;

import io.swagger.v3.oas.annotations.Operation;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated liveness check for load balancers; deeper checks live under actuator. */
@RestController
public class PingController {

  @GetMapping("/v1/ping")
  @Operation(summary = "Liveness check")
  public Map<String, Object> ping() {
    return Map.of("service", "rhythm-monitor", "pong", true);
  }
}
