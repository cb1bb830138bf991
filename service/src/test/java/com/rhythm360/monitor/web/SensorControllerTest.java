package com.rhythm360.monitor.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rhythm360.monitor.config.SecurityConfig;
import com.rhythm360.monitor.ingest.ActivityMode;
import com.rhythm360.monitor.sensor.PushSensorGateway;
import com.rhythm360.monitor.sensor.SensorAggregates;
import java.time.Clock;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SensorController.class)
@Import(SecurityConfig.class)
class SensorControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private PushSensorGateway gateway;

  @MockBean
  private Clock clock;

  @Test
  void sampleIsFannedOutWithDefaults() throws Exception {
    Instant now = Instant.parse("2025-06-01T10:00:00Z");
    when(clock.instant()).thenReturn(now);
    when(gateway.publishSample("watch-1", 88.0, now, ActivityMode.RESTING)).thenReturn(1);

    mvc.perform(post("/v1/sensors/watch-1/samples")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"value\": 88}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.deviceId").value("watch-1"))
        .andExpect(jsonPath("$.delivered").value(1));
  }

  @Test
  void sampleWithoutValueIsRejected() throws Exception {
    mvc.perform(post("/v1/sensors/watch-1/samples")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"mode\": \"EXERCISE\"}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(gateway);
  }

  @Test
  void aggregatesAreStored() throws Exception {
    mvc.perform(put("/v1/sensors/watch-1/aggregates")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"respiratoryRate\": 14.5, \"hrv\": 52}"))
        .andExpect(status().isNoContent());

    verify(gateway).updateAggregates(eq("watch-1"), any(SensorAggregates.class));
  }

  @Test
  void outOfRangeSleepRatioIsRejected() throws Exception {
    mvc.perform(put("/v1/sensors/watch-1/aggregates")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"sleepRatio\": 1.5}"))
        .andExpect(status().isBadRequest());
  }
}
