package com.rhythm360.monitor.web;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.rhythm360.monitor.config.SecurityConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PingController.class)
@Import(SecurityConfig.class)
class PingControllerTest {

  @Autowired
  private MockMvc mvc;

  @Test
  void pingAnswersWithoutASession() throws Exception {
    mvc.perform(get("/v1/ping"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pong").value(true));
  }

  @Test
  void rootIsNotMapped() throws Exception {
    mvc.perform(get("/"))
        .andExpect(status().isNotFound());
  }
}
