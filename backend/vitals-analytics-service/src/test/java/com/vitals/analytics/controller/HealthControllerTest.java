package com.vitals.analytics.controller;

import com.vitals.analytics.repo.MetricCacheRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

  @Autowired
  private MockMvc mvc;

  @MockBean
  private MetricCacheRepository cache;

  @Test
  @DisplayName("Healthy while Redis answers PING")
  void healthy() throws Exception {
    when(cache.ping()).thenReturn(true);

    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.redis").value("connected"));
  }

  @Test
  @DisplayName("503 when Redis is unreachable")
  void unhealthy() throws Exception {
    when(cache.ping()).thenReturn(false);

    mvc.perform(get("/health"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("unhealthy"))
        .andExpect(jsonPath("$.redis").value("disconnected"));
  }
}
