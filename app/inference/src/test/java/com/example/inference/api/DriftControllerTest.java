package com.example.inference.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.inference.model.DriftMonitorState;
import com.example.inference.model.DriftVerdict;
import com.example.inference.model.VerdictStatus;
import com.example.inference.service.DriftMonitor;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DriftController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class DriftControllerTest {

  private static final Instant WINDOW_END = Instant.parse("2026-03-31T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DriftMonitor driftMonitor;

  @Test
  void verdictIsNoContentBeforeFirstCycle() throws Exception {
    when(driftMonitor.snapshot())
        .thenReturn(
            new DriftMonitor.MonitorSnapshot(DriftMonitorState.NORMAL, null, Optional.empty()));

    mockMvc.perform(get("/v1/drift/verdict")).andExpect(status().isNoContent());
  }

  @Test
  void verdictReportsLatestCycleAndMonitorState() throws Exception {
    final Instant cooldownUntil = WINDOW_END.plus(Duration.ofHours(24));
    when(driftMonitor.snapshot())
        .thenReturn(
            new DriftMonitor.MonitorSnapshot(
                DriftMonitorState.SIGNALED, cooldownUntil, Optional.of(breach())));

    mockMvc
        .perform(get("/v1/drift/verdict"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.monitor_state").value("SIGNALED"))
        .andExpect(jsonPath("$.cooldown_until").value("2026-04-01T00:00:00Z"))
        .andExpect(jsonPath("$.status").value("breached"))
        .andExpect(jsonPath("$.triggered").value(true))
        .andExpect(jsonPath("$.signaled").value(true))
        .andExpect(jsonPath("$.statistic_name").value("positive-rate-gap"))
        .andExpect(jsonPath("$.sample_size").value(250))
        .andExpect(jsonPath("$.pending_count").value(12));
  }

  @Test
  void evaluationRunsOneCycle() throws Exception {
    when(driftMonitor.evaluateNow()).thenReturn(breach());
    when(driftMonitor.snapshot())
        .thenReturn(
            new DriftMonitor.MonitorSnapshot(
                DriftMonitorState.SIGNALED,
                WINDOW_END.plus(Duration.ofHours(24)),
                Optional.of(breach())));

    mockMvc
        .perform(post("/v1/drift/evaluations"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("breached"));
  }

  @Test
  void evaluationWhileRunningReturns409() throws Exception {
    when(driftMonitor.evaluateNow()).thenThrow(new DriftEvaluationInProgressException());

    mockMvc
        .perform(post("/v1/drift/evaluations"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("DRIFT_EVALUATION_RUNNING"));
  }

  private static DriftVerdict breach() {
    return new DriftVerdict(
        WINDOW_END.minus(Duration.ofDays(30)),
        WINDOW_END,
        "positive-rate-gap",
        0.4,
        0.1,
        250,
        12,
        VerdictStatus.BREACHED,
        true,
        DriftMonitorState.SIGNALED,
        WINDOW_END);
  }
}
