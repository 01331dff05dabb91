package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void prefersSnakeCaseTraceIdFromMdc() {
    MDC.put("trace_id", "trace-1");
    MDC.put("traceId", "legacy-1");

    assertThat(TraceIds.currentOrNew()).isEqualTo("trace-1");
  }

  @Test
  void fallsBackToLegacyTraceId() {
    MDC.put("trace_id", " ");
    MDC.put("traceId", "legacy-1");

    assertThat(TraceIds.currentOrNew()).isEqualTo("legacy-1");
  }

  @Test
  void issuesNewUuidWhenMdcIsEmpty() {
    final String traceId = TraceIds.currentOrNew();

    assertThat(UUID.fromString(traceId).toString()).isEqualTo(traceId);
    assertThat(TraceIds.currentOrNew()).isNotEqualTo(traceId);
  }
}
