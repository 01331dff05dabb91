package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  private static final String MDC_TRACE_ID = "trace_id";
  private static final String MDC_LEGACY_TRACE_ID = "traceId";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: 現在スレッドのトレース ID を取得する。
   * 動作: MDC の trace_id → traceId の順に参照し、どちらも無ければ新規発行する。
   * 前提: なし。
   */
  public static String currentOrNew() {
    final String traceId = MDC.get(MDC_TRACE_ID);
    if (traceId != null && !traceId.isBlank()) {
      return traceId;
    }
    final String legacyTraceId = MDC.get(MDC_LEGACY_TRACE_ID);
    if (legacyTraceId != null && !legacyTraceId.isBlank()) {
      return legacyTraceId;
    }
    return newTraceId();
  }
}
