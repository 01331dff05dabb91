/*
 * どこで: Inference API
 * 何を: 直近の drift 判定と監視状態の応答形状を定義する
 * なぜ: 判定値が無い (標本不足) 場合も含めて運用者が状態を確認できるようにするため
 */
package com.example.inference.api;

import com.example.inference.model.DriftVerdict;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DriftVerdictResponse(
    String monitorState,
    Instant cooldownUntil,
    Instant windowStart,
    Instant windowEnd,
    String statisticName,
    Double statistic,
    double threshold,
    int sampleSize,
    int pendingCount,
    String status,
    boolean triggered,
    boolean signaled,
    Instant evaluatedAt) {

  public static DriftVerdictResponse of(
      String monitorState, Instant cooldownUntil, DriftVerdict verdict) {
    return new DriftVerdictResponse(
        monitorState,
        cooldownUntil,
        verdict.windowStart(),
        verdict.windowEnd(),
        verdict.statisticName(),
        verdict.statistic(),
        verdict.threshold(),
        verdict.sampleSize(),
        verdict.pendingCount(),
        verdict.status().value(),
        verdict.triggered(),
        verdict.signaled(),
        verdict.evaluatedAt());
  }
}
