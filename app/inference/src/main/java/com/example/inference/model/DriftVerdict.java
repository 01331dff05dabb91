/*
 * どこで: Inference ドメインモデル
 * 何を: drift 判定 1 サイクル分の結果を定義する
 * なぜ: 再学習トリガーと運用 API へ同じ判定結果を渡すため
 */
package com.example.inference.model;

import java.time.Instant;

public record DriftVerdict(
    Instant windowStart,
    Instant windowEnd,
    String statisticName,
    Double statistic,
    double threshold,
    int sampleSize,
    int pendingCount,
    VerdictStatus status,
    boolean signaled,
    DriftMonitorState stateAfter,
    Instant evaluatedAt) {

  /** 閾値超過かどうか。INCONCLUSIVE は常に false。 */
  public boolean triggered() {
    return status == VerdictStatus.BREACHED;
  }
}
