/*
 * どこで: Inference ドメインモデル
 * 何を: 後から判明した実測ラベルを定義する
 * なぜ: 予測記録と request id で結合するため
 */
package com.example.inference.model;

import java.time.Instant;

public record OutcomeUpdate(String requestId, int realizedLabel, Instant observedAt) {

  /** 同一 request id の再配信が同じ内容かを判定する。 */
  public boolean samePayloadAs(OutcomeUpdate other) {
    return other != null
        && requestId.equals(other.requestId)
        && realizedLabel == other.realizedLabel;
  }
}
