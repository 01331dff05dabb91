/*
 * どこで: Inference ドメインモデル
 * 何を: ledger 上の予測と (あれば) 実測ラベルの組を表す
 * なぜ: drift 判定側が結合済み/未結合を区別できるようにするため
 */
package com.example.inference.model;

import java.time.Duration;
import java.util.Optional;

public record LedgerPair(PredictionRecord prediction, OutcomeUpdate outcomeOrNull) {

  public Optional<OutcomeUpdate> outcome() {
    return Optional.ofNullable(outcomeOrNull);
  }

  public boolean isJoined() {
    return outcomeOrNull != null;
  }

  /**
   * 役割: 予測時刻から指定期間内に実測が届いたかを判定する。
   * 動作: 未結合なら false、実測時刻が予測時刻より前でも期間内として扱う。
   * 前提: outcomeWindow は正の期間であること。
   */
  public boolean isJoinedWithin(Duration outcomeWindow) {
    if (outcomeOrNull == null) {
      return false;
    }
    final Duration lag = Duration.between(prediction.predictedAt(), outcomeOrNull.observedAt());
    return lag.compareTo(outcomeWindow) <= 0;
  }
}
