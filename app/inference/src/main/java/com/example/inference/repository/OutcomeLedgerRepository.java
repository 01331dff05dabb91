/*
 * どこで: Inference repository 層
 * 何を: 予測記録と実測ラベルの結合状態を保持する ledger の操作を定義する
 * なぜ: 保存方式 (メモリ/外部ストア) を service から切り離すため
 */
package com.example.inference.repository;

import com.example.inference.model.LedgerPair;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.model.PredictionRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OutcomeLedgerRepository {

  /**
   * 予測記録を追加する。同じ request id が既にあれば何もせず false を返す。
   * 保留中の実測ラベルがあればこの時点で結合する。
   */
  boolean savePrediction(PredictionRecord record);

  OutcomeUpsertResult upsertOutcome(OutcomeUpdate update);

  /** 予測時刻が [start, end) に入る組を返す。 */
  List<LedgerPair> findByPredictedAtBetween(Instant start, Instant end);

  Optional<LedgerPair> findByRequestId(String requestId);

  List<LedgerPair> findAllPairs();

  /** 予測記録がまだ届いていない実測ラベル。 */
  List<OutcomeUpdate> findOrphanOutcomes();

  long countPending();

  /** 予測時刻 (保留中の実測は観測時刻) が threshold より前の組を削除し、件数を返す。 */
  int deleteOlderThan(Instant threshold);
}
