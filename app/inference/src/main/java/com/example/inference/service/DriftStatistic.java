/*
 * どこで: Inference drift 監視
 * 何を: 結合済みの予測/実測の組から drift 統計量を計算する差し替え可能な検定
 * なぜ: 監視の手順 (窓・閾値・cooldown) と統計手法を分け、検定を設定で選べるようにするため
 */
package com.example.inference.service;

import com.example.inference.model.LedgerPair;
import java.util.List;

public interface DriftStatistic {

  /** 設定値 inference.drift.statistic と照合する名前。 */
  String name();

  /**
   * 役割: 標本から統計量を 1 つ計算する。値が大きいほど drift が強いことを表す。
   * 前提: samples は空でなく、すべて結合済みであること。
   */
  double compute(List<LedgerPair> samples);
}
