/*
 * どこで: Inference drift 監視
 * 何を: 予測確率と実測ラベルの二乗誤差平均 (Brier score) を計算する
 * なぜ: ラベルの比率が保たれていても確率の較正が崩れたことを検出するため
 */
package com.example.inference.service;

import com.example.inference.model.LedgerPair;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class BrierScoreStatistic implements DriftStatistic {

  static final String NAME = "brier-score";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public double compute(List<LedgerPair> samples) {
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("samples must not be empty");
    }
    double sum = 0.0;
    for (LedgerPair pair : samples) {
      final double error =
          pair.prediction().probability() - pair.outcome().orElseThrow().realizedLabel();
      sum += error * error;
    }
    return sum / samples.size();
  }
}
