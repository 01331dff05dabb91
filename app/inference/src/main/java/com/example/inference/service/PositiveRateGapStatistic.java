/*
 * どこで: Inference drift 監視
 * 何を: 実測の陽性率と予測の陽性率の差の絶対値を計算する
 * なぜ: 解約率のような基準率の変化を最小限の計算で捉えるため
 */
package com.example.inference.service;

import com.example.inference.model.LedgerPair;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PositiveRateGapStatistic implements DriftStatistic {

  static final String NAME = "positive-rate-gap";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public double compute(List<LedgerPair> samples) {
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("samples must not be empty");
    }
    long predictedPositive = 0;
    long realizedPositive = 0;
    for (LedgerPair pair : samples) {
      predictedPositive += pair.prediction().label();
      realizedPositive += pair.outcome().orElseThrow().realizedLabel();
    }
    final double size = samples.size();
    return Math.abs(realizedPositive / size - predictedPositive / size);
  }
}
