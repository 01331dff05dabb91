/*
 * どこで: Inference ドメインモデル
 * 何を: drift 監視の状態遷移 (NORMAL -> DRIFTING -> SIGNALED -> NORMAL) を定義する
 * なぜ: 同一 drift 期間中の再学習シグナル連発を抑止するため
 */
package com.example.inference.model;

public enum DriftMonitorState {
  NORMAL(0),
  DRIFTING(1),
  SIGNALED(2);

  private final int gaugeValue;

  DriftMonitorState(int gaugeValue) {
    this.gaugeValue = gaugeValue;
  }

  public int gaugeValue() {
    return gaugeValue;
  }
}
