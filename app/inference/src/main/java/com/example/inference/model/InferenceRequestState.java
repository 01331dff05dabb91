/*
 * どこで: Inference ドメインモデル
 * 何を: 推論リクエスト 1 件の処理段階を定義する
 * なぜ: 終端状態ごとにメトリクスのタグとログを揃えるため
 */
package com.example.inference.model;

import java.util.Locale;

public enum InferenceRequestState {
  RECEIVED(false),
  VALIDATED(false),
  ALIGNED(false),
  SCORED(false),
  RESPONDED(true),
  REJECTED(true),
  FAILED(true);

  private final boolean terminal;

  InferenceRequestState(boolean terminal) {
    this.terminal = terminal;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
