/*
 * どこで: Inference ドメインモデル
 * 何を: 入力特徴量 1 個分の値を数値/カテゴリのタグ付きで表現する
 * なぜ: 受信 JSON の型を decode 時点で確定させ、aligner で型不一致を明示的に扱うため
 */
package com.example.inference.model;

import java.util.Objects;

public record FeatureValue(Kind kind, double numeric, String category) {

  public enum Kind {
    NUMERIC,
    CATEGORICAL,
    // 真偽値・null・配列・オブジェクト・非有限数。category に元の JSON 表記を保持する
    UNSUPPORTED
  }

  public FeatureValue {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.NUMERIC && !Double.isFinite(numeric)) {
      throw new IllegalArgumentException("numeric feature value must be finite");
    }
    if (kind != Kind.NUMERIC && category == null) {
      throw new IllegalArgumentException("feature value text must not be null");
    }
  }

  public static FeatureValue numeric(double value) {
    return new FeatureValue(Kind.NUMERIC, value, null);
  }

  public static FeatureValue categorical(String value) {
    return new FeatureValue(Kind.CATEGORICAL, 0.0, value);
  }

  public static FeatureValue unsupported(String rawJson) {
    return new FeatureValue(Kind.UNSUPPORTED, 0.0, rawJson);
  }

  public boolean isNumeric() {
    return kind == Kind.NUMERIC;
  }

  public boolean isCategorical() {
    return kind == Kind.CATEGORICAL;
  }
}
