/*
 * どこで: Inference ドメインモデル
 * 何を: 1 リクエスト分の特徴量 (フィールド名 -> 値) を保持する
 * なぜ: decode 後の入力を不変にし、aligner/hasher へ安全に渡すため
 */
package com.example.inference.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record FeatureRecord(Map<String, FeatureValue> values) {

  public FeatureRecord {
    values = Map.copyOf(values);
  }

  public Optional<FeatureValue> get(String fieldName) {
    return Optional.ofNullable(values.get(fieldName));
  }

  public Set<String> fieldNames() {
    return values.keySet();
  }
}
