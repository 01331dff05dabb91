/*
 * どこで: Inference ドメインモデル
 * 何を: カテゴリ特徴量の既知水準と参照水準を保持する
 * なぜ: 学習時の one-hot (参照水準を除外) と同じ列構成を推論時に再現するため
 */
package com.example.inference.model;

import java.util.List;

public record CategoricalField(String name, List<String> levels, String referenceLevel) {

  public CategoricalField {
    levels = List.copyOf(levels);
  }

  /** 参照水準を除いた水準を、宣言順のまま返す。 */
  public List<String> indicatorLevels() {
    return levels.stream().filter(level -> !level.equals(referenceLevel)).toList();
  }

  public boolean isKnownLevel(String level) {
    return levels.contains(level);
  }

  public String columnName(String level) {
    return name + "_" + level;
  }
}
