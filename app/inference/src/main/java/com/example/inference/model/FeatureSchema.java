/*
 * どこで: Inference ドメインモデル
 * 何を: スコアリング artifact が期待する入力ベクトルの列構成を定義する
 * なぜ: 列の長さと順序をリクエスト内容ではなく schema だけで決めるため
 */
package com.example.inference.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record FeatureSchema(List<String> numericFields, List<CategoricalField> categoricalFields) {

  public FeatureSchema {
    numericFields = List.copyOf(numericFields);
    categoricalFields = List.copyOf(categoricalFields);
  }

  /**
   * 役割: ベクトルの列名を正規順で返す。
   * 動作: 数値フィールドを宣言順に並べ、その後ろにカテゴリごとの非参照水準を宣言順で並べる。
   * 前提: schema は artifact ロード時に検証済みであること。
   */
  public List<String> columnNames() {
    final List<String> columns = new ArrayList<>(numericFields);
    for (CategoricalField field : categoricalFields) {
      for (String level : field.indicatorLevels()) {
        columns.add(field.columnName(level));
      }
    }
    return Collections.unmodifiableList(columns);
  }

  public int width() {
    int width = numericFields.size();
    for (CategoricalField field : categoricalFields) {
      width += field.indicatorLevels().size();
    }
    return width;
  }
}
