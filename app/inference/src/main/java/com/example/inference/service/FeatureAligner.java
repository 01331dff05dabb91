/*
 * どこで: Inference サービス層
 * 何を: FeatureRecord を artifact schema の固定長ベクトルへ写像する
 * なぜ: 学習時と同じ列順・同じ one-hot 符号化で推論し、学習/推論の不整合を防ぐため
 */
package com.example.inference.service;

import com.example.inference.model.CategoricalField;
import com.example.inference.model.FeatureRecord;
import com.example.inference.model.FeatureSchema;
import com.example.inference.model.FeatureValue;
import com.example.inference.model.FeatureVector;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class FeatureAligner {

  /**
   * 役割: schema の正規順でベクトルを組み立てる。
   * 動作: 数値フィールドを宣言順に写し、カテゴリは非参照水準ごとの indicator 列を立てる。
   *       参照水準ならそのフィールドの列はすべて 0。schema に無い入力フィールドは無視する。
   * 前提: 1 つでも欠落・未知水準・型不一致があれば FeatureAlignmentException を投げ、部分ベクトルは返さない。
   */
  public FeatureVector align(FeatureRecord record, FeatureSchema schema) {
    final double[] values = new double[schema.width()];
    int column = 0;
    for (String name : schema.numericFields()) {
      final FeatureValue value = require(record, name);
      if (!value.isNumeric()) {
        throw new FeatureAlignmentException(
            AlignmentFailure.INVALID_FEATURE_TYPE, name, "feature " + name + " must be numeric");
      }
      values[column++] = value.numeric();
    }
    for (CategoricalField field : schema.categoricalFields()) {
      final FeatureValue value = require(record, field.name());
      if (!value.isCategorical()) {
        throw new FeatureAlignmentException(
            AlignmentFailure.INVALID_FEATURE_TYPE,
            field.name(),
            "feature " + field.name() + " must be a category string");
      }
      final String level = value.category();
      if (!field.isKnownLevel(level)) {
        throw new FeatureAlignmentException(
            AlignmentFailure.UNKNOWN_CATEGORY,
            field.name(),
            "feature " + field.name() + " has unknown category: " + level);
      }
      final List<String> indicators = field.indicatorLevels();
      for (String indicator : indicators) {
        values[column++] = indicator.equals(level) ? 1.0 : 0.0;
      }
    }
    return new FeatureVector(values);
  }

  private FeatureValue require(FeatureRecord record, String name) {
    return record
        .get(name)
        .orElseThrow(
            () ->
                new FeatureAlignmentException(
                    AlignmentFailure.MISSING_FEATURE, name, "feature " + name + " is required"));
  }
}
