/*
 * どこで: Inference artifact 層
 * 何を: ロジスティック回帰の係数で確率とラベルを計算する artifact 実装
 * なぜ: 学習ジョブが出力する churn モデルを JVM 内で直接スコアリングするため
 */
package com.example.inference.artifact;

import com.example.inference.model.FeatureSchema;
import com.example.inference.model.FeatureVector;
import com.example.inference.model.Prediction;

public final class LogisticScoringArtifact implements ScoringArtifact {

  static final String MODEL_TYPE = "logistic_regression";

  private final String modelVersion;
  private final FeatureSchema schema;
  private final double intercept;
  private final double[] coefficients;
  private final double decisionThreshold;

  public LogisticScoringArtifact(
      String modelVersion,
      FeatureSchema schema,
      double intercept,
      double[] coefficients,
      double decisionThreshold) {
    if (coefficients.length != schema.width()) {
      throw new IllegalArgumentException(
          "coefficient count "
              + coefficients.length
              + " does not match schema width "
              + schema.width());
    }
    this.modelVersion = modelVersion;
    this.schema = schema;
    this.intercept = intercept;
    this.coefficients = coefficients.clone();
    this.decisionThreshold = decisionThreshold;
  }

  @Override
  public String modelVersion() {
    return modelVersion;
  }

  @Override
  public String modelType() {
    return MODEL_TYPE;
  }

  @Override
  public FeatureSchema schema() {
    return schema;
  }

  public double decisionThreshold() {
    return decisionThreshold;
  }

  @Override
  public Prediction score(FeatureVector vector) {
    if (vector.length() != coefficients.length) {
      throw new IllegalStateException(
          "vector length "
              + vector.length()
              + " does not match artifact "
              + modelVersion
              + " width "
              + coefficients.length);
    }
    double linear = intercept;
    for (int i = 0; i < coefficients.length; i++) {
      linear += coefficients[i] * vector.get(i);
    }
    final double probability = sigmoid(linear);
    return new Prediction(probability >= decisionThreshold ? 1 : 0, probability);
  }

  // 大きな |z| で exp がオーバーフローしないよう符号で分けて計算する
  private static double sigmoid(double z) {
    if (z >= 0) {
      return 1.0 / (1.0 + Math.exp(-z));
    }
    final double e = Math.exp(z);
    return e / (1.0 + e);
  }
}
