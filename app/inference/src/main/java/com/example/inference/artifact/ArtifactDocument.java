/*
 * どこで: Inference artifact 層
 * 何を: artifact ファイル (JSON) の受け取り形状を定義する
 * なぜ: 学習ジョブとの受け渡し形式を型付きで読み込み、検証前の生値として扱うため
 */
package com.example.inference.artifact;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2"},
    justification = "読み込み専用の DTO で、検証後に不変なドメイン型へ写し替えるため")
record ArtifactDocument(
    Integer formatVersion,
    String modelVersion,
    String modelType,
    SchemaDocument schema,
    Double intercept,
    List<Double> coefficients,
    Double decisionThreshold) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record SchemaDocument(
      List<String> numericFields, List<CategoricalFieldDocument> categoricalFields) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  @JsonIgnoreProperties(ignoreUnknown = true)
  record CategoricalFieldDocument(String name, List<String> levels, String referenceLevel) {}
}
