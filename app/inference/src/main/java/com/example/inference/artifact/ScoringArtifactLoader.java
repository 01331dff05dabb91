/*
 * どこで: Inference artifact 層
 * 何を: artifact ファイルを読み込み、schema と係数を検証して ScoringArtifact を組み立てる
 * なぜ: 壊れた artifact を推論経路へ流さず、ロード時点で明確な失敗にするため
 */
package com.example.inference.artifact;

import com.example.inference.model.CategoricalField;
import com.example.inference.model.FeatureSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ScoringArtifactLoader {

  static final int SUPPORTED_FORMAT_VERSION = 1;

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;

  /**
   * 役割: location (classpath: / file: など Spring の Resource 表記) から artifact を読み込む。
   * 動作: JSON を読み、形式・モデル種別・schema・係数を検証してから不変な artifact を返す。
   * 前提: 失敗時は ArtifactLoadException を投げ、部分的に構築した artifact は返さない。
   */
  public ScoringArtifact load(String location) {
    final Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new ArtifactLoadException("artifact source does not exist: " + location);
    }
    final ArtifactDocument document;
    try (InputStream input = resource.getInputStream()) {
      document = objectMapper.readValue(input, ArtifactDocument.class);
    } catch (JsonProcessingException ex) {
      throw new ArtifactLoadException("artifact is not valid JSON: " + location, ex);
    } catch (IOException ex) {
      throw new ArtifactLoadException("artifact source is unreadable: " + location, ex);
    }
    if (document == null) {
      throw new ArtifactLoadException("artifact document is empty: " + location);
    }
    return toArtifact(document);
  }

  private ScoringArtifact toArtifact(ArtifactDocument document) {
    if (document.formatVersion() == null
        || document.formatVersion() != SUPPORTED_FORMAT_VERSION) {
      throw new ArtifactLoadException(
          "unsupported artifact format_version: " + document.formatVersion());
    }
    if (!LogisticScoringArtifact.MODEL_TYPE.equals(document.modelType())) {
      throw new ArtifactLoadException("unsupported model_type: " + document.modelType());
    }
    if (isBlank(document.modelVersion())) {
      throw new ArtifactLoadException("model_version is required");
    }
    final FeatureSchema schema = toSchema(document.schema());
    final double intercept = requireFinite("intercept", document.intercept());
    final double[] coefficients = toCoefficients(document.coefficients(), schema);
    final double threshold = requireFinite("decision_threshold", document.decisionThreshold());
    if (threshold <= 0.0 || threshold >= 1.0) {
      throw new ArtifactLoadException("decision_threshold must be within (0, 1): " + threshold);
    }
    return new LogisticScoringArtifact(
        document.modelVersion(), schema, intercept, coefficients, threshold);
  }

  private FeatureSchema toSchema(ArtifactDocument.SchemaDocument schema) {
    if (schema == null) {
      throw new ArtifactLoadException("schema is required");
    }
    final Set<String> fieldNames = new HashSet<>();
    final List<String> numericFields =
        schema.numericFields() == null ? List.of() : schema.numericFields();
    for (String name : numericFields) {
      requireUniqueName(fieldNames, name);
    }
    final List<CategoricalField> categoricalFields = new ArrayList<>();
    if (schema.categoricalFields() != null) {
      for (ArtifactDocument.CategoricalFieldDocument field : schema.categoricalFields()) {
        categoricalFields.add(toCategoricalField(fieldNames, field));
      }
    }
    if (fieldNames.isEmpty()) {
      throw new ArtifactLoadException("schema declares no fields");
    }
    final FeatureSchema featureSchema = new FeatureSchema(numericFields, categoricalFields);
    // 数値フィールド名と indicator 列名が衝突すると列の意味が曖昧になる
    final List<String> columns = featureSchema.columnNames();
    if (new HashSet<>(columns).size() != columns.size()) {
      throw new ArtifactLoadException("schema produces duplicate column names: " + columns);
    }
    return featureSchema;
  }

  private CategoricalField toCategoricalField(
      Set<String> fieldNames, ArtifactDocument.CategoricalFieldDocument field) {
    if (field == null) {
      throw new ArtifactLoadException("categorical field entry must not be null");
    }
    requireUniqueName(fieldNames, field.name());
    final List<String> levels = field.levels() == null ? List.of() : field.levels();
    if (levels.size() < 2) {
      throw new ArtifactLoadException(
          "categorical field " + field.name() + " must declare at least two levels");
    }
    final Set<String> seen = new HashSet<>();
    for (String level : levels) {
      if (isBlank(level) || !seen.add(level)) {
        throw new ArtifactLoadException(
            "categorical field " + field.name() + " has a blank or duplicate level: " + level);
      }
    }
    if (!levels.contains(field.referenceLevel())) {
      throw new ArtifactLoadException(
          "reference_level "
              + field.referenceLevel()
              + " is not a level of categorical field "
              + field.name());
    }
    return new CategoricalField(field.name(), levels, field.referenceLevel());
  }

  private double[] toCoefficients(List<Double> coefficients, FeatureSchema schema) {
    if (coefficients == null || coefficients.size() != schema.width()) {
      throw new ArtifactLoadException(
          "coefficient count "
              + (coefficients == null ? 0 : coefficients.size())
              + " does not match schema width "
              + schema.width());
    }
    final double[] values = new double[coefficients.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = requireFinite("coefficients[" + i + "]", coefficients.get(i));
    }
    return values;
  }

  private void requireUniqueName(Set<String> fieldNames, String name) {
    if (isBlank(name)) {
      throw new ArtifactLoadException("schema field name must not be blank");
    }
    if (!fieldNames.add(name)) {
      throw new ArtifactLoadException("schema field name is duplicated: " + name);
    }
  }

  private double requireFinite(String field, Double value) {
    if (value == null || !Double.isFinite(value)) {
      throw new ArtifactLoadException(field + " must be a finite number");
    }
    return value;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
