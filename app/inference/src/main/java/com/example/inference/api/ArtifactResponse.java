package com.example.inference.api;

import com.example.inference.artifact.ScoringArtifact;
import com.example.inference.model.CategoricalField;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArtifactResponse(
    String modelVersion,
    String modelType,
    List<String> numericFields,
    List<CategoricalFieldSummary> categoricalFields,
    List<String> columns) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record CategoricalFieldSummary(String name, List<String> levels, String referenceLevel) {}

  public static ArtifactResponse of(ScoringArtifact artifact) {
    final List<CategoricalFieldSummary> categorical =
        artifact.schema().categoricalFields().stream()
            .map(ArtifactResponse::summarize)
            .toList();
    return new ArtifactResponse(
        artifact.modelVersion(),
        artifact.modelType(),
        artifact.schema().numericFields(),
        categorical,
        artifact.schema().columnNames());
  }

  private static CategoricalFieldSummary summarize(CategoricalField field) {
    return new CategoricalFieldSummary(field.name(), field.levels(), field.referenceLevel());
  }
}
