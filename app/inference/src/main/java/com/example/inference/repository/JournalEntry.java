/*
 * どこで: Inference repository 層
 * 何を: ledger ジャーナル 1 行分の JSON 形状を定義する
 * なぜ: 予測と実測を同じファイルへ追記し、起動時に同じ順序で再生できるようにするため
 */
package com.example.inference.repository;

import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.PredictionRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JournalEntry(
    String type,
    String requestId,
    Instant predictedAt,
    String inputHash,
    Integer label,
    Double probability,
    String modelVersion,
    Integer realizedLabel,
    Instant observedAt) {

  public static final String TYPE_PREDICTION = "prediction";
  public static final String TYPE_OUTCOME = "outcome";

  public static JournalEntry prediction(PredictionRecord record) {
    return new JournalEntry(
        TYPE_PREDICTION,
        record.requestId(),
        record.predictedAt(),
        record.inputHash(),
        record.label(),
        record.probability(),
        record.modelVersion(),
        null,
        null);
  }

  public static JournalEntry outcome(OutcomeUpdate update) {
    return new JournalEntry(
        TYPE_OUTCOME,
        update.requestId(),
        null,
        null,
        null,
        null,
        null,
        update.realizedLabel(),
        update.observedAt());
  }

  public boolean isPrediction() {
    return TYPE_PREDICTION.equals(type);
  }

  public boolean isOutcome() {
    return TYPE_OUTCOME.equals(type);
  }

  /** 必須項目が欠けた行は IllegalArgumentException。 */
  public PredictionRecord toPrediction() {
    if (requestId == null || predictedAt == null || label == null || probability == null) {
      throw new IllegalArgumentException("prediction entry is incomplete");
    }
    return new PredictionRecord(
        requestId, predictedAt, inputHash, label, probability, modelVersion);
  }

  public OutcomeUpdate toOutcome() {
    if (requestId == null || realizedLabel == null || observedAt == null) {
      throw new IllegalArgumentException("outcome entry is incomplete");
    }
    return new OutcomeUpdate(requestId, realizedLabel, observedAt);
  }
}
