/*
 * どこで: Inference サービス層
 * 何を: 1 件の推論リクエストを検証→整列→スコアリング→応答まで進め、ledger 追記を投げる
 * なぜ: リクエスト状態ごとの計測と失敗分類を 1 箇所で確定させるため
 */
package com.example.inference.service;

import com.example.inference.api.ArtifactUnavailableException;
import com.example.inference.api.InvalidInferenceRequestException;
import com.example.inference.api.PredictionResponse;
import com.example.inference.artifact.ScoringArtifact;
import com.example.inference.artifact.ScoringArtifactHolder;
import com.example.inference.model.FeatureRecord;
import com.example.inference.model.FeatureVector;
import com.example.inference.model.InferenceRequestState;
import com.example.inference.model.Prediction;
import com.example.inference.model.PredictionRecord;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class InferenceService {

  private static final Logger logger = LoggerFactory.getLogger(InferenceService.class);

  static final String REJECT_VALIDATION = "validation_error";

  private final FeatureRecordDecoder decoder;
  private final FeatureAligner aligner;
  private final FeatureRecordHasher hasher;
  private final ScoringArtifactHolder artifactHolder;
  private final OutcomeLedgerService ledgerService;
  private final InferenceMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 生の本文から予測を返す。
   * 動作: RECEIVED から RESPONDED まで進め、途中の失敗は REJECTED (クライアント起因) か
   *       FAILED (artifact 未ロードなどサーバ起因) で終える。どの経路でも計測は 1 回だけ。
   * 前提: requestId は outcome の結合キーとして応答と ledger の両方に使う。
   */
  public PredictionResponse predict(String requestId, String body) {
    try (InferenceMetrics.RequestScope scope = metrics.startRequest()) {
      final FeatureRecord record;
      try {
        record = decoder.decode(body);
      } catch (InvalidInferenceRequestException ex) {
        scope.reject(REJECT_VALIDATION);
        throw ex;
      }
      scope.advance(InferenceRequestState.VALIDATED);

      // 整列とスコアリングは同じスナップショットで行う
      final ScoringArtifact artifact;
      try {
        artifact = artifactHolder.require();
      } catch (ArtifactUnavailableException ex) {
        scope.fail();
        throw ex;
      }
      final FeatureVector vector;
      try {
        vector = aligner.align(record, artifact.schema());
      } catch (FeatureAlignmentException ex) {
        scope.reject(ex.failure().value());
        throw ex;
      }
      scope.advance(InferenceRequestState.ALIGNED);

      final Prediction prediction = artifact.score(vector);
      scope.advance(InferenceRequestState.SCORED);

      ledgerService.recordPredictionAsync(
          new PredictionRecord(
              requestId,
              Instant.now(clock),
              hasher.hash(record),
              prediction.label(),
              prediction.probability(),
              artifact.modelVersion()));
      scope.advance(InferenceRequestState.RESPONDED);
      logger.debug(
          "prediction served requestId={} modelVersion={} label={}",
          requestId,
          artifact.modelVersion(),
          prediction.label());
      return new PredictionResponse(
          prediction.label(), prediction.probability(), requestId, artifact.modelVersion());
    }
  }
}
