/*
 * どこで: Inference サービス層
 * 何を: 推論・ledger・artifact・drift 監視のアプリ固有メトリクス記録を集約する
 * なぜ: 呼び出し側がメトリクス名やタグを直接扱わず、宣言済みの名前だけを使うようにするため
 */
package com.example.inference.service;

import com.example.inference.model.DriftMonitorState;
import com.example.inference.model.InferenceRequestState;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.model.VerdictStatus;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class InferenceMetrics {

  static final String METRIC_REQUESTS_TOTAL = "inference.requests.total";
  static final String METRIC_REQUEST_LATENCY = "inference.request.latency";
  static final String METRIC_REJECTIONS_TOTAL = "inference.rejections.total";
  static final String METRIC_LEDGER_WRITE_FAILURE_TOTAL = "inference.ledger.write.failure.total";
  static final String METRIC_LEDGER_OUTCOME_TOTAL = "inference.ledger.outcome.total";
  static final String METRIC_LEDGER_RETENTION_DELETED_TOTAL =
      "inference.ledger.retention.deleted.total";
  static final String METRIC_ARTIFACT_RELOAD_TOTAL = "inference.artifact.reload.total";
  static final String METRIC_DRIFT_EVALUATION_TOTAL = "inference.drift.evaluation.total";
  static final String METRIC_DRIFT_EVALUATION_DURATION = "inference.drift.evaluation.duration";
  static final String METRIC_DRIFT_SIGNAL_TOTAL = "inference.drift.signal.total";
  static final String METRIC_LEDGER_PENDING = "inference.ledger.pending";
  static final String METRIC_LEDGER_JOINED = "inference.ledger.joined";
  static final String METRIC_DRIFT_STATISTIC = "inference.drift.statistic";
  static final String METRIC_DRIFT_STATE = "inference.drift.state";
  static final String METRIC_ARTIFACT_LOADED = "inference.artifact.loaded";

  private final TelemetrySink sink;
  private final AtomicLong ledgerPending = new AtomicLong(0);
  private final AtomicLong ledgerJoined = new AtomicLong(0);
  private final AtomicReference<Double> driftStatistic = new AtomicReference<>(Double.NaN);
  private final AtomicInteger driftState = new AtomicInteger(DriftMonitorState.NORMAL.gaugeValue());
  private final AtomicInteger artifactLoaded = new AtomicInteger(0);

  public InferenceMetrics(TelemetrySink sink) {
    this.sink = sink;
    sink.declareCounter(METRIC_REQUESTS_TOTAL, "Prediction requests by terminal state");
    sink.declareHistogram(
        METRIC_REQUEST_LATENCY, "Prediction latency from receipt to terminal state");
    sink.declareCounter(METRIC_REJECTIONS_TOTAL, "Rejected prediction requests by reason");
    sink.declareCounter(
        METRIC_LEDGER_WRITE_FAILURE_TOTAL, "Ledger writes that failed and were dropped");
    sink.declareCounter(METRIC_LEDGER_OUTCOME_TOTAL, "Outcome updates by upsert result");
    sink.declareCounter(
        METRIC_LEDGER_RETENTION_DELETED_TOTAL, "Ledger pairs removed by retention compaction");
    sink.declareCounter(METRIC_ARTIFACT_RELOAD_TOTAL, "Scoring artifact reload attempts by result");
    sink.declareCounter(METRIC_DRIFT_EVALUATION_TOTAL, "Drift evaluation cycles by status");
    sink.declareHistogram(METRIC_DRIFT_EVALUATION_DURATION, "Drift evaluation cycle duration");
    sink.declareCounter(METRIC_DRIFT_SIGNAL_TOTAL, "Retraining signal decisions by result");
    sink.gauge(
        METRIC_LEDGER_PENDING,
        "Predictions in the last evaluated window still waiting for an outcome",
        ledgerPending,
        AtomicLong::get);
    sink.gauge(
        METRIC_LEDGER_JOINED,
        "Predictions in the last evaluated window joined with an outcome",
        ledgerJoined,
        AtomicLong::get);
    sink.gauge(
        METRIC_DRIFT_STATISTIC,
        "Last conclusive drift statistic",
        driftStatistic,
        reference -> reference.get());
    sink.gauge(
        METRIC_DRIFT_STATE,
        "Drift monitor state (0=normal, 1=drifting, 2=signaled)",
        driftState,
        AtomicInteger::get);
    sink.gauge(
        METRIC_ARTIFACT_LOADED,
        "Whether a scoring artifact is loaded (1) or not (0)",
        artifactLoaded,
        AtomicInteger::get);
  }

  /**
   * 役割: 推論リクエスト 1 件の計測スコープを開始する。
   * 動作: close 時に終端状態をタグにしてカウンタを 1 増やし、経過時間を 1 件記録する。
   * 前提: try-with-resources で使い、どの経路で抜けても close されること。
   */
  public RequestScope startRequest() {
    return new RequestScope(System.nanoTime());
  }

  public void recordRejection(String reason) {
    sink.increment(METRIC_REJECTIONS_TOTAL, "reason", reason);
  }

  public void recordLedgerWriteFailure(String kind) {
    sink.increment(METRIC_LEDGER_WRITE_FAILURE_TOTAL, "kind", kind);
  }

  public void recordOutcomeUpsert(OutcomeUpsertResult result) {
    sink.increment(METRIC_LEDGER_OUTCOME_TOTAL, "result", result.value());
  }

  public void recordRetentionDeleted(int deleted) {
    if (deleted > 0) {
      sink.incrementBy(METRIC_LEDGER_RETENTION_DELETED_TOTAL, deleted);
    }
  }

  public void recordArtifactReload(String result) {
    sink.increment(METRIC_ARTIFACT_RELOAD_TOTAL, "result", result);
  }

  public void updateArtifactLoaded(boolean loaded) {
    artifactLoaded.set(loaded ? 1 : 0);
  }

  public void recordDriftEvaluation(String status, Duration duration) {
    sink.increment(METRIC_DRIFT_EVALUATION_TOTAL, "status", status);
    sink.observe(METRIC_DRIFT_EVALUATION_DURATION, duration);
  }

  public void recordDriftVerdict(VerdictStatus status, Double statistic, Duration duration) {
    recordDriftEvaluation(status.value(), duration);
    if (statistic != null) {
      driftStatistic.set(statistic);
    }
  }

  public void recordDriftSignal(String result) {
    sink.increment(METRIC_DRIFT_SIGNAL_TOTAL, "result", result);
  }

  public void updateLedgerCounts(long pending, long joined) {
    ledgerPending.set(Math.max(0, pending));
    ledgerJoined.set(Math.max(0, joined));
  }

  public void updateDriftState(DriftMonitorState state) {
    driftState.set(state.gaugeValue());
  }

  public final class RequestScope implements AutoCloseable {

    private final long startedAtNanos;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile InferenceRequestState state = InferenceRequestState.RECEIVED;

    private RequestScope(long startedAtNanos) {
      this.startedAtNanos = startedAtNanos;
    }

    public void advance(InferenceRequestState next) {
      state = next;
    }

    public void reject(String reason) {
      state = InferenceRequestState.REJECTED;
      recordRejection(reason);
    }

    public void fail() {
      state = InferenceRequestState.FAILED;
    }

    public InferenceRequestState state() {
      return state;
    }

    @Override
    public void close() {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
      // 想定外の例外で途中状態のまま抜けた場合はサーバ側失敗として数える
      final InferenceRequestState terminal =
          state.isTerminal() ? state : InferenceRequestState.FAILED;
      state = terminal;
      final Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAtNanos);
      sink.increment(METRIC_REQUESTS_TOTAL, "outcome", terminal.value());
      sink.observe(METRIC_REQUEST_LATENCY, elapsed, "outcome", terminal.value());
    }
  }
}
