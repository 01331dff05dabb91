/*
 * どこで: Inference drift 監視
 * 何を: 直近の窓で結合済みの組を集計して drift を判定し、cooldown 付きで再学習シグナルを送る
 * なぜ: 閾値超過が続いても 1 つの drift エピソードでシグナルを連打しないようにするため
 */
package com.example.inference.service;

import com.example.inference.api.DriftEvaluationInProgressException;
import com.example.inference.artifact.ScoringArtifact;
import com.example.inference.artifact.ScoringArtifactHolder;
import com.example.inference.config.InferenceDriftProperties;
import com.example.inference.model.DriftMonitorState;
import com.example.inference.model.DriftVerdict;
import com.example.inference.model.LedgerPair;
import com.example.inference.model.VerdictStatus;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class DriftMonitor {

  private static final Logger logger = LoggerFactory.getLogger(DriftMonitor.class);

  static final String SIGNAL_SENT = "sent";
  static final String SIGNAL_SUPPRESSED = "suppressed";
  static final String SIGNAL_FAILED = "failed";
  static final String EVALUATION_SKIPPED = "skipped";
  static final String EVALUATION_ERROR = "error";

  public record MonitorSnapshot(
      DriftMonitorState state, Instant cooldownUntil, Optional<DriftVerdict> latestVerdict) {}

  private final OutcomeLedgerService ledgerService;
  private final DriftStatistic statistic;
  private final RetrainingTrigger retrainingTrigger;
  private final ScoringArtifactHolder artifactHolder;
  private final InferenceDriftProperties properties;
  private final InferenceMetrics metrics;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicReference<DriftVerdict> latestVerdict = new AtomicReference<>();
  // 状態と cooldown は running を取ったスレッドだけが書き換える
  private volatile DriftMonitorState state = DriftMonitorState.NORMAL;
  private volatile Instant cooldownUntil;

  public DriftMonitor(
      OutcomeLedgerService ledgerService,
      List<DriftStatistic> statistics,
      RetrainingTrigger retrainingTrigger,
      ScoringArtifactHolder artifactHolder,
      InferenceDriftProperties properties,
      InferenceMetrics metrics,
      Clock clock) {
    this.ledgerService = ledgerService;
    this.statistic = selectStatistic(statistics, properties.statistic());
    this.retrainingTrigger = retrainingTrigger;
    this.artifactHolder = artifactHolder;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    metrics.updateDriftState(state);
  }

  /**
   * 役割: スケジューラから 1 サイクル実行する。
   * 動作: 実行中のサイクルがあれば重ねずに skip し、評価中の例外はログと計数を残してサイクルを終える。
   * 前提: 例外はスケジューラへ伝えず、次のサイクルは通常どおり動く。
   */
  public Optional<DriftVerdict> runScheduledCycle() {
    if (!running.compareAndSet(false, true)) {
      metrics.recordDriftEvaluation(EVALUATION_SKIPPED, Duration.ZERO);
      logger.info("drift evaluation skipped because a previous cycle is still running");
      return Optional.empty();
    }
    final long startedAt = System.nanoTime();
    try {
      return Optional.of(evaluate(startedAt));
    } catch (RuntimeException ex) {
      metrics.recordDriftEvaluation(
          EVALUATION_ERROR, Duration.ofNanos(System.nanoTime() - startedAt));
      logger.warn("drift evaluation failed; cycle skipped", ex);
      return Optional.empty();
    } finally {
      running.set(false);
    }
  }

  /**
   * 役割: 管理 API から即時に 1 サイクル実行する。
   * 動作: 実行中なら DriftEvaluationInProgressException。評価中の例外は呼び出し側へ伝える。
   * 前提: 状態遷移とシグナル送信はスケジュール実行と同じ規則に従う。
   */
  public DriftVerdict evaluateNow() {
    if (!running.compareAndSet(false, true)) {
      throw new DriftEvaluationInProgressException();
    }
    try {
      return evaluate(System.nanoTime());
    } finally {
      running.set(false);
    }
  }

  public MonitorSnapshot snapshot() {
    return new MonitorSnapshot(state, cooldownUntil, Optional.ofNullable(latestVerdict.get()));
  }

  public Optional<DriftVerdict> latestVerdict() {
    return Optional.ofNullable(latestVerdict.get());
  }

  public String statisticName() {
    return statistic.name();
  }

  @VisibleForTesting
  boolean isRunning() {
    return running.get();
  }

  private DriftVerdict evaluate(long startedAtNanos) {
    final Instant now = Instant.now(clock);
    final Instant windowStart = now.minus(properties.window());
    final List<LedgerPair> pairs = ledgerService.query(windowStart, now);
    final List<LedgerPair> samples =
        pairs.stream().filter(pair -> pair.isJoinedWithin(properties.outcomeWindow())).toList();
    final int pending = pairs.size() - samples.size();
    metrics.updateLedgerCounts(pending, samples.size());

    final DriftVerdict verdict;
    if (samples.size() < properties.minSampleSize()) {
      // 標本不足は正常系。状態は変えない
      verdict =
          verdict(windowStart, now, null, samples.size(), pending, VerdictStatus.INCONCLUSIVE, false);
    } else {
      final double value = statistic.compute(samples);
      final boolean breached = value > properties.threshold();
      final boolean signaled = transition(breached, now, value, windowStart, samples.size(), pending);
      verdict =
          verdict(
              windowStart,
              now,
              value,
              samples.size(),
              pending,
              breached ? VerdictStatus.BREACHED : VerdictStatus.WITHIN_THRESHOLD,
              signaled);
    }
    latestVerdict.set(verdict);
    metrics.updateDriftState(state);
    metrics.recordDriftVerdict(
        verdict.status(), verdict.statistic(), Duration.ofNanos(System.nanoTime() - startedAtNanos));
    logger.info(
        "drift evaluation finished status={} statistic={} value={} threshold={} samples={}"
            + " pending={} state={} signaled={}",
        verdict.status().value(),
        verdict.statisticName(),
        verdict.statistic(),
        verdict.threshold(),
        verdict.sampleSize(),
        verdict.pendingCount(),
        verdict.stateAfter(),
        verdict.signaled());
    return verdict;
  }

  /**
   * 役割: 判定結果から状態を進め、必要ならシグナルを送る。
   * 動作: cooldown 中の SIGNALED は判定に関わらず維持する。cooldown は SIGNALED の間しか残らないので、
   *       それ以外の状態で超過なら送信を試み、
   *       成功で SIGNALED、失敗で DRIFTING に留めて次の超過で再送する。超過していなければ NORMAL。
   * 前提: running を保持したスレッドからのみ呼ばれる。
   */
  private boolean transition(
      boolean breached,
      Instant now,
      double value,
      Instant windowStart,
      int sampleSize,
      int pending) {
    final boolean cooldownActive = cooldownUntil != null && now.isBefore(cooldownUntil);
    if (state == DriftMonitorState.SIGNALED && cooldownActive) {
      if (breached) {
        metrics.recordDriftSignal(SIGNAL_SUPPRESSED);
        logger.info("drift breach within cooldown; signal suppressed cooldownUntil={}", cooldownUntil);
      }
      return false;
    }
    if (!breached) {
      if (state != DriftMonitorState.NORMAL) {
        logger.info("drift recovered state={} -> {}", state, DriftMonitorState.NORMAL);
      }
      state = DriftMonitorState.NORMAL;
      return false;
    }
    state = DriftMonitorState.DRIFTING;
    final DriftVerdict breachVerdict =
        verdict(windowStart, now, value, sampleSize, pending, VerdictStatus.BREACHED, true);
    try {
      retrainingTrigger.signal(breachVerdict, currentModelVersion());
    } catch (RuntimeException ex) {
      metrics.recordDriftSignal(SIGNAL_FAILED);
      logger.warn("retraining signal failed; staying {}", state, ex);
      return false;
    }
    state = DriftMonitorState.SIGNALED;
    cooldownUntil = now.plus(properties.cooldown());
    metrics.recordDriftSignal(SIGNAL_SENT);
    logger.warn(
        "retraining signal sent statistic={} value={} cooldownUntil={}",
        statistic.name(),
        value,
        cooldownUntil);
    return true;
  }

  private DriftVerdict verdict(
      Instant windowStart,
      Instant windowEnd,
      Double value,
      int sampleSize,
      int pending,
      VerdictStatus status,
      boolean signaled) {
    return new DriftVerdict(
        windowStart,
        windowEnd,
        statistic.name(),
        value,
        properties.threshold(),
        sampleSize,
        pending,
        status,
        signaled,
        state,
        windowEnd);
  }

  private String currentModelVersion() {
    return artifactHolder.current().map(ScoringArtifact::modelVersion).orElse("none");
  }

  private static DriftStatistic selectStatistic(List<DriftStatistic> statistics, String name) {
    return statistics.stream()
        .filter(candidate -> candidate.name().equals(name))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "unknown inference.drift.statistic: "
                        + name
                        + " (available: "
                        + statistics.stream().map(DriftStatistic::name).toList()
                        + ")"));
  }
}
