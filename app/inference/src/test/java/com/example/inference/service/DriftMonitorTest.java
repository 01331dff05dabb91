/*
 * どこで: Inference drift 監視のユニットテスト
 * 何を: 標本不足・閾値超過・cooldown 抑止・回復・送信失敗・多重実行防止を検証する
 * なぜ: 1 つの drift エピソードで再学習シグナルが 1 回だけ送られることを保証するため
 */
package com.example.inference.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.inference.MutableClock;
import com.example.inference.TestTelemetry;
import com.example.inference.api.DriftEvaluationInProgressException;
import com.example.inference.artifact.ScoringArtifactHolder;
import com.example.inference.config.InferenceDriftProperties;
import com.example.inference.model.DriftMonitorState;
import com.example.inference.model.DriftVerdict;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.PredictionRecord;
import com.example.inference.model.VerdictStatus;
import com.example.inference.repository.InMemoryOutcomeLedgerRepository;
import com.example.inference.repository.NoopLedgerJournal;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.SyncTaskExecutor;

class DriftMonitorTest {

  private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
  private static final InferenceDriftProperties PROPERTIES =
      new InferenceDriftProperties(
          true,
          Duration.ofMinutes(5),
          Duration.ofDays(30),
          Duration.ofDays(7),
          10,
          0.1,
          Duration.ofHours(24),
          PositiveRateGapStatistic.NAME);

  private MutableClock clock;
  private SimpleMeterRegistry registry;
  private OutcomeLedgerService ledgerService;
  private RetrainingTrigger trigger;
  private DriftMonitor monitor;
  private ExecutorService executor;
  private int sequence;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    registry = new SimpleMeterRegistry();
    final InferenceMetrics metrics = TestTelemetry.metrics(registry);
    ledgerService =
        new OutcomeLedgerService(
            new InMemoryOutcomeLedgerRepository(),
            new NoopLedgerJournal(),
            metrics,
            new SyncTaskExecutor());
    trigger = mock(RetrainingTrigger.class);
    monitor = newMonitor(ledgerService, PROPERTIES, metrics);
  }

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void predictionsWithoutOutcomesAreInconclusive() {
    addPairs(100, 1, null);

    final DriftVerdict verdict = monitor.evaluateNow();

    assertThat(verdict.status()).isEqualTo(VerdictStatus.INCONCLUSIVE);
    assertThat(verdict.statistic()).isNull();
    assertThat(verdict.sampleSize()).isZero();
    assertThat(verdict.pendingCount()).isEqualTo(100);
    assertThat(verdict.triggered()).isFalse();
    assertThat(monitor.snapshot().state()).isEqualTo(DriftMonitorState.NORMAL);
    verify(trigger, never()).signal(any(), anyString());
  }

  @Test
  void withinThresholdStaysNormal() {
    addPairs(20, 1, 1);

    final DriftVerdict verdict = monitor.evaluateNow();

    assertThat(verdict.status()).isEqualTo(VerdictStatus.WITHIN_THRESHOLD);
    assertThat(verdict.statistic()).isZero();
    assertThat(verdict.stateAfter()).isEqualTo(DriftMonitorState.NORMAL);
    verify(trigger, never()).signal(any(), anyString());
  }

  @Test
  void breachSignalsOnceAndCooldownSuppressesRepeats() {
    addPairs(20, 1, 0);

    final DriftVerdict first = monitor.evaluateNow();

    assertThat(first.status()).isEqualTo(VerdictStatus.BREACHED);
    assertThat(first.statistic()).isEqualTo(1.0);
    assertThat(first.signaled()).isTrue();
    assertThat(first.stateAfter()).isEqualTo(DriftMonitorState.SIGNALED);
    assertThat(monitor.snapshot().cooldownUntil()).isEqualTo(START.plus(Duration.ofHours(24)));
    final ArgumentCaptor<DriftVerdict> captor = ArgumentCaptor.forClass(DriftVerdict.class);
    verify(trigger).signal(captor.capture(), eq("none"));
    assertThat(captor.getValue().sampleSize()).isEqualTo(20);
    assertThat(captor.getValue().windowEnd()).isEqualTo(START);

    clock.advance(Duration.ofHours(1));
    final DriftVerdict second = monitor.evaluateNow();

    assertThat(second.status()).isEqualTo(VerdictStatus.BREACHED);
    assertThat(second.signaled()).isFalse();
    assertThat(second.stateAfter()).isEqualTo(DriftMonitorState.SIGNALED);
    verify(trigger, times(1)).signal(any(), anyString());
    assertThat(signals("sent")).isEqualTo(1.0);
    assertThat(signals("suppressed")).isEqualTo(1.0);
  }

  @Test
  void withinThresholdDuringCooldownKeepsSignaledState() {
    addPairs(20, 1, 0);
    monitor.evaluateNow();

    addPairs(200, 1, 1);
    clock.advance(Duration.ofHours(1));
    final DriftVerdict verdict = monitor.evaluateNow();

    assertThat(verdict.status()).isEqualTo(VerdictStatus.WITHIN_THRESHOLD);
    assertThat(verdict.stateAfter()).isEqualTo(DriftMonitorState.SIGNALED);
  }

  @Test
  void recoveryAfterCooldownReturnsToNormalAndNextBreachSignalsAgain() {
    addPairs(20, 1, 0);
    monitor.evaluateNow();

    // 20 / 220 < 0.1 になるまで一致する組を足す
    addPairs(200, 1, 1);
    clock.advance(Duration.ofHours(25));
    final DriftVerdict recovered = monitor.evaluateNow();

    assertThat(recovered.status()).isEqualTo(VerdictStatus.WITHIN_THRESHOLD);
    assertThat(recovered.stateAfter()).isEqualTo(DriftMonitorState.NORMAL);

    addPairs(100, 1, 0);
    clock.advance(Duration.ofHours(1));
    final DriftVerdict rebreached = monitor.evaluateNow();

    assertThat(rebreached.signaled()).isTrue();
    assertThat(rebreached.stateAfter()).isEqualTo(DriftMonitorState.SIGNALED);
    verify(trigger, times(2)).signal(any(), anyString());
  }

  @Test
  void breachAfterCooldownExpiresSignalsAgain() {
    addPairs(20, 1, 0);
    monitor.evaluateNow();

    clock.advance(Duration.ofHours(24));
    final DriftVerdict verdict = monitor.evaluateNow();

    assertThat(verdict.signaled()).isTrue();
    assertThat(monitor.snapshot().cooldownUntil()).isEqualTo(START.plus(Duration.ofHours(48)));
    verify(trigger, times(2)).signal(any(), anyString());
  }

  @Test
  void publishFailureStaysDriftingAndRetriesOnNextBreach() {
    addPairs(20, 1, 0);
    doThrow(new RetrainingSignalException("unreachable", new IOException("unreachable")))
        .doNothing()
        .when(trigger)
        .signal(any(), anyString());

    final DriftVerdict failed = monitor.evaluateNow();

    assertThat(failed.signaled()).isFalse();
    assertThat(failed.stateAfter()).isEqualTo(DriftMonitorState.DRIFTING);
    assertThat(monitor.snapshot().cooldownUntil()).isNull();
    assertThat(signals("failed")).isEqualTo(1.0);

    clock.advance(Duration.ofMinutes(5));
    final DriftVerdict retried = monitor.evaluateNow();

    assertThat(retried.signaled()).isTrue();
    assertThat(retried.stateAfter()).isEqualTo(DriftMonitorState.SIGNALED);
  }

  @Test
  void outcomesOutsideOutcomeWindowAreNotSamples() {
    final Instant predictedAt = START.minus(Duration.ofDays(10));
    for (int i = 0; i < 20; i++) {
      final String requestId = "late-" + i;
      ledgerService.recordPredictionAsync(
          new PredictionRecord(requestId, predictedAt, "hash", 1, 0.9, "v1"));
      ledgerService.recordOutcome(new OutcomeUpdate(requestId, 0, START));
    }

    final DriftVerdict verdict = monitor.evaluateNow();

    assertThat(verdict.status()).isEqualTo(VerdictStatus.INCONCLUSIVE);
    assertThat(verdict.pendingCount()).isEqualTo(20);
  }

  @Test
  void overlappingCyclesAreRejectedWhileOneIsRunning() throws Exception {
    addPairs(20, 1, 0);
    final CountDownLatch signalling = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    doAnswer(
            invocation -> {
              signalling.countDown();
              assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
              return null;
            })
        .when(trigger)
        .signal(any(), anyString());
    executor = Executors.newSingleThreadExecutor();

    final Future<Optional<DriftVerdict>> running = executor.submit(monitor::runScheduledCycle);
    assertThat(signalling.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(monitor.isRunning()).isTrue();
    assertThatThrownBy(monitor::evaluateNow)
        .isInstanceOf(DriftEvaluationInProgressException.class);
    assertThat(monitor.runScheduledCycle()).isEmpty();
    assertThat(evaluations("skipped")).isEqualTo(1.0);

    release.countDown();
    final Optional<DriftVerdict> finished = running.get(5, TimeUnit.SECONDS);
    assertThat(finished).isPresent();
    assertThat(finished.get().signaled()).isTrue();
    assertThat(monitor.isRunning()).isFalse();
  }

  @Test
  void scheduledCycleFailureIsRecordedAndReleasesGuard() {
    final OutcomeLedgerService failingLedger = mock(OutcomeLedgerService.class);
    when(failingLedger.query(any(), any())).thenThrow(new IllegalStateException("boom"));
    final DriftMonitor failing =
        newMonitor(failingLedger, PROPERTIES, TestTelemetry.metrics(new SimpleMeterRegistry()));

    assertThat(failing.runScheduledCycle()).isEmpty();
    assertThat(failing.isRunning()).isFalse();
    assertThat(failing.latestVerdict()).isEmpty();
  }

  @Test
  void unknownStatisticNameFailsAtConstruction() {
    final InferenceDriftProperties unknown =
        new InferenceDriftProperties(
            true,
            Duration.ofMinutes(5),
            Duration.ofDays(30),
            Duration.ofDays(7),
            10,
            0.1,
            Duration.ofHours(24),
            "psi");

    assertThatThrownBy(
            () ->
                newMonitor(
                    ledgerService, unknown, TestTelemetry.metrics(new SimpleMeterRegistry())))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("psi");
  }

  @Test
  void brierScoreCanBeSelected() {
    final InferenceDriftProperties brier =
        new InferenceDriftProperties(
            true,
            Duration.ofMinutes(5),
            Duration.ofDays(30),
            Duration.ofDays(7),
            10,
            0.5,
            Duration.ofHours(24),
            BrierScoreStatistic.NAME);
    final DriftMonitor brierMonitor =
        newMonitor(ledgerService, brier, TestTelemetry.metrics(new SimpleMeterRegistry()));
    addPairs(20, 1, 1);

    final DriftVerdict verdict = brierMonitor.evaluateNow();

    assertThat(brierMonitor.statisticName()).isEqualTo("brier-score");
    assertThat(verdict.statisticName()).isEqualTo("brier-score");
    assertThat(verdict.status()).isEqualTo(VerdictStatus.WITHIN_THRESHOLD);
  }

  private DriftMonitor newMonitor(
      OutcomeLedgerService ledger, InferenceDriftProperties properties, InferenceMetrics metrics) {
    return new DriftMonitor(
        ledger,
        List.of(new PositiveRateGapStatistic(), new BrierScoreStatistic()),
        trigger,
        mock(ScoringArtifactHolder.class),
        properties,
        metrics,
        clock);
  }

  // 現在時刻の 1 分前に予測し、realized が null でなければ直後に実測を付ける
  private void addPairs(int count, int label, Integer realized) {
    final Instant predictedAt = clock.instant().minus(Duration.ofMinutes(1));
    for (int i = 0; i < count; i++) {
      final String requestId = "req-" + sequence++;
      ledgerService.recordPredictionAsync(
          new PredictionRecord(requestId, predictedAt, "hash", label, 0.9, "v1"));
      if (realized != null) {
        ledgerService.recordOutcome(new OutcomeUpdate(requestId, realized, clock.instant()));
      }
    }
  }

  private double signals(String result) {
    final Counter counter =
        registry.find("inference.drift.signal.total").tag("result", result).counter();
    return counter == null ? 0.0 : counter.count();
  }

  private double evaluations(String status) {
    final Counter counter =
        registry.find("inference.drift.evaluation.total").tag("status", status).counter();
    return counter == null ? 0.0 : counter.count();
  }
}
