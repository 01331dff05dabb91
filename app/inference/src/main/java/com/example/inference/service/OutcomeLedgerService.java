/*
 * どこで: Inference サービス層
 * 何を: 予測記録と実測ラベルを ledger へ追記し、窓単位の参照と compaction を提供する
 * なぜ: 推論応答をブロックせずに予測を残し、後から届く実測と request id で結合するため
 */
package com.example.inference.service;

import com.example.inference.config.LedgerExecutorConfig;
import com.example.inference.model.LedgerPair;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.model.PredictionRecord;
import com.example.inference.repository.JournalEntry;
import com.example.inference.repository.LedgerJournal;
import com.example.inference.repository.OutcomeLedgerRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PostConstruct;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "executor と repository は Spring 管理の共有コンポーネントのため")
public class OutcomeLedgerService {

  private static final Logger logger = LoggerFactory.getLogger(OutcomeLedgerService.class);

  private final OutcomeLedgerRepository repository;
  private final LedgerJournal journal;
  private final InferenceMetrics metrics;
  private final TaskExecutor ledgerExecutor;

  public OutcomeLedgerService(
      OutcomeLedgerRepository repository,
      LedgerJournal journal,
      InferenceMetrics metrics,
      @Qualifier(LedgerExecutorConfig.LEDGER_EXECUTOR) TaskExecutor ledgerExecutor) {
    this.repository = repository;
    this.journal = journal;
    this.metrics = metrics;
    this.ledgerExecutor = ledgerExecutor;
  }

  @PostConstruct
  public void restore() {
    final int replayed = journal.replay(this::applyReplayed);
    if (replayed > 0) {
      logger.info(
          "outcome ledger restored entries={} pending={}", replayed, repository.countPending());
    }
  }

  /**
   * 役割: 予測記録の追記を専用 executor へ投げて即座に戻る。
   * 動作: キュー満杯や書き込み失敗はログとメトリクスに残すだけで、呼び出し側へは伝えない。
   * 前提: クライアント接続が切れても投入済みの追記は完了する。
   */
  public void recordPredictionAsync(PredictionRecord record) {
    try {
      ledgerExecutor.execute(() -> recordPrediction(record));
    } catch (TaskRejectedException ex) {
      metrics.recordLedgerWriteFailure("rejected");
      logger.warn("ledger append rejected requestId={}", record.requestId(), ex);
    }
  }

  void recordPrediction(PredictionRecord record) {
    try {
      if (!repository.savePrediction(record)) {
        // 応答済みの予測が ledger に残らないので /metrics から追えるよう計数する
        metrics.recordLedgerWriteFailure("duplicate");
        logger.warn("duplicate prediction ignored requestId={}", record.requestId());
        return;
      }
      journal.append(JournalEntry.prediction(record));
    } catch (RuntimeException ex) {
      metrics.recordLedgerWriteFailure("prediction");
      logger.warn("ledger prediction write failed requestId={}", record.requestId(), ex);
    }
  }

  /**
   * 役割: 実測ラベルを request id で冪等に upsert する。
   * 動作: 結合/保留の場合のみジャーナルへ追記する。同内容の再配信は DUPLICATE、
   *       ラベル違いは CONFLICT で、どちらも既存を変えない。
   * 前提: ジャーナル書き込み失敗は計数してログに残し、メモリ上の結果を返す。
   */
  public OutcomeUpsertResult recordOutcome(OutcomeUpdate update) {
    final OutcomeUpsertResult result = repository.upsertOutcome(update);
    if (result == OutcomeUpsertResult.JOINED || result == OutcomeUpsertResult.ORPHANED) {
      try {
        journal.append(JournalEntry.outcome(update));
      } catch (RuntimeException ex) {
        metrics.recordLedgerWriteFailure("outcome");
        logger.warn("ledger outcome write failed requestId={}", update.requestId(), ex);
      }
    }
    if (result == OutcomeUpsertResult.CONFLICT) {
      logger.warn(
          "outcome conflict kept first label requestId={} rejectedLabel={}",
          update.requestId(),
          update.realizedLabel());
    }
    metrics.recordOutcomeUpsert(result);
    return result;
  }

  public List<LedgerPair> query(Instant start, Instant end) {
    return repository.findByPredictedAtBetween(start, end);
  }

  public long countPending() {
    return repository.countPending();
  }

  /**
   * 役割: threshold より古い組と保留中の実測を落とし、ジャーナルを現在の内容で書き換える。
   * 動作: 削除が 0 件ならジャーナルには触れない。
   * 前提: 書き換え中の追記はジャーナル側で待たされ、書き換え後の末尾に残る。
   */
  public int compact(Instant threshold) {
    final int deleted = repository.deleteOlderThan(threshold);
    if (deleted > 0) {
      journal.rewrite(this::snapshotEntries);
    }
    return deleted;
  }

  private List<JournalEntry> snapshotEntries() {
    final List<JournalEntry> entries = new ArrayList<>();
    for (LedgerPair pair : repository.findAllPairs()) {
      entries.add(JournalEntry.prediction(pair.prediction()));
      pair.outcome().ifPresent(outcome -> entries.add(JournalEntry.outcome(outcome)));
    }
    for (OutcomeUpdate orphan : repository.findOrphanOutcomes()) {
      entries.add(JournalEntry.outcome(orphan));
    }
    return entries;
  }

  private void applyReplayed(JournalEntry entry) {
    try {
      if (entry.isPrediction()) {
        repository.savePrediction(entry.toPrediction());
      } else if (entry.isOutcome()) {
        repository.upsertOutcome(entry.toOutcome());
      } else {
        logger.warn("ledger journal entry has unknown type={}", entry.type());
      }
    } catch (IllegalArgumentException ex) {
      logger.warn("ledger journal entry skipped requestId={}", entry.requestId(), ex);
    }
  }
}
