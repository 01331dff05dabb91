/*
 * どこで: Inference repository 層
 * 何を: request id をキーに予測と実測の組を不変エントリとして保持する
 * なぜ: 追記は request id 単位の原子的更新だけで済ませ、読み手を待たせないため
 */
package com.example.inference.repository;

import com.example.inference.model.LedgerPair;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.model.PredictionRecord;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryOutcomeLedgerRepository implements OutcomeLedgerRepository {

  // 予測が無く実測だけのエントリは orphan として同じ map に置く
  private record Slot(PredictionRecord prediction, OutcomeUpdate outcome) {

    boolean hasPrediction() {
      return prediction != null;
    }

    LedgerPair toPair() {
      return new LedgerPair(prediction, outcome);
    }

    Instant sortKey() {
      return hasPrediction() ? prediction.predictedAt() : outcome.observedAt();
    }
  }

  private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();

  @Override
  public boolean savePrediction(PredictionRecord record) {
    final AtomicBoolean stored = new AtomicBoolean(false);
    slots.compute(
        record.requestId(),
        (requestId, existing) -> {
          if (existing == null) {
            stored.set(true);
            return new Slot(record, null);
          }
          if (existing.hasPrediction()) {
            return existing;
          }
          stored.set(true);
          return new Slot(record, existing.outcome());
        });
    return stored.get();
  }

  @Override
  public OutcomeUpsertResult upsertOutcome(OutcomeUpdate update) {
    final AtomicReference<OutcomeUpsertResult> result = new AtomicReference<>();
    slots.compute(
        update.requestId(),
        (requestId, existing) -> {
          if (existing == null) {
            result.set(OutcomeUpsertResult.ORPHANED);
            return new Slot(null, update);
          }
          if (existing.outcome() == null) {
            result.set(OutcomeUpsertResult.JOINED);
            return new Slot(existing.prediction(), update);
          }
          // 先に書かれた実測を正とし、再配信では上書きしない
          result.set(
              existing.outcome().samePayloadAs(update)
                  ? OutcomeUpsertResult.DUPLICATE
                  : OutcomeUpsertResult.CONFLICT);
          return existing;
        });
    return result.get();
  }

  @Override
  public List<LedgerPair> findByPredictedAtBetween(Instant start, Instant end) {
    return slots.values().stream()
        .filter(Slot::hasPrediction)
        .filter(
            slot ->
                !slot.prediction().predictedAt().isBefore(start)
                    && slot.prediction().predictedAt().isBefore(end))
        .sorted(Comparator.comparing(Slot::sortKey))
        .map(Slot::toPair)
        .toList();
  }

  @Override
  public Optional<LedgerPair> findByRequestId(String requestId) {
    final Slot slot = slots.get(requestId);
    if (slot == null || !slot.hasPrediction()) {
      return Optional.empty();
    }
    return Optional.of(slot.toPair());
  }

  @Override
  public List<LedgerPair> findAllPairs() {
    return slots.values().stream()
        .filter(Slot::hasPrediction)
        .sorted(Comparator.comparing(Slot::sortKey))
        .map(Slot::toPair)
        .toList();
  }

  @Override
  public List<OutcomeUpdate> findOrphanOutcomes() {
    return slots.values().stream()
        .filter(slot -> !slot.hasPrediction())
        .sorted(Comparator.comparing(Slot::sortKey))
        .map(Slot::outcome)
        .toList();
  }

  @Override
  public long countPending() {
    return slots.values().stream()
        .filter(slot -> slot.hasPrediction() && slot.outcome() == null)
        .count();
  }

  @Override
  public int deleteOlderThan(Instant threshold) {
    int deleted = 0;
    for (Map.Entry<String, Slot> entry : slots.entrySet()) {
      final Slot slot = entry.getValue();
      // 判定後に結合された組は remove(key, value) が失敗するので残る
      if (slot.sortKey().isBefore(threshold) && slots.remove(entry.getKey(), slot)) {
        deleted++;
      }
    }
    return deleted;
  }
}
