/*
 * どこで: Inference ledger retention サービス
 * 何を: 保持期間を過ぎた予測/実測の組を削除する
 * なぜ: 長時間稼働でも ledger とジャーナルが無制限に伸びないようにするため
 */
package com.example.inference.service;

import com.example.inference.config.InferenceLedgerRetentionProperties;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LedgerRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(LedgerRetentionService.class);

  private final OutcomeLedgerService ledgerService;
  private final InferenceLedgerRetentionProperties properties;
  private final InferenceMetrics metrics;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(properties.horizon());
    final int deleted = ledgerService.compact(threshold);
    metrics.recordRetentionDeleted(deleted);
    logger.info(
        "ledger retention cleanup deleted pairs={} threshold={} pending={}",
        deleted,
        threshold,
        ledgerService.countPending());
    return deleted;
  }
}
