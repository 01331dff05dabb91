/*
 * どこで: Inference ledger retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れの組を落とすため
 */
package com.example.inference.worker;

import com.example.inference.service.LedgerRetentionService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "inference.ledger.retention.enabled", havingValue = "true")
public class LedgerRetentionWorker {

  private static final Logger logger = LoggerFactory.getLogger(LedgerRetentionWorker.class);

  private final LedgerRetentionService retentionService;

  @Scheduled(fixedDelayString = "${inference.ledger.retention.cleanup-interval}")
  public void run() {
    try {
      retentionService.cleanup();
    } catch (RuntimeException ex) {
      logger.warn("ledger retention cleanup failed", ex);
    }
  }
}
