/*
 * どこで: Inference drift 監視ワーカー
 * 何を: 固定間隔で drift 評価サイクルを起動する
 * なぜ: リクエストに依存せず、一定間隔で ledger を集計するため
 */
package com.example.inference.worker;

import com.example.inference.service.DriftMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "inference.drift.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class DriftMonitorWorker {

  private final DriftMonitor driftMonitor;

  @Scheduled(
      fixedRateString = "${inference.drift.evaluation-interval}",
      initialDelayString = "${inference.drift.evaluation-interval}")
  public void run() {
    // 固定レートなので、前のサイクルが長引いた場合の重複はモニタ側で skip する
    driftMonitor.runScheduledCycle();
  }
}
